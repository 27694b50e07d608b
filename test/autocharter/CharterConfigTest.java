package autocharter;

import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.assertj.core.api.Assertions.*;

class CharterConfigTest {

    @Test
    @DisplayName("Should start from the documented defaults")
    void testDefaults() throws Exception {
        CharterConfig config = CharterConfig.defaults();

        config.validate();
        assertThat(config.getBpmOverride()).isNull();
        assertThat(config.getGridDivision()).isEqualTo(4);
        assertThat(config.getSustainThreshold()).isEqualTo(0.5f);
        assertThat(config.getMinHoldDuration()).isEqualTo(0.25f);
        assertThat(config.getLaneStrategy()).isEqualTo(LaneStrategy.SEQUENTIAL);
        assertThat(config.getRandomSeed()).isEqualTo(1L);
        assertThat(config.getWindowSize()).isEqualTo(2048);
        assertThat(config.getHopSize()).isEqualTo(512);
    }

    @Test
    @DisplayName("Should copy every setting through toBuilder")
    void testToBuilder() {
        CharterConfig config = CharterConfig.builder().bpmOverride(95f).gridDivision(3).laneStrategy(LaneStrategy.RANDOM).randomSeed(9L).build();

        CharterConfig copy = config.toBuilder().build();

        assertThat(copy.getBpmOverride()).isEqualTo(95f);
        assertThat(copy.getGridDivision()).isEqualTo(3);
        assertThat(copy.getLaneStrategy()).isEqualTo(LaneStrategy.RANDOM);
        assertThat(copy.getRandomSeed()).isEqualTo(9L);
    }

    static Stream<Arguments> invalidConfigs() {
        return Stream.of(
                Arguments.of("grid 0", CharterConfig.builder().gridDivision(0)),
                Arguments.of("negative bpm", CharterConfig.builder().bpmOverride(-10f)),
                Arguments.of("threshold above 1", CharterConfig.builder().sustainThreshold(1.2f)),
                Arguments.of("negative threshold", CharterConfig.builder().sustainThreshold(-0.1f)),
                Arguments.of("zero min hold", CharterConfig.builder().minHoldDuration(0f)),
                Arguments.of("no lane strategy", CharterConfig.builder().laneStrategy(null)),
                Arguments.of("window not a power of two", CharterConfig.builder().windowSize(1000)),
                Arguments.of("hop as large as window", CharterConfig.builder().hopSize(2048)),
                Arguments.of("even smoothing", CharterConfig.builder().smoothingWidth(4)),
                Arguments.of("narrow tempo range", CharterConfig.builder().tempoRange(100f, 150f)),
                Arguments.of("default outside range", CharterConfig.builder().defaultBpm(300f)));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("invalidConfigs")
    @DisplayName("Should reject invalid settings")
    void testInvalid(String name, CharterConfig.Builder builder) {
        CharterConfig config = builder.build();

        assertThatThrownBy(config::validate)
                .isInstanceOf(ChartingException.class)
                .extracting(e -> ((ChartingException) e).getKind())
                .isEqualTo(ChartingException.Kind.INVALID_CONFIG);
    }
}
