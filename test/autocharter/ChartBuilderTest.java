package autocharter;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ChartBuilderTest {

    private static ChartBuilder builder() {
        return new ChartBuilder()
                .songId("song")
                .instrument("drums")
                .difficulty(Difficulty.NORMAL)
                .bpm(120f)
                .clock(Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should order notes by time, then lane")
    void testOrdering() {
        Chart chart = builder()
                .notes(Arrays.asList(new Note(1f, 2), new Note(0.5f, 3), new Note(1f, 0, 0.5f)))
                .build();

        assertThat(chart.getNotes()).containsExactly(new Note(0.5f, 3), new Note(1f, 0, 0.5f), new Note(1f, 2));
        assertThat(chart.getColumnCount()).isEqualTo(4);
        assertThat(chart.getGeneratedAt()).isEqualTo(1_700_000_000L);
        assertThat(chart.holdCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should default the column count to the difficulty's")
    void testExpertColumns() {
        Chart chart = builder().difficulty(Difficulty.EXPERT).notes(Arrays.asList(new Note(0f, 4))).build();

        assertThat(chart.getColumnCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should reject duplicate notes")
    void testDuplicate() {
        assertThatThrownBy(() -> builder().notes(Arrays.asList(new Note(1f, 1), new Note(1f, 1, 0.5f))).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    @DisplayName("Should reject lanes outside the column count")
    void testLaneOutOfRange() {
        assertThatThrownBy(() -> builder().notes(Arrays.asList(new Note(1f, 4))).build())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should reject notes after the end of the signal")
    void testPastEnd() {
        assertThatThrownBy(() -> builder().signalDuration(2f).notes(Arrays.asList(new Note(2.5f, 0))).build())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should require a positive tempo")
    void testTempo() {
        assertThatThrownBy(() -> builder().bpm(0f).build()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should hand out an unmodifiable note list")
    void testImmutable() {
        Chart chart = builder().notes(Arrays.asList(new Note(1f, 1))).build();

        assertThatThrownBy(() -> chart.getNotes().add(new Note(2f, 0))).isInstanceOf(UnsupportedOperationException.class);
    }
}
