package autocharter;

import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class QuantizerTest {

    @Test
    @DisplayName("Should snap to the nearest subdivision and clamp at zero")
    void testQuantize() throws Exception {
        Quantizer quantizer = new Quantizer(120f, 4);

        assertThat(quantizer.subdivisionDuration()).isEqualTo(0.125f);
        assertThat(quantizer.quantize(0.06f)).isEqualTo(0f);
        assertThat(quantizer.quantize(0.07f)).isEqualTo(0.125f);
        assertThat(quantizer.quantize(-0.3f)).isEqualTo(0f);
        assertThat(quantizer.gridTime(2, 1)).isEqualTo(1.125f);
    }

    @Test
    @DisplayName("Should sort and collapse onsets landing on the same grid point")
    void testDeduplicates() throws Exception {
        Quantizer quantizer = new Quantizer(120f, 4);

        float[] result = quantizer.quantizeAll(new float[] {0.13f, 0.12f, 0.5f, 0.49f}, 10f);

        assertThat(result).containsExactly(0.125f, 0.5f);
    }

    @Test
    @DisplayName("Should move a snap past the end back one grid step")
    void testMaxTime() throws Exception {
        Quantizer quantizer = new Quantizer(120f, 4);

        assertThat(quantizer.quantizeAll(new float[] {0.97f}, 0.98f)).containsExactly(0.875f);
    }

    @Test
    @DisplayName("Should leave grid-aligned times unchanged")
    void testIdempotent() throws Exception {
        Quantizer quantizer = new Quantizer(100f, 4);
        float[] aligned = new float[32];
        for (int i = 0; i < aligned.length; i++) aligned[i] = quantizer.quantize(i * 0.31f);

        float[] once = quantizer.quantizeAll(aligned, 20f);
        float[] twice = quantizer.quantizeAll(once, 20f);

        assertThat(twice).containsExactly(once);
    }

    @Test
    @DisplayName("Should never emit two times within the dedup tolerance")
    void testSpacing() throws Exception {
        Random random = new Random(7);
        Quantizer quantizer = new Quantizer(173f, 8);
        float[] times = new float[500];
        for (int i = 0; i < times.length; i++) times[i] = random.nextFloat() * 30f;

        float[] result = quantizer.quantizeAll(times, 30f);

        for (int i = 1; i < result.length; i++) {
            assertThat(result[i] - result[i - 1]).isGreaterThan(Quantizer.DEDUP_TOLERANCE);
        }
        assertThat(result[result.length - 1]).isLessThanOrEqualTo(30f);
    }

    @Test
    @DisplayName("Should reject a non-positive tempo or grid")
    void testInvalid() {
        assertThatThrownBy(() -> new Quantizer(0f, 4))
                .isInstanceOf(ChartingException.class)
                .extracting(e -> ((ChartingException) e).getKind())
                .isEqualTo(ChartingException.Kind.INVALID_CONFIG);
        assertThatThrownBy(() -> new Quantizer(120f, 0))
                .isInstanceOf(ChartingException.class)
                .extracting(e -> ((ChartingException) e).getKind())
                .isEqualTo(ChartingException.Kind.INVALID_CONFIG);
    }
}
