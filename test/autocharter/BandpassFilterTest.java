package autocharter;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class BandpassFilterTest {

    private final BandpassFilter filter = new BandpassFilter(2048, 512);

    @Test
    @DisplayName("Should keep the in-band tone and suppress the out-of-band one")
    void testSeparatesTones() throws Exception {
        float[] low = SyntheticSignals.sine(100f, 1f, 0.4f);
        float[] high = SyntheticSignals.sine(3000f, 1f, 0.4f);
        Samples mixed = SyntheticSignals.samples(SyntheticSignals.mix(low, high));
        FrequencyBand lowBand = new FrequencyBand(50f, 150f);
        FrequencyBand highBand = new FrequencyBand(2500f, 3500f);

        Samples filtered = filter.apply(mixed, new FrequencyBand(2000f, 4000f));

        List<FrequencyBand> bands = Arrays.asList(lowBand, highBand);
        BandEnergies energies = new SpectralAnalyzer(CharterConfig.defaults()).analyze(filtered, bands).bandEnergies(bands);
        float lowTotal = 0f;
        float highTotal = 0f;
        for (int f = 0; f < energies.frameCount(); f++) {
            lowTotal += energies.energy(0, f);
            highTotal += energies.energy(1, f);
        }
        assertThat(highTotal).isGreaterThan(10f * lowTotal);
    }

    @Test
    @DisplayName("Should keep the signal length and normalize the peak to one")
    void testNormalizes() throws Exception {
        Samples tone = SyntheticSignals.samples(SyntheticSignals.sine(440f, 0.5f, 0.2f));

        Samples filtered = filter.apply(tone, Instrument.VOCALS.getBand());

        assertThat(filtered.length()).isEqualTo(tone.length());
        assertThat(filtered.getSampleRate()).isEqualTo(tone.getSampleRate());
        float max = 0f;
        for (float v : filtered.toArray()) max = Math.max(max, Math.abs(v));
        assertThat(max).isCloseTo(1f, within(1e-4f));
    }

    @Test
    @DisplayName("Should leave silence silent")
    void testSilence() throws Exception {
        Samples filtered = filter.apply(Samples.of(new float[8192], 44100f), Instrument.DRUMS.getBand());

        for (float v : filtered.toArray()) assertThat(v).isEqualTo(0f);
    }

    @Test
    @DisplayName("Should reject FFT sizes that are not powers of two")
    void testInvalidSize() {
        assertThatThrownBy(() -> new BandpassFilter(1000, 256)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BandpassFilter(1024, 1024)).isInstanceOf(IllegalArgumentException.class);
    }
}
