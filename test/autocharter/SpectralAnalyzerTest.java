package autocharter;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SpectralAnalyzerTest {

    private SpectralAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new SpectralAnalyzer(CharterConfig.defaults());
    }

    @Test
    @DisplayName("Should cover every sample with a frame")
    void testFrameCount() throws Exception {
        assertThat(analyzer.frameCount(Samples.of(new float[1000], 44100f))).isEqualTo(2);
        assertThat(analyzer.frameCount(Samples.of(new float[1024], 44100f))).isEqualTo(2);
        assertThat(analyzer.frameCount(Samples.of(new float[1025], 44100f))).isEqualTo(3);
    }

    @Test
    @DisplayName("Should produce increasing frame times and non-negative energies")
    void testEnvelopeShape() throws Exception {
        Samples samples = SyntheticSignals.samples(SyntheticSignals.clickTrack(120f, 2f, 0.25f));

        EnergyEnvelope envelope = analyzer.envelope(samples);

        assertThat(envelope.size()).isEqualTo(analyzer.frameCount(samples));
        assertThat(envelope.timeAt(0)).isEqualTo(0f);
        for (int i = 1; i < envelope.size(); i++) {
            assertThat(envelope.timeAt(i)).isGreaterThan(envelope.timeAt(i - 1));
            assertThat(envelope.energyAt(i)).isGreaterThanOrEqualTo(0f);
        }
        assertThat(envelope.getFrameDuration()).isCloseTo(512f / 44100f, within(1e-6f));
    }

    @Test
    @DisplayName("Should centre frames so an onset at zero peaks in the first frames")
    void testOnsetAtZero() throws Exception {
        Samples samples = SyntheticSignals.samples(SyntheticSignals.clicks(1f, 0f));

        EnergyEnvelope raw = analyzer.analyze(samples, Collections.<FrequencyBand>emptyList()).rawEnvelope();

        int loudest = 0;
        for (int i = 1; i < raw.size(); i++) {
            if (raw.energyAt(i) > raw.energyAt(loudest)) loudest = i;
        }
        assertThat(raw.timeAt(loudest)).isLessThan(0.015f);
        assertThat(raw.energyAt(0)).isGreaterThan(0.5f * raw.max());
    }

    @Test
    @DisplayName("Should measure no energy in silence")
    void testSilence() throws Exception {
        EnergyEnvelope envelope = analyzer.envelope(Samples.of(new float[44100], 44100f));

        assertThat(envelope.max()).isEqualTo(0f);
    }

    @Test
    @DisplayName("Should put a tone's energy into the band that contains it")
    void testBandEnergies() throws Exception {
        Samples tone = SyntheticSignals.samples(SyntheticSignals.sine(440f, 1f, 0.5f));
        List<FrequencyBand> bands = Arrays.asList(new FrequencyBand(100f, 300f), new FrequencyBand(300f, 600f), new FrequencyBand(600f, 2000f));

        SpectralAnalysis analysis = analyzer.analyze(tone, bands);
        BandEnergies energies = analysis.bandEnergies(bands);

        int middle = energies.frameCount() / 2;
        assertThat(energies.bandCount()).isEqualTo(3);
        assertThat(energies.energy(1, middle)).isGreaterThan(100f * energies.energy(0, middle));
        assertThat(energies.energy(1, middle)).isGreaterThan(100f * energies.energy(2, middle));
        assertThat(analysis.hasBand(bands.get(2))).isTrue();
    }

    @Test
    @DisplayName("Should refuse band energies for bands that were not analysed")
    void testUnknownBand() throws Exception {
        SpectralAnalysis analysis = analyzer.analyze(Samples.of(new float[4096], 44100f), Collections.<FrequencyBand>emptyList());

        assertThatThrownBy(() -> analysis.bandEnergies(Collections.singletonList(new FrequencyBand(10f, 20f))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should smooth with a centered window truncated at the edges")
    void testSmoothing() {
        EnergyEnvelope envelope = new EnergyEnvelope(new float[] {0f, 0.1f, 0.2f}, new float[] {0f, 3f, 0f}, 0.1f);

        EnergyEnvelope smoothed = envelope.smooth(3);

        assertThat(smoothed.energies()).containsExactly(new float[] {1.5f, 1f, 1.5f}, within(1e-6f));
        assertThat(smoothed.times()).containsExactly(0f, 0.1f, 0.2f);
    }

    @Test
    @DisplayName("Should map each band onto the FFT bins inside it")
    void testBinRange() {
        float binWidth = 44100f / 2048f;

        assertThat(SpectralAnalyzer.binRange(new FrequencyBand(100f, 1000f), binWidth, 1025)).containsExactly(5, 46);
        // narrower than a bin: nearest bin
        assertThat(SpectralAnalyzer.binRange(new FrequencyBand(100f, 105f), binWidth, 1025)).containsExactly(5, 5);
    }
}
