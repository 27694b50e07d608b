package autocharter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one analysis pass: the raw and smoothed energy envelopes plus the
 * band energies that were requested for it.
 */
public final class SpectralAnalysis {

    private final EnergyEnvelope rawEnvelope;
    private final EnergyEnvelope envelope;
    private final Map<FrequencyBand, float[]> bandSeries;

    SpectralAnalysis(EnergyEnvelope rawEnvelope, int smoothingWidth, Map<FrequencyBand, float[]> bandSeries) {
        this.rawEnvelope = rawEnvelope;
        this.envelope = rawEnvelope.smooth(smoothingWidth);
        this.bandSeries = Collections.unmodifiableMap(new LinkedHashMap<>(bandSeries));
    }

    public EnergyEnvelope rawEnvelope() {
        return rawEnvelope;
    }

    /** The smoothed envelope, ready for peak picking. */
    public EnergyEnvelope envelope() {
        return envelope;
    }

    public boolean hasBand(FrequencyBand band) {
        return bandSeries.containsKey(band);
    }

    public BandEnergies bandEnergies(List<FrequencyBand> bands) {
        float[][] series = new float[bands.size()][];
        for (int i = 0; i < bands.size(); i++) {
            float[] values = bandSeries.get(bands.get(i));
            if (values == null) {
                throw new IllegalArgumentException("Band was not part of the analysis: " + bands.get(i));
            }
            series[i] = values;
        }
        return new BandEnergies(bands, series, rawEnvelope.getFrameDuration());
    }
}
