package autocharter;

import java.util.ArrayList;
import java.util.List;

/**
 * A closed frequency range in Hz.
 */
public final class FrequencyBand {

    private final float lowHz;
    private final float highHz;

    public FrequencyBand(float lowHz, float highHz) {
        if (lowHz < 0f || highHz <= lowHz) {
            throw new IllegalArgumentException(String.format("Invalid band %s-%s Hz", lowHz, highHz));
        }
        this.lowHz = lowHz;
        this.highHz = highHz;
    }

    public float getLowHz() {
        return lowHz;
    }

    public float getHighHz() {
        return highHz;
    }

    public boolean contains(float hz) {
        return hz >= lowHz && hz <= highHz;
    }

    /**
     * Split this band into {@code count} adjacent bands of equal width on a log scale,
     * so each lane covers roughly the same number of octaves.
     */
    public List<FrequencyBand> split(int count) {
        List<FrequencyBand> bands = new ArrayList<>(count);
        double low = Math.max(lowHz, 1f);
        double ratio = Math.pow(highHz / low, 1.0 / count);
        double edge = low;
        for (int i = 0; i < count; i++) {
            double next = i == count - 1 ? highHz : edge * ratio;
            bands.add(new FrequencyBand((float) edge, (float) next));
            edge = next;
        }
        return bands;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FrequencyBand)) return false;
        FrequencyBand other = (FrequencyBand) o;
        return Float.compare(lowHz, other.lowHz) == 0 && Float.compare(highHz, other.highHz) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Float.hashCode(lowHz) + Float.hashCode(highHz);
    }

    @Override
    public String toString() {
        return String.format("%.0f-%.0f Hz", lowHz, highHz);
    }
}
