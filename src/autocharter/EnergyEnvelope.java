package autocharter;

import java.util.Arrays;

/**
 * Per-frame spectral energy over time. Times are frame start times in seconds,
 * strictly increasing; energies are never negative.
 */
public final class EnergyEnvelope {

    private final float[] times;
    private final float[] energies;
    private final float frameDuration;

    public EnergyEnvelope(float[] times, float[] energies, float frameDuration) {
        if (times.length != energies.length) {
            throw new IllegalArgumentException("times and energies differ in length");
        }
        this.times = Arrays.copyOf(times, times.length);
        this.energies = Arrays.copyOf(energies, energies.length);
        this.frameDuration = frameDuration;
    }

    public int size() {
        return energies.length;
    }

    public float timeAt(int frame) {
        return times[frame];
    }

    public float energyAt(int frame) {
        return energies[frame];
    }

    /** Seconds between consecutive frame starts. */
    public float getFrameDuration() {
        return frameDuration;
    }

    public float max() {
        float max = 0f;
        for (float e : energies) max = Math.max(max, e);
        return max;
    }

    /**
     * Centered moving average over {@code width} frames; the window is truncated at both ends.
     */
    public EnergyEnvelope smooth(int width) {
        if (width <= 1 || energies.length == 0) return this;
        int half = width / 2;
        float[] smoothed = new float[energies.length];
        for (int i = 0; i < energies.length; i++) {
            int start = Math.max(0, i - half);
            int end = Math.min(energies.length, i + half + 1);
            float sum = 0f;
            for (int j = start; j < end; j++) sum += energies[j];
            smoothed[i] = sum / (end - start);
        }
        return new EnergyEnvelope(times, smoothed, frameDuration);
    }

    public float[] energies() {
        return Arrays.copyOf(energies, energies.length);
    }

    public float[] times() {
        return Arrays.copyOf(times, times.length);
    }
}
