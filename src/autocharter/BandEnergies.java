package autocharter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Energy per frame for an ordered list of frequency bands. Band {@code i} is the
 * intensity signal of lane {@code i}.
 */
public final class BandEnergies {

    private final List<FrequencyBand> bands;
    private final float[][] energies; // [band][frame]
    private final float frameDuration;
    private final int frameCount;

    public BandEnergies(List<FrequencyBand> bands, float[][] energies, float frameDuration) {
        if (bands.size() != energies.length) {
            throw new IllegalArgumentException("One energy series per band is required");
        }
        this.bands = Collections.unmodifiableList(new ArrayList<>(bands));
        this.frameCount = energies.length == 0 ? 0 : energies[0].length;
        this.energies = new float[energies.length][];
        for (int b = 0; b < energies.length; b++) {
            if (energies[b].length != frameCount) {
                throw new IllegalArgumentException("Band " + b + " has a different frame count");
            }
            this.energies[b] = energies[b].clone();
        }
        this.frameDuration = frameDuration;
    }

    public int bandCount() {
        return bands.size();
    }

    public List<FrequencyBand> getBands() {
        return bands;
    }

    public int frameCount() {
        return frameCount;
    }

    public float getFrameDuration() {
        return frameDuration;
    }

    public float energy(int band, int frame) {
        return energies[band][frame];
    }

    public float frameTime(int frame) {
        return frame * frameDuration;
    }

    /** Index of the frame whose start is nearest to {@code time}, clamped to the valid range. */
    public int frameAt(float time) {
        if (frameCount == 0) return -1;
        int frame = Math.round(time / frameDuration);
        return Math.max(0, Math.min(frameCount - 1, frame));
    }
}
