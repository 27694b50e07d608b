package autocharter;

/**
 * A detected onset: its time in seconds and the envelope energy it was picked with.
 */
public final class PeakCandidate {

    private final float time;
    private final float energy;

    public PeakCandidate(float time, float energy) {
        this.time = time;
        this.energy = energy;
    }

    public float getTime() {
        return time;
    }

    public float getEnergy() {
        return energy;
    }

    @Override
    public String toString() {
        return String.format("Peak[%.3fs, %.4f]", time, energy);
    }
}
