package autocharter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Peaks found in an envelope together with the tempo used for the rest of the run.
 */
public final class BeatDetection {

    private final List<PeakCandidate> peaks;
    private final float bpm;
    private final float estimatedBpm;
    private final boolean fallbackBpmUsed;
    private final boolean bpmOverridden;

    public BeatDetection(List<PeakCandidate> peaks, float bpm, float estimatedBpm, boolean fallbackBpmUsed, boolean bpmOverridden) {
        this.peaks = Collections.unmodifiableList(new ArrayList<>(peaks));
        this.bpm = bpm;
        this.estimatedBpm = estimatedBpm;
        this.fallbackBpmUsed = fallbackBpmUsed;
        this.bpmOverridden = bpmOverridden;
    }

    public List<PeakCandidate> getPeaks() {
        return peaks;
    }

    public float[] peakTimes() {
        float[] times = new float[peaks.size()];
        for (int i = 0; i < times.length; i++) times[i] = peaks.get(i).getTime();
        return times;
    }

    /** Tempo for downstream stages: the override when one was given, otherwise the estimate. */
    public float getBpm() {
        return bpm;
    }

    /** Tempo derived from peak spacing, 0 when nothing could be estimated. */
    public float getEstimatedBpm() {
        return estimatedBpm;
    }

    public boolean isFallbackBpmUsed() {
        return fallbackBpmUsed;
    }

    public boolean isBpmOverridden() {
        return bpmOverridden;
    }
}
