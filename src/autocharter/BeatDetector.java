package autocharter;

import gnu.trove.list.array.TFloatArrayList;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Picks energy peaks out of a smoothed envelope and estimates the tempo from their spacing.
 */
public class BeatDetector {

    private static final Logger logger = Logger.getLogger(BeatDetector.class.getName());

    private final float defaultBpm;
    private final float minBpm;
    private final float maxBpm;

    public BeatDetector(float defaultBpm, float minBpm, float maxBpm) {
        this.defaultBpm = defaultBpm;
        this.minBpm = minBpm;
        this.maxBpm = maxBpm;
    }

    public BeatDetector(CharterConfig config) {
        this(config.getDefaultBpm(), config.getMinBpm(), config.getMaxBpm());
    }

    /**
     * @param envelope smoothed energy envelope
     * @param threshold fraction of the envelope maximum a peak has to exceed
     * @param minPeakInterval peaks closer than this (seconds) are merged, keeping the stronger one
     * @param bpmOverride tempo to use instead of the estimate, or null
     * @throws ChartingException NO_BEATS_DETECTED when no peak exists and no override was given
     */
    public BeatDetection detect(EnergyEnvelope envelope, float threshold, float minPeakInterval, Float bpmOverride) throws ChartingException {
        List<PeakCandidate> peaks = mergeClosePeaks(findPeaks(envelope, threshold), minPeakInterval);

        if (peaks.isEmpty() && bpmOverride == null) {
            throw new ChartingException(ChartingException.Kind.NO_BEATS_DETECTED,
                    "No energy peaks above " + threshold + " of the maximum; cannot derive a tempo");
        }

        float estimated = 0f;
        boolean fallback = false;
        if (!peaks.isEmpty()) {
            estimated = estimateBpm(peaks);
            if (estimated <= 0f) {
                estimated = defaultBpm;
                fallback = true;
                if (logger.isLoggable(Level.WARNING)) {
                    logger.warning(String.format("Only %d usable peak(s); falling back to %.1f BPM", peaks.size(), defaultBpm));
                }
            }
        }

        float bpm = bpmOverride != null ? bpmOverride : estimated;
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Peaks: %d, estimated BPM: %.2f, using: %.2f%s", peaks.size(), estimated, bpm,
                    bpmOverride != null ? " (override)" : ""));
        }
        return new BeatDetection(peaks, bpm, estimated, fallback, bpmOverride != null);
    }

    /**
     * Local maxima above {@code threshold * max}. A frame must be strictly louder than its left
     * neighbour and at least as loud as its right one, so a flat top yields its first frame only.
     * Neighbours outside the envelope count as silence.
     */
    static List<PeakCandidate> findPeaks(EnergyEnvelope envelope, float threshold) {
        List<PeakCandidate> peaks = new ArrayList<>();
        int n = envelope.size();
        float floor = threshold * envelope.max();
        for (int i = 0; i < n; i++) {
            float e = envelope.energyAt(i);
            float left = i > 0 ? envelope.energyAt(i - 1) : 0f;
            float right = i < n - 1 ? envelope.energyAt(i + 1) : 0f;
            if (e > floor && e > left && e >= right) {
                peaks.add(new PeakCandidate(envelope.timeAt(i), e));
            }
        }
        return peaks;
    }

    static List<PeakCandidate> mergeClosePeaks(List<PeakCandidate> peaks, float minPeakInterval) {
        List<PeakCandidate> merged = new ArrayList<>();
        for (PeakCandidate peak : peaks) {
            if (merged.isEmpty()) {
                merged.add(peak);
                continue;
            }
            PeakCandidate last = merged.get(merged.size() - 1);
            if (peak.getTime() - last.getTime() < minPeakInterval) {
                // ties keep the earlier peak
                if (peak.getEnergy() > last.getEnergy()) merged.set(merged.size() - 1, peak);
            } else {
                merged.add(peak);
            }
        }
        return merged;
    }

    /**
     * 60 / median of the positive gaps between peaks, folded into the tempo range.
     * Returns 0 when fewer than two usable gaps exist.
     */
    float estimateBpm(List<PeakCandidate> peaks) {
        TFloatArrayList gaps = new TFloatArrayList();
        for (int i = 1; i < peaks.size(); i++) {
            float gap = peaks.get(i).getTime() - peaks.get(i - 1).getTime();
            if (gap > 0f) gaps.add(gap);
        }
        if (gaps.size() < 2) return 0f;
        return foldIntoRange(60f / median(gaps));
    }

    static float median(TFloatArrayList values) {
        TFloatArrayList sorted = new TFloatArrayList(values);
        sorted.sort();
        int mid = sorted.size() / 2;
        if (sorted.size() % 2 == 1) return sorted.getQuick(mid);
        return (sorted.getQuick(mid - 1) + sorted.getQuick(mid)) / 2f;
    }

    // double or halve until the tempo sits inside [minBpm, maxBpm]
    float foldIntoRange(float bpm) {
        float folded = bpm;
        while (folded > maxBpm && folded / 2f >= minBpm) folded /= 2f;
        while (folded < minBpm && folded * 2f <= maxBpm) folded *= 2f;
        return folded;
    }
}
