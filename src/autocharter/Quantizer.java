package autocharter;

import gnu.trove.list.array.TFloatArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Snaps onset times onto the musical grid given by a tempo and a subdivision count.
 */
public class Quantizer {

    private static final Logger logger = Logger.getLogger(Quantizer.class.getName());

    /** Grid points closer than this (seconds) collapse into the earlier one. */
    public static final float DEDUP_TOLERANCE = 0.01f;

    private final float bpm;
    private final int gridDivision;

    public Quantizer(float bpm, int gridDivision) throws ChartingException {
        if (!(bpm > 0f) || Float.isInfinite(bpm)) {
            throw new ChartingException(ChartingException.Kind.INVALID_CONFIG, "BPM must be positive: " + bpm);
        }
        if (gridDivision <= 0) {
            throw new ChartingException(ChartingException.Kind.INVALID_CONFIG, "Grid division must be positive: " + gridDivision);
        }
        this.bpm = bpm;
        this.gridDivision = gridDivision;
    }

    /** Seconds between two neighbouring grid points. */
    public float subdivisionDuration() {
        return 60f / bpm / gridDivision;
    }

    /** Time of grid point {@code subdivision} within beat {@code beat}. */
    public float gridTime(int beat, int subdivision) {
        float beatDuration = 60f / bpm;
        return beat * beatDuration + subdivision * subdivisionDuration();
    }

    /** Nearest grid point, never negative. */
    public float quantize(float time) {
        float sub = subdivisionDuration();
        float snapped = Math.round(time / sub) * sub;
        return Math.max(0f, snapped);
    }

    /**
     * Snap, sort and deduplicate. Snaps that land after {@code maxTime} use the grid point before it.
     * The result is ascending with neighbours more than {@link #DEDUP_TOLERANCE} apart.
     */
    public float[] quantizeAll(float[] times, float maxTime) {
        float sub = subdivisionDuration();
        TFloatArrayList snapped = new TFloatArrayList(times.length);
        for (float t : times) {
            float q = quantize(t);
            if (q > maxTime) {
                q = Math.max(0f, q - sub);
            }
            snapped.add(q);
        }
        snapped.sort();

        TFloatArrayList deduped = new TFloatArrayList(snapped.size());
        float lastKept = Float.NEGATIVE_INFINITY;
        for (int i = 0; i < snapped.size(); i++) {
            float t = snapped.getQuick(i);
            if (t - lastKept > DEDUP_TOLERANCE) {
                deduped.add(t);
                lastKept = t;
            }
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Quantized %d onsets to %d grid points (%.1f BPM, 1/%d)", times.length, deduped.size(), bpm, gridDivision));
        }
        return deduped.toArray();
    }

    public float getBpm() {
        return bpm;
    }

    public int getGridDivision() {
        return gridDivision;
    }
}
