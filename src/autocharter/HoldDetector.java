package autocharter;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides which notes become holds by following the energy of their lane's
 * frequency band after the onset.
 */
public class HoldDetector {

    private static final Logger logger = Logger.getLogger(HoldDetector.class.getName());

    // onset frame plus this many following frames form the reference window
    private static final int REFERENCE_FRAMES = 3;

    private final float sustainThreshold;
    private final float minHoldDuration;

    public HoldDetector(float sustainThreshold, float minHoldDuration) throws ChartingException {
        if (sustainThreshold < 0f || sustainThreshold > 1f || Float.isNaN(sustainThreshold)) {
            throw new ChartingException(ChartingException.Kind.INVALID_CONFIG, "Sustain threshold must be within [0, 1]: " + sustainThreshold);
        }
        if (!(minHoldDuration > 0f)) {
            throw new ChartingException(ChartingException.Kind.INVALID_CONFIG, "Minimum hold duration must be positive: " + minHoldDuration);
        }
        this.sustainThreshold = sustainThreshold;
        this.minHoldDuration = minHoldDuration;
    }

    /**
     * Returns new notes; those with a long enough sustain carry a duration.
     * Holds are computed independently, so two holds in one lane may overlap.
     *
     * @param laneBands band {@code i} belongs to lane {@code i}
     * @param signalDuration length of the analysed signal in seconds
     */
    public List<Note> detect(List<Note> notes, BandEnergies laneBands, float signalDuration) {
        List<Note> result = new ArrayList<>(notes.size());
        int holds = 0;
        for (Note note : notes) {
            float duration = sustainedDuration(note, laneBands, signalDuration);
            if (duration >= minHoldDuration) {
                result.add(note.withDuration(duration));
                holds++;
            } else {
                result.add(note.withDuration(0f));
            }
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("%d of %d notes are holds (threshold %.2f, min %.2fs)", holds, notes.size(), sustainThreshold, minHoldDuration));
        }
        return result;
    }

    /**
     * Seconds from the note until its band first drops below the sustain level,
     * or until the end of the signal. 0 if the lane has no band or no energy.
     */
    float sustainedDuration(Note note, BandEnergies laneBands, float signalDuration) {
        if (laneBands == null || note.getLane() >= laneBands.bandCount() || laneBands.frameCount() == 0) return 0f;
        int band = note.getLane();
        int frames = laneBands.frameCount();
        int start = laneBands.frameAt(note.getTime());

        float reference = 0f;
        for (int f = start; f < Math.min(frames, start + REFERENCE_FRAMES); f++) {
            reference = Math.max(reference, laneBands.energy(band, f));
        }
        if (reference <= 0f) return 0f;

        float level = sustainThreshold * reference;
        for (int f = start + 1; f < frames; f++) {
            if (laneBands.energy(band, f) < level) {
                return Math.max(0f, laneBands.frameTime(f) - note.getTime());
            }
        }
        return Math.max(0f, signalDuration - note.getTime());
    }
}
