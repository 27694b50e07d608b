package autocharter;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns quantized note times into notes by giving each one a lane.
 */
public class LaneAssigner {

    private static final Logger logger = Logger.getLogger(LaneAssigner.class.getName());

    private final int laneCount;

    public LaneAssigner(int laneCount) throws ChartingException {
        if (laneCount <= 0) {
            throw new ChartingException(ChartingException.Kind.INVALID_LANE_COUNT, "Lane count must be positive: " + laneCount);
        }
        this.laneCount = laneCount;
    }

    public int getLaneCount() {
        return laneCount;
    }

    /**
     * @param times ascending, deduplicated note times
     * @param strategy how lanes are chosen
     * @param seed seed for {@link LaneStrategy#RANDOM}
     * @param bands one band per lane, needed by {@link LaneStrategy#FREQUENCY}; may be null otherwise
     */
    public List<Note> assign(float[] times, LaneStrategy strategy, long seed, BandEnergies bands) {
        switch (strategy) {
            case FREQUENCY:
                if (bands == null || bands.frameCount() == 0) {
                    logger.warning("No band energies available; assigning lanes sequentially");
                    return assignSequential(times);
                }
                return assignByFrequency(times, bands);
            case RANDOM:
                return assignRandom(times, seed);
            case SEQUENTIAL:
            default:
                return assignSequential(times);
        }
    }

    List<Note> assignSequential(float[] times) {
        List<Note> notes = new ArrayList<>(times.length);
        for (int i = 0; i < times.length; i++) {
            notes.add(new Note(times[i], i % laneCount));
        }
        return notes;
    }

    List<Note> assignByFrequency(float[] times, BandEnergies bands) {
        if (bands.bandCount() != laneCount) {
            throw new IllegalArgumentException(String.format("Expected %d bands, got %d", laneCount, bands.bandCount()));
        }
        List<Note> notes = new ArrayList<>(times.length);
        int[] perLane = new int[laneCount];
        for (float t : times) {
            int frame = bands.frameAt(t);
            int best = 0;
            float bestEnergy = bands.energy(0, frame);
            for (int b = 1; b < laneCount; b++) {
                // strictly greater, so ties stay on the lower band
                if (bands.energy(b, frame) > bestEnergy) {
                    bestEnergy = bands.energy(b, frame);
                    best = b;
                }
            }
            perLane[best]++;
            notes.add(new Note(t, best));
        }
        if (logger.isLoggable(Level.FINE)) {
            StringBuilder counts = new StringBuilder();
            for (int lane = 0; lane < laneCount; lane++) counts.append(lane == 0 ? "" : ", ").append(perLane[lane]);
            logger.fine(String.format("Frequency lanes: [%s]", counts));
        }
        return notes;
    }

    List<Note> assignRandom(float[] times, long seed) {
        Lcg rng = new Lcg(seed);
        List<Note> notes = new ArrayList<>(times.length);
        for (float t : times) {
            notes.add(new Note(t, rng.next() % laneCount));
        }
        return notes;
    }

    /** The classic ANSI C rand() recurrence on a 64-bit state. */
    static final class Lcg {
        private long state;

        Lcg(long seed) {
            this.state = seed;
        }

        int next() {
            state = state * 1103515245L + 12345L;
            return (int) ((state >>> 16) % 32768L);
        }
    }
}
