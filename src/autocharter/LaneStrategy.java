package autocharter;

import java.util.Locale;

/**
 * How notes are spread over the lanes.
 */
public enum LaneStrategy {
    /** note i goes to lane i mod N */
    SEQUENTIAL,
    /** lane of the frequency band carrying the most energy at the note */
    FREQUENCY,
    /** seeded linear-congruential sequence, reproducible for a given seed */
    RANDOM;

    public static LaneStrategy fromLabel(String label) throws ChartingException {
        if (label != null) {
            for (LaneStrategy strategy : values()) {
                if (strategy.name().equalsIgnoreCase(label.trim())) return strategy;
            }
        }
        throw new ChartingException(ChartingException.Kind.INVALID_CONFIG, "Unknown lane strategy: " + label);
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
