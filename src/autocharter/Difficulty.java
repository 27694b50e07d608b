package autocharter;

import java.util.Locale;

/**
 * The four chart presets. Harder presets use a finer grid, a lower peak threshold
 * and shorter holds; Expert adds a fifth lane.
 */
public enum Difficulty {
    EASY("Easy", 4, 0.45f, 0.20f, 2.0f, false),
    NORMAL("Normal", 4, 0.35f, 0.12f, 1.5f, false),
    HARD("Hard", 4, 0.25f, 0.08f, 1.0f, false),
    EXPERT("Expert", 5, 0.20f, 0.06f, 1.0f, true);

    private final String displayName;
    private final int columnCount;
    private final float peakThreshold;
    private final float minPeakInterval;
    private final float holdScale;
    private final boolean fillGaps;

    Difficulty(String displayName, int columnCount, float peakThreshold, float minPeakInterval, float holdScale, boolean fillGaps) {
        this.displayName = displayName;
        this.columnCount = columnCount;
        this.peakThreshold = peakThreshold;
        this.minPeakInterval = minPeakInterval;
        this.holdScale = holdScale;
        this.fillGaps = fillGaps;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public int getColumnCount() {
        return columnCount;
    }

    public float getPeakThreshold() {
        return peakThreshold;
    }

    public float getMinPeakInterval() {
        return minPeakInterval;
    }

    /** Multiplier on the configured minimum hold duration, never below 1. */
    public float getHoldScale() {
        return holdScale;
    }

    /** Whether long gaps between onsets get an extra note in the middle. */
    public boolean isFillGaps() {
        return fillGaps;
    }

    /** Grid subdivision for this preset, derived from the configured one. */
    public int gridDivision(int configured) {
        switch (this) {
            case EASY:
                return Math.max(1, configured / 2);
            case EXPERT:
                return configured * 2;
            default:
                return configured;
        }
    }

    public static Difficulty fromDisplayName(String name) {
        for (Difficulty d : values()) {
            if (d.displayName.equalsIgnoreCase(name.trim())) return d;
        }
        throw new IllegalArgumentException("Unknown difficulty: " + name);
    }
}
