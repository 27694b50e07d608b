package autocharter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A finished chart for one song, instrument and difficulty. Build it with {@link ChartBuilder}.
 */
public final class Chart {

    private final String songId;
    private final String instrument;
    private final Difficulty difficulty;
    private final int columnCount;
    private final float bpm;
    private final long generatedAt;
    private final boolean fallbackBpmUsed;
    private final List<Note> notes;

    Chart(String songId, String instrument, Difficulty difficulty, int columnCount, float bpm, long generatedAt,
            boolean fallbackBpmUsed, List<Note> notes) {
        this.songId = songId;
        this.instrument = instrument;
        this.difficulty = difficulty;
        this.columnCount = columnCount;
        this.bpm = bpm;
        this.generatedAt = generatedAt;
        this.fallbackBpmUsed = fallbackBpmUsed;
        this.notes = Collections.unmodifiableList(new ArrayList<>(notes));
    }

    public String getSongId() {
        return songId;
    }

    public String getInstrument() {
        return instrument;
    }

    public Difficulty getDifficulty() {
        return difficulty;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public float getBpm() {
        return bpm;
    }

    /** Creation time in epoch seconds. */
    public long getGeneratedAt() {
        return generatedAt;
    }

    /** True when too few peaks were found and the tempo is the configured default, not an estimate. */
    public boolean isFallbackBpmUsed() {
        return fallbackBpmUsed;
    }

    /** Notes ordered by time, then lane. */
    public List<Note> getNotes() {
        return notes;
    }

    public int holdCount() {
        int holds = 0;
        for (Note n : notes) if (n.isHold()) holds++;
        return holds;
    }

    @Override
    public String toString() {
        return String.format("Chart[%s %s %s, %d notes, %d columns, %.2f BPM%s]",
                songId, instrument, difficulty.getDisplayName(), notes.size(), columnCount, bpm, fallbackBpmUsed ? " (fallback)" : "");
    }
}
