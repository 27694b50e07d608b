package autocharter;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Assembles a {@link Chart}: orders the notes and checks that the result is well formed.
 */
public class ChartBuilder {

    private String songId;
    private String instrument;
    private Difficulty difficulty;
    private int columnCount = -1;
    private float bpm;
    private boolean fallbackBpmUsed;
    private float signalDuration = Float.POSITIVE_INFINITY;
    private List<Note> notes = new ArrayList<>();
    private Clock clock = Clock.systemUTC();

    public ChartBuilder songId(String songId) {
        this.songId = songId;
        return this;
    }

    public ChartBuilder instrument(String instrument) {
        this.instrument = instrument;
        return this;
    }

    public ChartBuilder difficulty(Difficulty difficulty) {
        this.difficulty = difficulty;
        return this;
    }

    /** Defaults to the difficulty's column count. */
    public ChartBuilder columnCount(int columnCount) {
        this.columnCount = columnCount;
        return this;
    }

    public ChartBuilder bpm(float bpm) {
        this.bpm = bpm;
        return this;
    }

    /** Marks the tempo as the default used when none could be estimated. */
    public ChartBuilder fallbackBpmUsed(boolean fallbackBpmUsed) {
        this.fallbackBpmUsed = fallbackBpmUsed;
        return this;
    }

    /** Upper bound for note times; unbounded when not set. */
    public ChartBuilder signalDuration(float signalDuration) {
        this.signalDuration = signalDuration;
        return this;
    }

    public ChartBuilder notes(List<Note> notes) {
        this.notes = new ArrayList<>(notes);
        return this;
    }

    public ChartBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public Chart build() {
        if (songId == null || songId.isEmpty()) throw new IllegalStateException("songId is required");
        if (instrument == null || instrument.isEmpty()) throw new IllegalStateException("instrument is required");
        if (difficulty == null) throw new IllegalStateException("difficulty is required");
        if (!(bpm > 0f)) throw new IllegalStateException("bpm must be positive: " + bpm);
        int columns = columnCount > 0 ? columnCount : difficulty.getColumnCount();

        List<Note> ordered = new ArrayList<>(notes);
        ordered.sort(Note.CHART_ORDER);
        Note previous = null;
        for (Note note : ordered) {
            if (note.getLane() >= columns) {
                throw new IllegalStateException(String.format("%s is outside %d columns", note, columns));
            }
            if (note.getTime() > signalDuration) {
                throw new IllegalStateException(String.format("%s is past the end of the signal (%.3fs)", note, signalDuration));
            }
            if (previous != null && previous.getTime() == note.getTime() && previous.getLane() == note.getLane()) {
                throw new IllegalStateException("Duplicate note at " + note.getTime() + "s in lane " + note.getLane());
            }
            previous = note;
        }
        return new Chart(songId, instrument, difficulty, columns, bpm, clock.instant().getEpochSecond(), fallbackBpmUsed, ordered);
    }
}
