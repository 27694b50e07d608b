package autocharter;

import java.util.Comparator;
import java.util.Objects;

/**
 * One chart note: a time, a lane and, for holds, a duration.
 * A duration of zero marks a tap.
 */
public final class Note {

    /** Chart order: by time, then by lane. */
    public static final Comparator<Note> CHART_ORDER = Comparator.comparingDouble(Note::getTime).thenComparingInt(Note::getLane);

    private final float time;
    private final int lane;
    private final float duration;

    public Note(float time, int lane) {
        this(time, lane, 0f);
    }

    public Note(float time, int lane, float duration) {
        if (time < 0f) throw new IllegalArgumentException("Note time must not be negative: " + time);
        if (lane < 0) throw new IllegalArgumentException("Lane must not be negative: " + lane);
        if (duration < 0f) throw new IllegalArgumentException("Duration must not be negative: " + duration);
        this.time = time;
        this.lane = lane;
        this.duration = duration;
    }

    public float getTime() {
        return time;
    }

    public int getLane() {
        return lane;
    }

    /** Hold length in seconds, 0 for taps. */
    public float getDuration() {
        return duration;
    }

    public boolean isHold() {
        return duration > 0f;
    }

    public Note withLane(int newLane) {
        return new Note(time, newLane, duration);
    }

    public Note withDuration(float newDuration) {
        return new Note(time, lane, newDuration);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Note)) return false;
        Note other = (Note) o;
        return Float.compare(time, other.time) == 0 && lane == other.lane && Float.compare(duration, other.duration) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(time, lane, duration);
    }

    @Override
    public String toString() {
        return isHold() ? String.format("Note[%.3fs lane %d hold %.3fs]", time, lane, duration)
                : String.format("Note[%.3fs lane %d]", time, lane);
    }
}
