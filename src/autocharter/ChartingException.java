package autocharter;

/**
 * Raised by any pipeline stage that cannot produce its output.
 * The {@link Kind} tells callers which stage gave up and why.
 */
public class ChartingException extends Exception {

    public enum Kind {
        UNSUPPORTED_FORMAT,
        DECODE_ERROR,
        EMPTY_SIGNAL,
        NO_BEATS_DETECTED,
        INVALID_LANE_COUNT,
        INVALID_CONFIG,
        IO_ERROR,
        SERIALIZATION_ERROR
    }

    private static final long serialVersionUID = 1L;

    private final Kind kind;

    public ChartingException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ChartingException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return kind + ": " + getMessage();
    }
}
