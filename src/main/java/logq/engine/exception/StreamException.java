package logq.engine.exception;

/**
 * Raised while pulling rows: a log line that does not decode under its format, or an
 * I/O failure of the underlying reader. {@link #lineNumber()} is 1-based, or -1 when the
 * failure is not tied to a line.
 */
public class StreamException extends LogQueryException {
    private final long lineNumber;

    public StreamException(String message, long lineNumber) {
        super(message);
        this.lineNumber = lineNumber;
    }

    public StreamException(String message, long lineNumber, Throwable cause) {
        super(message, cause);
        this.lineNumber = lineNumber;
    }

    public long lineNumber() { return lineNumber; }

    @Override
    public String kind() { return "Stream Error"; }
}
