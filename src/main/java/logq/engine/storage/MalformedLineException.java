package logq.engine.storage;

/**
 * A single log line did not decode under its schema. The scan decides whether that
 * stops the stream or the line is skipped.
 */
public class MalformedLineException extends Exception {
    private final long lineNumber;
    private final String format;

    public MalformedLineException(String format, long lineNumber, String reason, Throwable cause) {
        super("malformed " + format + " log line " + lineNumber + ": " + reason, cause);
        this.lineNumber = lineNumber;
        this.format = format;
    }

    public long lineNumber() { return lineNumber; }
    public String format() { return format; }
}
