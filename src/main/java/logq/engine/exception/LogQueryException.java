package logq.engine.exception;

/**
 * Base class of every error a query can end with. The driver catches this type,
 * reports the message and keeps the process healthy for the next query.
 */
public abstract class LogQueryException extends RuntimeException {

    protected LogQueryException(String message) {
        super(message);
    }

    protected LogQueryException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Short label of the error kind, printed in front of the message. */
    public abstract String kind();
}
