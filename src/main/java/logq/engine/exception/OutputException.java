package logq.engine.exception;

/**
 * Writing results in the selected output mode failed.
 */
public class OutputException extends LogQueryException {

    public OutputException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() { return "Output Error"; }
}
