package logq.engine.exception;

public class CreateStreamException extends LogQueryException {

    public CreateStreamException(String message) {
        super(message);
    }

    public CreateStreamException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() { return "Create Stream Error"; }
}
