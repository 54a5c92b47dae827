package logq.engine.exception;

/**
 * A statement parsed successfully but text was left after it.
 */
public class InputNotAllConsumedException extends LogQueryException {
    private final String leftover;

    public InputNotAllConsumedException(String leftover) {
        super("Input is not fully consumed, the leftover is \"" + leftover + "\"");
        this.leftover = leftover;
    }

    public String leftover() { return leftover; }

    @Override
    public String kind() { return "Syntax Error"; }
}
