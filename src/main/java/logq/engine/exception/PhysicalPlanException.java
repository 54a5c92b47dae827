package logq.engine.exception;

/**
 * The data source could not be bound while lowering the plan.
 */
public class PhysicalPlanException extends LogQueryException {
    private final String source;

    public PhysicalPlanException(String source, String reason, Throwable cause) {
        super("Cannot bind data source " + source + ": " + reason, cause);
        this.source = source;
    }

    public String source() { return source; }

    @Override
    public String kind() { return "Physical Plan Error"; }
}
