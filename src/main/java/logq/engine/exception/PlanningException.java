package logq.engine.exception;

/**
 * Semantic failure while building the logical plan: unknown or duplicate column,
 * literal not coercible to the column type, operator not defined for a type.
 */
public class PlanningException extends LogQueryException {

    public PlanningException(String message) {
        super(message);
    }

    public PlanningException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() { return "Parse Error"; }
}
