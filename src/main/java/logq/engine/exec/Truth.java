package logq.engine.exec;

/**
 * Three-valued (Kleene) logic result of a predicate. A comparison with NULL is UNKNOWN;
 * filters keep a row only when its predicate is TRUE.
 */
public enum Truth {
    TRUE, FALSE, UNKNOWN;

    public static Truth of(boolean b) { return b ? TRUE : FALSE; }

    public Truth and(Truth other) {
        if (this == FALSE || other == FALSE) return FALSE;
        if (this == TRUE && other == TRUE) return TRUE;
        return UNKNOWN;
    }

    public Truth or(Truth other) {
        if (this == TRUE || other == TRUE) return TRUE;
        if (this == FALSE && other == FALSE) return FALSE;
        return UNKNOWN;
    }

    public Truth not() {
        return switch (this) {
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            case UNKNOWN -> UNKNOWN;
        };
    }
}
