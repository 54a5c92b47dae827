package logq.engine.types;

import java.time.OffsetDateTime;

/**
 * Comparison rules shared by filters. Neither method accepts NULL; callers handle it first.
 */
public final class Values {
    private Values() {}

    /**
     * Equality as the query language sees it: INT and FLOAT compare numerically and
     * timestamps compare by instant regardless of offset.
     */
    public static boolean equalTo(Value a, Value b) {
        requireNonNull(a, b);
        if (a.type().isNumeric() && b.type().isNumeric()) return compare(a, b) == 0;
        requireSameType(a, b);
        return switch (a.type()) {
            case DATE_TIME -> ((Value.DateTimeValue) a).value().isEqual(((Value.DateTimeValue) b).value());
            case BOOLEAN, STRING, HOST, HTTP_REQUEST, INT, FLOAT -> a.equals(b);
            case NULL -> throw new IllegalStateException("unreachable");
        };
    }

    /** Ordering of two values of an ordered type (INT, FLOAT, STRING, DATE_TIME). */
    public static int compare(Value a, Value b) {
        requireNonNull(a, b);
        if (a.type().isNumeric() && b.type().isNumeric()) {
            if (a instanceof Value.IntValue x && b instanceof Value.IntValue y) return Long.compare(x.value(), y.value());
            return Double.compare(asDouble(a), asDouble(b));
        }
        requireSameType(a, b);
        return switch (a.type()) {
            case STRING -> ((Value.StringValue) a).value().compareTo(((Value.StringValue) b).value());
            case DATE_TIME -> OffsetDateTime.timeLineOrder()
                .compare(((Value.DateTimeValue) a).value(), ((Value.DateTimeValue) b).value());
            case BOOLEAN, HOST, HTTP_REQUEST -> throw new IllegalArgumentException(a.type() + " values have no ordering");
            case INT, FLOAT, NULL -> throw new IllegalStateException("unreachable");
        };
    }

    private static double asDouble(Value v) {
        return switch (v.type()) {
            case INT -> (double) ((Value.IntValue) v).value();
            case FLOAT -> ((Value.FloatValue) v).value();
            case BOOLEAN, STRING, DATE_TIME, HOST, HTTP_REQUEST, NULL ->
                throw new IllegalArgumentException("not a number: " + v.type());
        };
    }

    private static void requireNonNull(Value a, Value b) {
        if (a.isNull() || b.isNull()) throw new IllegalArgumentException("NULL is not comparable");
    }

    private static void requireSameType(Value a, Value b) {
        if (a.type() != b.type()) {
            throw new IllegalArgumentException("cannot compare " + a.type() + " with " + b.type());
        }
    }
}
