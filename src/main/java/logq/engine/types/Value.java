package logq.engine.types;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;

import logq.engine.catalog.DataType;

/**
 * Immutable typed value flowing through the engine.
 *
 * <p>The set of implementations is closed: one record per {@link DataType}. Code that
 * needs per-variant behaviour switches over {@link #type()} without a default branch,
 * so the compiler flags every site when a type is added.
 *
 * <p>{@code equals}/{@code hashCode} are total, including {@link #NULL} equal to itself.
 * Query comparison semantics for NULL live in the executor, not here.
 */
public interface Value {

    Value NULL = NullValue.INSTANCE;

    DataType type();

    /** Human-readable rendering used by the table printer and CSV output. */
    String asText();

    default boolean isNull() { return type() == DataType.NULL; }

    static Value of(boolean b) { return new BooleanValue(b); }
    static Value of(long l) { return new IntValue(l); }
    static Value of(double d) { return new FloatValue(d); }
    static Value of(String s) { return s == null ? NULL : new StringValue(s); }
    static Value of(OffsetDateTime t) { return t == null ? NULL : new DateTimeValue(t); }
    static Value of(Host h) { return h == null ? NULL : new HostValue(h); }
    static Value of(HttpRequest r) { return r == null ? NULL : new HttpRequestValue(r); }

    record BooleanValue(boolean value) implements Value {
        @Override public DataType type() { return DataType.BOOLEAN; }
        @Override public String asText() { return Boolean.toString(value); }
    }

    record IntValue(long value) implements Value {
        @Override public DataType type() { return DataType.INT; }
        @Override public String asText() { return Long.toString(value); }
    }

    /** NaN is rejected and -0.0 folded into 0.0 so equality and ordering agree. */
    record FloatValue(double value) implements Value {
        public FloatValue {
            if (Double.isNaN(value)) throw new IllegalArgumentException("NaN is not a valid float value");
            if (value == 0.0d) value = 0.0d;
        }

        @Override public DataType type() { return DataType.FLOAT; }

        @Override
        public String asText() {
            String s = Double.toString(value);
            if (s.indexOf('E') < 0 || Double.isInfinite(value)) return s;
            return BigDecimal.valueOf(value).toPlainString();
        }
    }

    record StringValue(String value) implements Value {
        public StringValue {
            if (value == null) throw new IllegalArgumentException("string value must not be null, use Value.NULL");
        }

        @Override public DataType type() { return DataType.STRING; }
        @Override public String asText() { return value; }
    }

    record DateTimeValue(OffsetDateTime value) implements Value {
        public DateTimeValue {
            if (value == null) throw new IllegalArgumentException("timestamp must not be null, use Value.NULL");
        }

        @Override public DataType type() { return DataType.DATE_TIME; }
        @Override public String asText() { return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(value); }
    }

    record HostValue(Host value) implements Value {
        public HostValue {
            if (value == null) throw new IllegalArgumentException("host must not be null, use Value.NULL");
        }

        @Override public DataType type() { return DataType.HOST; }
        @Override public String asText() { return value.toString(); }
    }

    record HttpRequestValue(HttpRequest value) implements Value {
        public HttpRequestValue {
            if (value == null) throw new IllegalArgumentException("request must not be null, use Value.NULL");
        }

        @Override public DataType type() { return DataType.HTTP_REQUEST; }
        @Override public String asText() { return value.toString(); }
    }

    final class NullValue implements Value {
        static final NullValue INSTANCE = new NullValue();

        private NullValue() {}

        @Override public DataType type() { return DataType.NULL; }
        @Override public String asText() { return "NULL"; }
        @Override public String toString() { return "NULL"; }
    }
}
