package logq.engine.catalog;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

import logq.engine.types.Host;
import logq.engine.types.HttpRequest;
import logq.engine.types.Value;

/**
 * Stock field decoders. All of them map the log placeholder "-" (and an empty field) to NULL.
 */
public final class FieldDecoders {
    private FieldDecoders() {}

    // S3 / common log format, e.g. 06/Feb/2019:00:00:38 +0000 (brackets already removed by the tokenizer)
    private static final DateTimeFormatter CLF_FORMAT =
        DateTimeFormatter.ofPattern("dd/MMM/yyyy:HH:mm:ss Z", Locale.ENGLISH);

    public static final FieldDecoder STRING = raw -> isAbsent(raw) ? Value.NULL : Value.of(raw);

    public static final FieldDecoder INT = raw -> isAbsent(raw) ? Value.NULL : Value.of(Long.parseLong(raw));

    /** Only finite numbers; NaN and infinities (including overflowing exponents) are rejected. */
    public static final FieldDecoder FLOAT = raw -> {
        if (isAbsent(raw)) return Value.NULL;
        double d = Double.parseDouble(raw);
        if (!Double.isFinite(d)) throw new IllegalArgumentException("not a finite number: " + raw);
        return Value.of(d);
    };

    public static final FieldDecoder BOOLEAN = raw -> {
        if (isAbsent(raw)) return Value.NULL;
        if (raw.equalsIgnoreCase("true")) return Value.of(true);
        if (raw.equalsIgnoreCase("false")) return Value.of(false);
        throw new IllegalArgumentException("not a boolean: " + raw);
    };

    /** ISO-8601 with offset, as written by ELB and ALB: 2015-05-13T23:39:43.945958Z */
    public static final FieldDecoder ISO_TIMESTAMP = raw -> {
        if (isAbsent(raw)) return Value.NULL;
        try {
            return Value.of(OffsetDateTime.parse(raw, DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid timestamp: " + raw, e);
        }
    };

    /** Squid native format: seconds since the epoch with millisecond fraction, 1286536309.450 */
    public static final FieldDecoder EPOCH_SECONDS = raw -> {
        if (isAbsent(raw)) return Value.NULL;
        BigDecimal seconds;
        try {
            seconds = new BigDecimal(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid epoch timestamp: " + raw, e);
        }
        try {
            long whole = seconds.toBigInteger().longValueExact();
            long nanos = seconds.subtract(BigDecimal.valueOf(whole)).movePointRight(9).longValue();
            return Value.of(Instant.ofEpochSecond(whole, nanos).atOffset(ZoneOffset.UTC));
        } catch (ArithmeticException | DateTimeException e) {
            throw new IllegalArgumentException("invalid epoch timestamp: " + raw, e);
        }
    };

    public static final FieldDecoder CLF_TIMESTAMP = raw -> {
        if (isAbsent(raw)) return Value.NULL;
        try {
            return Value.of(OffsetDateTime.parse(raw, CLF_FORMAT));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid timestamp: " + raw, e);
        }
    };

    public static final FieldDecoder HOST = raw -> isAbsent(raw) ? Value.NULL : Value.of(Host.parse(raw));

    /** ELB writes "- - - " for requests it could not parse; that is NULL as well. */
    public static final FieldDecoder HTTP_REQUEST = raw -> {
        if (isAbsent(raw) || raw.trim().equals("- - -")) return Value.NULL;
        return Value.of(HttpRequest.parse(raw));
    };

    public static FieldDecoder forType(DataType type) {
        return switch (type) {
            case BOOLEAN -> BOOLEAN;
            case INT -> INT;
            case FLOAT -> FLOAT;
            case STRING -> STRING;
            case DATE_TIME -> ISO_TIMESTAMP;
            case HOST -> HOST;
            case HTTP_REQUEST -> HTTP_REQUEST;
            case NULL -> throw new IllegalArgumentException("columns cannot be of type NULL");
        };
    }

    static boolean isAbsent(String raw) {
        return raw == null || raw.isEmpty() || raw.equals("-");
    }
}
