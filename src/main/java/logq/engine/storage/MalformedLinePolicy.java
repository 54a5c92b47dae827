package logq.engine.storage;

import java.util.Locale;

/**
 * What a scan does with a line that does not decode.
 * FAIL stops the stream with an error; SKIP drops the line and counts it.
 */
public enum MalformedLinePolicy {
    FAIL,
    SKIP;

    public static MalformedLinePolicy fromString(String s) {
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "fail" -> FAIL;
            case "skip" -> SKIP;
            default -> throw new IllegalArgumentException("unknown malformed-line policy: " + s + " (expected fail or skip)");
        };
    }
}
