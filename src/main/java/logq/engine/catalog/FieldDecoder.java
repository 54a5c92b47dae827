package logq.engine.catalog;

import logq.engine.types.Value;

/**
 * Turns one raw log field into a typed value.
 * Implementations throw IllegalArgumentException when the field does not parse.
 */
@FunctionalInterface
public interface FieldDecoder {
    Value decode(String raw);
}
