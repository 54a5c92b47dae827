package logq.engine.exec;

import logq.engine.types.Tuple;

/**
 * Condition evaluated against a decoded tuple.
 */
public interface Predicate {
    Truth evaluate(Tuple tuple);

    default boolean test(Tuple tuple) { return evaluate(tuple) == Truth.TRUE; }
}
