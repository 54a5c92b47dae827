package logq.engine.exec;

import logq.engine.types.Tuple;
import logq.engine.types.Value;

/**
 * One side of a comparison once variables are bound: a tuple position or a fixed value.
 */
public interface Operand {
    Value resolve(Tuple tuple);

    record Column(int index, String name) implements Operand {
        @Override public Value resolve(Tuple tuple) { return tuple.get(index); }
        @Override public String toString() { return name; }
    }

    record Constant(Value value) implements Operand {
        @Override public Value resolve(Tuple tuple) { return value; }
        @Override public String toString() { return value.asText(); }
    }
}
