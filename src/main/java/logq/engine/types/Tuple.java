package logq.engine.types;

import java.util.List;

/**
 * Positional row of values, one per schema column and in schema order.
 */
public record Tuple(List<Value> values) {

    public Tuple {
        values = List.copyOf(values);
    }

    public Value get(int index) { return values.get(index); }

    public int size() { return values.size(); }
}
