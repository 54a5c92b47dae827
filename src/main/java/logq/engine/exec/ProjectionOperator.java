package logq.engine.exec;

import java.util.ArrayList;
import java.util.List;

import logq.engine.types.Tuple;
import logq.engine.types.Value;

/**
 * Projection operator: keeps the given child positions, in the given order.
 */
public class ProjectionOperator implements Operator {
    private final Operator child;
    private final int[] columnIndexes; // indices to keep in output order

    public ProjectionOperator(Operator child, int[] columnIndexes) {
        this.child = child;
        this.columnIndexes = columnIndexes.clone();
    }

    @Override
    public void open() { child.open(); }

    @Override
    public Tuple next() {
        Tuple t = child.next();
        if (t == null) return null;
        List<Value> projected = new ArrayList<>(columnIndexes.length);
        for (int idx : columnIndexes) {
            projected.add(t.get(idx));
        }
        return new Tuple(projected);
    }

    @Override
    public void close() { child.close(); }
}
