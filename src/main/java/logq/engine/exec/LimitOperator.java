package logq.engine.exec;

import logq.engine.types.Tuple;

/**
 * Passes through at most {@code limit} tuples. Once the budget is spent or the child runs
 * dry it stays exhausted and stops pulling from the child.
 */
public class LimitOperator implements Operator {
    private final Operator child;
    private final long limit;
    private long produced;
    private boolean exhausted;

    public LimitOperator(Operator child, long limit) {
        if (limit < 0) throw new IllegalArgumentException("limit must not be negative: " + limit);
        this.child = child;
        this.limit = limit;
    }

    @Override
    public void open() {
        produced = 0;
        exhausted = limit == 0;
        child.open();
    }

    @Override
    public Tuple next() {
        if (exhausted) return null;
        Tuple t = child.next();
        if (t == null) {
            exhausted = true;
            return null;
        }
        if (++produced >= limit) exhausted = true;
        return t;
    }

    @Override
    public void close() { child.close(); }
}
