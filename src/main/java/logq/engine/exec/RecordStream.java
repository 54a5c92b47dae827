package logq.engine.exec;

import java.util.List;
import java.util.Optional;

import logq.engine.types.Tuple;

/**
 * Single-pass, pull-driven stream of result records over an operator tree.
 *
 * <p>Life cycle: open, active while rows are pulled, exhausted once the operator tree reports
 * its end. After exhaustion, after an error and after {@link #close()} every call to
 * {@link #next()} returns empty. The operator tree, and with it the underlying reader, is
 * closed as soon as the stream reaches one of those states, so callers that drop the stream
 * early only need {@link #close()} (try-with-resources).
 */
public class RecordStream implements AutoCloseable {
    private enum State { OPEN, ACTIVE, EXHAUSTED, CLOSED }

    private final Operator root;
    private final List<String> columns;
    private State state;

    RecordStream(Operator root, List<String> columns) {
        this.root = root;
        this.columns = List.copyOf(columns);
        root.open();
        this.state = State.OPEN;
    }

    /** Output column names, in order. */
    public List<String> columns() { return columns; }

    public Optional<Record> next() {
        if (state == State.EXHAUSTED || state == State.CLOSED) return Optional.empty();
        Tuple t;
        try {
            t = root.next();
        } catch (RuntimeException e) {
            release(State.CLOSED);
            throw e;
        }
        if (t == null) {
            release(State.EXHAUSTED);
            return Optional.empty();
        }
        state = State.ACTIVE;
        return Optional.of(new Record(columns, t.values()));
    }

    public boolean isExhausted() { return state == State.EXHAUSTED; }

    @Override
    public void close() {
        if (state != State.EXHAUSTED && state != State.CLOSED) release(State.CLOSED);
    }

    private void release(State next) {
        state = next;
        root.close();
    }
}
