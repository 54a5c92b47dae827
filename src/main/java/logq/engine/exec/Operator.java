package logq.engine.exec;

import logq.engine.types.Tuple;

/**
 * Pull-based physical operator (open, then next until null, then close).
 * next() throws StreamException when the input cannot be read or decoded.
 * close() must be safe to call more than once and without a prior open().
 */
public interface Operator {
    void open();
    Tuple next(); // returns next tuple or null when exhausted
    void close();
}
