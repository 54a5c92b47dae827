package logq.engine.cli;

import java.io.Writer;

import logq.engine.exec.RecordStream;

/**
 * Renders the records of a stream. Implementations pull until the stream is exhausted; a
 * stream error propagates unchanged and stops rendering.
 */
public interface ResultPrinter {

    /** Writes every remaining record of {@code stream}; write failures become OutputException. */
    void print(RecordStream stream, Writer out);
}
