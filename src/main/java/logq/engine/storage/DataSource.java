package logq.engine.storage;

import java.io.BufferedReader;
import java.io.IOException;

/**
 * Where log lines come from. The engine treats it as an opaque descriptor: it is bound
 * once while the physical plan is compiled and opened once per stream.
 */
public interface DataSource {

    /** Descriptor shown in plans and error messages, e.g. the file path. */
    String describe();

    /** Verifies the source can be read. Called during physical planning. */
    void bind() throws IOException;

    /** Opens a fresh sequential reader positioned at the first line. The caller closes it. */
    BufferedReader openReader() throws IOException;
}
