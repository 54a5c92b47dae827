package logq.engine.storage;

import java.io.BufferedReader;
import java.io.FilterInputStream;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Standard input. Closing a stream over it leaves the process' stdin open.
 */
public class StdinDataSource implements DataSource {
    private final InputStream in;

    public StdinDataSource() {
        this(System.in);
    }

    public StdinDataSource(InputStream in) {
        this.in = in;
    }

    @Override
    public String describe() { return "<stdin>"; }

    @Override
    public void bind() {
        // always readable
    }

    @Override
    public BufferedReader openReader() {
        InputStream shielded = new FilterInputStream(in) {
            @Override
            public void close() {
                // keep the shared stream open
            }
        };
        return new BufferedReader(new InputStreamReader(shielded, StandardCharsets.UTF_8));
    }

    @Override
    public String toString() { return "Stdin"; }
}
