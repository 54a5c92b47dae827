package logq.engine.storage;

import java.io.BufferedReader;
import java.io.StringReader;
import java.util.List;

/**
 * Lines held in memory; every opened reader starts from the first line again.
 */
public class InMemoryDataSource implements DataSource {
    private final String name;
    private final List<String> lines;

    public InMemoryDataSource(String name, List<String> lines) {
        this.name = name;
        this.lines = List.copyOf(lines);
    }

    public static InMemoryDataSource of(String... lines) {
        return new InMemoryDataSource("<memory>", List.of(lines));
    }

    public static InMemoryDataSource ofText(String text) {
        return new InMemoryDataSource("<memory>", text.lines().toList());
    }

    @Override
    public String describe() { return name; }

    @Override
    public void bind() {
        // nothing to verify
    }

    @Override
    public BufferedReader openReader() {
        return new BufferedReader(new StringReader(String.join("\n", lines)));
    }

    @Override
    public String toString() { return "Memory(" + name + ", " + lines.size() + " lines)"; }
}
