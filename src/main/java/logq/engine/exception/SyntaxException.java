package logq.engine.exception;

import java.util.List;

/**
 * The query text does not match the grammar. Carries every alternative the parser tried
 * at the furthest position it reached, already formatted for the operator.
 */
public class SyntaxException extends LogQueryException {
    private final String query;
    private final int offset;
    private final List<String> diagnostics;

    public SyntaxException(String query, int offset, List<String> diagnostics) {
        super(render(query, offset, diagnostics));
        this.query = query;
        this.offset = offset;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public String query() { return query; }
    public int offset() { return offset; }
    public List<String> diagnostics() { return diagnostics; }

    @Override
    public String kind() { return "Syntax Error"; }

    private static String render(String query, int offset, List<String> diagnostics) {
        StringBuilder sb = new StringBuilder();
        for (String d : diagnostics) sb.append(d).append('\n');
        sb.append("  ").append(query).append('\n');
        sb.append("  ").append(" ".repeat(Math.max(0, Math.min(offset, query.length())))).append('^');
        return sb.toString();
    }
}
