package logq.engine.cli;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import logq.engine.exception.OutputException;
import logq.engine.exec.Record;
import logq.engine.exec.RecordStream;

/**
 * Simple ASCII table printer for query results. Rows are buffered to size the columns, so
 * nothing is written when the stream fails.
 */
public final class TablePrinter implements ResultPrinter {

    @Override
    public void print(RecordStream stream, Writer out) {
        List<List<String>> rows = new ArrayList<>();
        for (Optional<Record> r = stream.next(); r.isPresent(); r = stream.next()) {
            rows.add(r.get().toRow());
        }
        try {
            out.write(render(stream.columns(), rows));
            out.flush();
        } catch (IOException e) {
            throw new OutputException("Failed writing table output: " + e.getMessage(), e);
        }
    }

    static String render(List<String> headers, List<List<String>> rows) {
        StringBuilder sb = new StringBuilder();
        if (rows.isEmpty()) {
            return sb.append("(0 row(s))\n").toString();
        }
        int colCount = headers.size();
        int[] widths = new int[colCount];
        for (int i = 0; i < colCount; i++) widths[i] = headers.get(i).length();
        for (List<String> r : rows) {
            for (int i = 0; i < colCount; i++) {
                if (r.get(i).length() > widths[i]) widths[i] = r.get(i).length();
            }
        }
        String divLine = buildDivider(widths);
        sb.append(divLine).append('\n');
        sb.append(buildRow(headers, widths)).append('\n');
        sb.append(divLine).append('\n');
        for (List<String> r : rows) {
            sb.append(buildRow(r, widths)).append('\n');
        }
        sb.append(divLine).append('\n');
        sb.append('(').append(rows.size()).append(" row(s))\n");
        return sb.toString();
    }

    private static String buildDivider(int[] widths) {
        StringBuilder divider = new StringBuilder();
        divider.append('+');
        for (int w : widths) {
            divider.append("-".repeat(w + 2));
            divider.append('+');
        }
        return divider.toString();
    }

    private static String buildRow(List<String> cells, int[] widths) {
        StringBuilder sb = new StringBuilder();
        sb.append('|');
        for (int i = 0; i < widths.length; i++) {
            sb.append(' ').append(pad(cells.get(i), widths[i])).append(' ').append('|');
        }
        return sb.toString();
    }

    private static String pad(String s, int width) {
        if (s.length() >= width) return s;
        return s + " ".repeat(width - s.length());
    }
}
