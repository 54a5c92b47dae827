package logq.engine.cli;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Optional;

import logq.engine.exception.OutputException;
import logq.engine.exec.Record;
import logq.engine.exec.RecordStream;

/**
 * RFC 4180 CSV without a header line. Written row by row, so rows pulled before a stream
 * error are already on the output.
 */
public final class CsvPrinter implements ResultPrinter {

    @Override
    public void print(RecordStream stream, Writer out) {
        try {
            for (Optional<Record> r = stream.next(); r.isPresent(); r = stream.next()) {
                out.write(formatLine(r.get().toCsvRecord()));
                out.write("\r\n");
            }
            out.flush();
        } catch (IOException e) {
            throw new OutputException("Failed writing CSV output: " + e.getMessage(), e);
        }
    }

    static String formatLine(List<String> fields) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(escape(fields.get(i)));
        }
        return sb.toString();
    }

    /** Quotes a field containing a comma, quote, CR or LF; inner quotes are doubled. */
    static String escape(String field) {
        boolean quote = false;
        for (int i = 0; i < field.length() && !quote; i++) {
            char c = field.charAt(i);
            quote = c == ',' || c == '"' || c == '\r' || c == '\n';
        }
        if (!quote) return field;
        return '"' + field.replace("\"", "\"\"") + '"';
    }
}
