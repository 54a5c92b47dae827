package logq.engine.storage;

import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import logq.engine.catalog.ColumnSchema;
import logq.engine.catalog.LogSchema;
import logq.engine.types.Tuple;
import logq.engine.types.Value;

/**
 * Decodes raw lines of one log format into tuples.
 * Only the columns flagged in {@code decoded} are parsed; the others hold NULL. The field
 * count is always validated, so a line with a broken layout fails even if none of its
 * columns are referenced.
 */
public class LogLineDecoder {
    private final LogSchema schema;
    private final boolean[] decoded;

    public LogLineDecoder(LogSchema schema) {
        this(schema, all(schema.columns().size()));
    }

    public LogLineDecoder(LogSchema schema, boolean[] decoded) {
        if (decoded.length != schema.columns().size()) {
            throw new IllegalArgumentException("decode mask has " + decoded.length + " entries, schema " + schema.name()
                + " has " + schema.columns().size() + " columns");
        }
        this.schema = schema;
        this.decoded = decoded.clone();
    }

    public LogSchema schema() { return schema; }

    public Tuple decode(String line, long lineNumber) throws MalformedLineException {
        List<String> fields;
        try {
            fields = LineTokenizer.tokenize(line);
        } catch (IllegalArgumentException e) {
            throw new MalformedLineException(schema.name(), lineNumber, e.getMessage(), e);
        }
        List<ColumnSchema> columns = schema.columns();
        int count = fields.size();
        if (count < schema.minimumFieldCount()) {
            throw new MalformedLineException(schema.name(), lineNumber,
                "expected at least " + schema.minimumFieldCount() + " fields but found " + count, null);
        }
        if (count > columns.size() && !schema.acceptsTrailingFields()) {
            throw new MalformedLineException(schema.name(), lineNumber,
                "expected " + columns.size() + " fields but found " + count, null);
        }
        List<Value> values = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            if (!decoded[i] || i >= count) {
                values.add(Value.NULL);
                continue;
            }
            ColumnSchema col = columns.get(i);
            String raw = fields.get(i);
            try {
                values.add(col.decoder().decode(raw));
            } catch (IllegalArgumentException | DateTimeException e) {
                throw new MalformedLineException(schema.name(), lineNumber,
                    "cannot decode field '" + col.name() + "' as " + col.type() + " from \"" + raw + "\"", e);
            }
        }
        return new Tuple(values);
    }

    private static boolean[] all(int n) {
        boolean[] mask = new boolean[n];
        Arrays.fill(mask, true);
        return mask;
    }
}
