package logq.engine.catalog;

import java.util.List;

/**
 * Column layout of one log format.
 * minimumFieldCount: lines with fewer fields are malformed; columns past it decode to NULL when absent.
 * acceptsTrailingFields: whether fields beyond the last column are ignored rather than rejected.
 */
public record LogSchema(String name, List<ColumnSchema> columns, int minimumFieldCount, boolean acceptsTrailingFields) {

    public LogSchema {
        columns = List.copyOf(columns);
        if (minimumFieldCount < 1 || minimumFieldCount > columns.size()) {
            throw new IllegalArgumentException("minimumFieldCount out of range for " + name + ": " + minimumFieldCount);
        }
    }

    /** Returns the position of the column or -1 if the schema has no such column. */
    public int indexOf(String columnName) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(columnName)) return i;
        }
        return -1;
    }

    public ColumnSchema column(int index) { return columns.get(index); }

    public List<String> columnNames() {
        return columns.stream().map(ColumnSchema::name).toList();
    }
}
