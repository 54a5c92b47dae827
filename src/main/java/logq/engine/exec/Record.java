package logq.engine.exec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import logq.engine.types.Value;

/**
 * One result row: output column names paired with their values, in projection order.
 * A new instance is created for every row pulled from a stream.
 */
public final class Record {
    private final List<String> names;
    private final List<Value> values;

    public Record(List<String> names, List<Value> values) {
        if (names.size() != values.size()) {
            throw new IllegalArgumentException(names.size() + " column names for " + values.size() + " values");
        }
        this.names = List.copyOf(names);
        this.values = List.copyOf(values);
    }

    public List<String> names() { return names; }
    public List<Value> values() { return values; }
    public int size() { return values.size(); }

    /** Value of the named column, or null if the record has no such column. */
    public Value get(String name) {
        int idx = names.indexOf(name);
        return idx < 0 ? null : values.get(idx);
    }

    /** Display cells for the table printer; NULL shows as "NULL". */
    public List<String> toRow() {
        List<String> cells = new ArrayList<>(values.size());
        for (Value v : values) cells.add(v.asText());
        return cells;
    }

    /** CSV fields; NULL becomes an empty field. */
    public List<String> toCsvRecord() {
        List<String> fields = new ArrayList<>(values.size());
        for (Value v : values) fields.add(v.isNull() ? "" : v.asText());
        return fields;
    }

    /** (name, value) pairs for structured output. */
    public List<Map.Entry<String, Value>> toTuples() {
        List<Map.Entry<String, Value>> out = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) out.add(Map.entry(names.get(i), values.get(i)));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record other)) return false;
        return names.equals(other.names) && values.equals(other.values);
    }

    @Override
    public int hashCode() { return 31 * names.hashCode() + values.hashCode(); }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Record{");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(names.get(i)).append('=').append(values.get(i).asText());
        }
        return sb.append('}').toString();
    }
}
