package logq.engine.cli;

import java.util.Locale;

public enum OutputMode {
    TABLE, CSV, JSON;

    public ResultPrinter printer() {
        return switch (this) {
            case TABLE -> new TablePrinter();
            case CSV -> new CsvPrinter();
            case JSON -> new JsonPrinter();
        };
    }

    public static OutputMode fromString(String s) {
        if (s == null) throw new IllegalArgumentException("output mode must not be null");
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown output mode '" + s + "', expected table, csv or json", e);
        }
    }
}
