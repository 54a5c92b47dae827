package logq.engine.exception;

import java.util.Collection;

public class InvalidLogFormatException extends LogQueryException {
    private final String tableName;

    public InvalidLogFormatException(String tableName, Collection<String> supported) {
        super("Invalid log file format '" + tableName + "', expected one of " + supported);
        this.tableName = tableName;
    }

    public String tableName() { return tableName; }

    @Override
    public String kind() { return "Invalid Log File Format"; }
}
