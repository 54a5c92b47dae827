package logq.engine.catalog;

/**
 * Value kinds known to the engine. Every column of a log schema has one of these
 * types except NULL, which only describes the absent value.
 */
public enum DataType {
    BOOLEAN,
    INT,
    FLOAT,
    STRING,
    DATE_TIME,
    HOST,
    HTTP_REQUEST,
    NULL;

    public boolean isNumeric() { return this == INT || this == FLOAT; }

    /** Whether values of this type support <, <=, >, >=. */
    public boolean isOrdered() {
        return switch (this) {
            case INT, FLOAT, STRING, DATE_TIME -> true;
            case BOOLEAN, HOST, HTTP_REQUEST, NULL -> false;
        };
    }
}
