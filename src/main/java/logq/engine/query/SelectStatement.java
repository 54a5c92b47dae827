package logq.engine.query;

import java.util.List;

/**
 * Parsed SELECT statement.
 * columns: empty list means SELECT *.
 * where: null when there is no WHERE clause.
 * limit: null when there is no LIMIT clause.
 */
public record SelectStatement(String tableName, List<String> columns, Expression where, Long limit) {

    public SelectStatement {
        columns = List.copyOf(columns);
        if (limit != null && limit < 0) throw new IllegalArgumentException("limit must not be negative");
    }

    public boolean isSelectAll() { return columns.isEmpty(); }
}
