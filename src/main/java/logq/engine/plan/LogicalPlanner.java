package logq.engine.plan;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import logq.engine.catalog.LogCatalog;
import logq.engine.catalog.LogSchema;
import logq.engine.exception.InvalidLogFormatException;
import logq.engine.exception.PlanningException;
import logq.engine.query.SelectStatement;

/**
 * Planner: builds the logical plan for a SelectStatement.
 * Shape is fixed, bottom-up: Scan, Filter (when there is a WHERE), Project (always, with
 * {@code *} expanded to the full schema), Limit (when there is a LIMIT). No reordering.
 */
public class LogicalPlanner {
    private static final Logger LOG = LoggerFactory.getLogger(LogicalPlanner.class);

    private final PredicateCompiler predicateCompiler;

    public LogicalPlanner() {
        this(new PredicateCompiler());
    }

    public LogicalPlanner(PredicateCompiler predicateCompiler) {
        this.predicateCompiler = predicateCompiler;
    }

    public LogicalNode plan(SelectStatement statement) {
        LogSchema schema = LogCatalog.lookup(statement.tableName())
            .orElseThrow(() -> new InvalidLogFormatException(statement.tableName(), LogCatalog.formatNames()));

        LogicalNode root = new LogicalScan(schema);
        if (statement.where() != null) {
            root = new LogicalFilter(predicateCompiler.compile(statement.where(), schema), root);
        }

        List<String> names = statement.isSelectAll() ? schema.columnNames() : statement.columns();
        int[] idxs = new int[names.size()];
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            int found = schema.indexOf(name);
            if (found < 0) {
                throw new PlanningException("Unknown column '" + name + "' in format " + schema.name()
                    + ", known columns: " + schema.columnNames());
            }
            if (!seen.add(name)) throw new PlanningException("Duplicate column '" + name + "' in projection");
            idxs[i] = found;
        }
        root = new LogicalProject(idxs, new ArrayList<>(names), root);

        if (statement.limit() != null) root = new LogicalLimit(statement.limit(), root);
        LOG.debug("Logical plan: {}", root);
        return root;
    }
}
