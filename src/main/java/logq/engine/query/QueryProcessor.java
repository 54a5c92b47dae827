package logq.engine.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import logq.engine.catalog.LogCatalog;
import logq.engine.exception.InputNotAllConsumedException;
import logq.engine.exception.InvalidLogFormatException;
import logq.engine.exec.RecordStream;
import logq.engine.plan.LogicalNode;
import logq.engine.plan.LogicalPlanner;
import logq.engine.plan.PhysicalPlanCreator;
import logq.engine.plan.PhysicalPlanResult;
import logq.engine.storage.DataSource;
import logq.engine.storage.MalformedLinePolicy;

/**
 * Processor combining parsing, planning, lowering and streaming execution.
 */
public class QueryProcessor {
    private static final Logger LOG = LoggerFactory.getLogger(QueryProcessor.class);

    private final QueryParser parser = new QueryParser();
    private final LogicalPlanner planner = new LogicalPlanner();
    private final MalformedLinePolicy malformedLinePolicy;

    public QueryProcessor() {
        this(MalformedLinePolicy.FAIL);
    }

    public QueryProcessor(MalformedLinePolicy malformedLinePolicy) {
        this.malformedLinePolicy = malformedLinePolicy;
    }

    public CompiledQuery compile(String query, DataSource source) {
        if (query == null) throw new IllegalArgumentException("query must not be null");
        ParseResult parsed = parser.parse(query);
        if (!parsed.remaining().isEmpty()) throw new InputNotAllConsumedException(parsed.remaining());
        SelectStatement statement = parsed.statement();
        LOG.debug("Parsed {}", statement);

        if (!LogCatalog.isSupported(statement.tableName())) {
            throw new InvalidLogFormatException(statement.tableName(), LogCatalog.formatNames());
        }
        LogicalNode logical = planner.plan(statement);
        PhysicalPlanResult physical = logical.physical(new PhysicalPlanCreator(source, malformedLinePolicy));
        LOG.debug("Physical plan for {} with variables {}", source.describe(), physical.variables());
        return new CompiledQuery(statement, logical, physical.plan(), physical.variables());
    }

    /** Compiles the query and opens a stream over its results. */
    public RecordStream stream(String query, DataSource source) {
        return compile(query, source).open();
    }

    /** Compiles the query and describes its plan without reading any line. */
    public String explain(String query, DataSource source) {
        return compile(query, source).explain();
    }
}
