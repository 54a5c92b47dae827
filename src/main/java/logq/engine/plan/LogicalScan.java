package logq.engine.plan;

import java.util.List;

import logq.engine.catalog.LogSchema;
import logq.engine.exec.PhysicalScan;
import logq.engine.types.Variables;

public final class LogicalScan implements LogicalNode {
    private final LogSchema schema;

    public LogicalScan(LogSchema schema) {
        this.schema = schema;
    }

    public LogSchema schema() { return schema; }

    @Override
    public PhysicalPlanResult physical(PhysicalPlanCreator creator) {
        var source = creator.bindDataSource();
        var scan = new PhysicalScan(schema, source, creator.decodeMask(schema.columns().size()), creator.policy());
        return new PhysicalPlanResult(scan, Variables.empty());
    }

    @Override
    public List<String> outputColumns() { return schema.columnNames(); }

    @Override
    public String toString() { return "Scan(" + schema.name() + ")"; }
}
