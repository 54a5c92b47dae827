package logq.engine.exec;

import java.util.ArrayList;
import java.util.List;

import logq.engine.catalog.LogSchema;
import logq.engine.storage.DataSource;
import logq.engine.storage.LogLineDecoder;
import logq.engine.storage.MalformedLinePolicy;
import logq.engine.types.Variables;

/**
 * Leaf of every plan: a bound data source read with one log schema. Only the columns
 * flagged in {@code decoded} are parsed.
 */
public final class PhysicalScan implements PhysicalPlan {
    private final LogSchema schema;
    private final DataSource source;
    private final boolean[] decoded;
    private final MalformedLinePolicy policy;

    public PhysicalScan(LogSchema schema, DataSource source, boolean[] decoded, MalformedLinePolicy policy) {
        this.schema = schema;
        this.source = source;
        this.decoded = decoded.clone();
        this.policy = policy;
    }

    public LogSchema schema() { return schema; }
    public DataSource source() { return source; }

    @Override
    public Operator createOperator(Variables variables) {
        return new LogScanOperator(source, new LogLineDecoder(schema, decoded), policy);
    }

    @Override
    public List<String> outputColumns() { return schema.columnNames(); }

    @Override
    public void explain(StringBuilder out, int depth) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < decoded.length; i++) if (decoded[i]) names.add(schema.column(i).name());
        PhysicalPlan.indent(out, depth);
        out.append("Scan(format=").append(schema.name())
            .append(", source=").append(source.describe())
            .append(", decode=").append(names)
            .append(", onMalformed=").append(policy)
            .append(")\n");
    }

    @Override
    public String toString() { return explain(); }
}
