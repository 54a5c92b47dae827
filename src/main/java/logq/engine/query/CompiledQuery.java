package logq.engine.query;

import logq.engine.exec.PhysicalPlan;
import logq.engine.exec.RecordStream;
import logq.engine.plan.LogicalNode;
import logq.engine.types.Variables;

/**
 * Output of every compilation stage for one query. {@link #open()} may be called any number
 * of times; each call reads the data source from the start.
 */
public record CompiledQuery(SelectStatement statement, LogicalNode logicalPlan, PhysicalPlan physicalPlan,
                            Variables variables) {

    public RecordStream open() { return physicalPlan.get(variables); }

    /** "Query Plan:" header, the physical tree, then the bound variables. */
    public String explain() {
        return "Query Plan:\n" + physicalPlan.explain() + "Variables: " + variables + "\n";
    }
}
