package logq.engine.exec;

import java.util.List;

import logq.engine.exception.CreateStreamException;
import logq.engine.types.Value;
import logq.engine.types.Variables;

/**
 * Row budget read from a variable when the stream is created.
 */
public final class PhysicalLimit implements PhysicalPlan {
    private final PhysicalPlan child;
    private final String limitVariable;

    public PhysicalLimit(PhysicalPlan child, String limitVariable) {
        this.child = child;
        this.limitVariable = limitVariable;
    }

    @Override
    public Operator createOperator(Variables variables) {
        Value v = variables.get(limitVariable);
        if (!(v instanceof Value.IntValue limit) || limit.value() < 0) {
            throw new CreateStreamException("Variable '" + limitVariable + "' must hold a non-negative INT, got "
                + (v == null ? "nothing" : v.asText()));
        }
        return new LimitOperator(child.createOperator(variables), limit.value());
    }

    @Override
    public List<String> outputColumns() { return child.outputColumns(); }

    @Override
    public void explain(StringBuilder out, int depth) {
        PhysicalPlan.indent(out, depth);
        out.append("Limit(:").append(limitVariable).append(")\n");
        child.explain(out, depth + 1);
    }

    @Override
    public String toString() { return explain(); }
}
