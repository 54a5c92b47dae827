package logq.engine.exec;

import java.util.List;

import logq.engine.types.Variables;

public final class PhysicalFilter implements PhysicalPlan {
    private final PhysicalPlan child;
    private final PhysicalExpression condition;

    public PhysicalFilter(PhysicalPlan child, PhysicalExpression condition) {
        this.child = child;
        this.condition = condition;
    }

    public PhysicalExpression condition() { return condition; }

    @Override
    public Operator createOperator(Variables variables) {
        Predicate predicate = condition.bind(variables);
        return new FilterOperator(child.createOperator(variables), predicate);
    }

    @Override
    public List<String> outputColumns() { return child.outputColumns(); }

    @Override
    public void explain(StringBuilder out, int depth) {
        PhysicalPlan.indent(out, depth);
        out.append("Filter(").append(condition).append(")\n");
        child.explain(out, depth + 1);
    }

    @Override
    public String toString() { return explain(); }
}
