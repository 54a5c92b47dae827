package logq.engine.exec;

import java.util.List;

import logq.engine.types.Variables;

public final class PhysicalProject implements PhysicalPlan {
    private final PhysicalPlan child;
    private final int[] columnIndexes;
    private final List<String> names;

    public PhysicalProject(PhysicalPlan child, int[] columnIndexes, List<String> names) {
        if (columnIndexes.length != names.size()) {
            throw new IllegalArgumentException(columnIndexes.length + " indexes for " + names.size() + " names");
        }
        this.child = child;
        this.columnIndexes = columnIndexes.clone();
        this.names = List.copyOf(names);
    }

    @Override
    public Operator createOperator(Variables variables) {
        return new ProjectionOperator(child.createOperator(variables), columnIndexes);
    }

    @Override
    public List<String> outputColumns() { return names; }

    @Override
    public void explain(StringBuilder out, int depth) {
        PhysicalPlan.indent(out, depth);
        out.append("Project(").append(names).append(")\n");
        child.explain(out, depth + 1);
    }

    @Override
    public String toString() { return explain(); }
}
