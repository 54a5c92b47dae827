package logq.engine.plan;

import java.util.List;

import logq.engine.exec.PhysicalProject;

public final class LogicalProject implements LogicalNode {
    private final int[] columnIndexes;
    private final List<String> names;
    private final LogicalNode input;

    public LogicalProject(int[] columnIndexes, List<String> names, LogicalNode input) {
        this.columnIndexes = columnIndexes.clone();
        this.names = List.copyOf(names);
        this.input = input;
    }

    public LogicalNode input() { return input; }

    @Override
    public PhysicalPlanResult physical(PhysicalPlanCreator creator) {
        for (int idx : columnIndexes) creator.referenceColumn(idx);
        PhysicalPlanResult child = input.physical(creator);
        return new PhysicalPlanResult(new PhysicalProject(child.plan(), columnIndexes, names), child.variables());
    }

    @Override
    public List<String> outputColumns() { return names; }

    @Override
    public String toString() { return "Project(" + names + ", " + input + ")"; }
}
