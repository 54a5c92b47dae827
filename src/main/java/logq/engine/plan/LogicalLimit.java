package logq.engine.plan;

import java.util.List;

import logq.engine.exec.PhysicalLimit;
import logq.engine.types.Value;
import logq.engine.types.Variables;

public final class LogicalLimit implements LogicalNode {
    private final long limit;
    private final LogicalNode input;

    public LogicalLimit(long limit, LogicalNode input) {
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0: " + limit);
        this.limit = limit;
        this.input = input;
    }

    public long limit() { return limit; }
    public LogicalNode input() { return input; }

    @Override
    public PhysicalPlanResult physical(PhysicalPlanCreator creator) {
        String variable = creator.newVariableName("limit");
        Variables variables = Variables.empty();
        variables.bind(variable, Value.of(limit));
        PhysicalPlanResult child = input.physical(creator);
        variables.merge(child.variables());
        return new PhysicalPlanResult(new PhysicalLimit(child.plan(), variable), variables);
    }

    @Override
    public List<String> outputColumns() { return input.outputColumns(); }

    @Override
    public String toString() { return "Limit(" + limit + ", " + input + ")"; }
}
