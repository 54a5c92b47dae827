package logq.engine.plan;

import java.util.BitSet;
import java.util.List;

import logq.engine.exec.PhysicalExpression;
import logq.engine.exec.PhysicalFilter;
import logq.engine.types.Variables;

/**
 * Keeps the rows for which the bound condition is TRUE. When lowered, every constant of the
 * condition becomes a const_k variable.
 */
public final class LogicalFilter implements LogicalNode {
    private final BoundExpression condition;
    private final LogicalNode input;

    public LogicalFilter(BoundExpression condition, LogicalNode input) {
        this.condition = condition;
        this.input = input;
    }

    public BoundExpression condition() { return condition; }
    public LogicalNode input() { return input; }

    @Override
    public PhysicalPlanResult physical(PhysicalPlanCreator creator) {
        BitSet columns = new BitSet();
        condition.collectColumns(columns);
        creator.referenceColumns(columns);

        Variables variables = Variables.empty();
        PhysicalExpression lowered = lower(condition, creator, variables);
        PhysicalPlanResult child = input.physical(creator);
        variables.merge(child.variables());
        return new PhysicalPlanResult(new PhysicalFilter(child.plan(), lowered), variables);
    }

    private static PhysicalExpression lower(BoundExpression e, PhysicalPlanCreator creator, Variables variables) {
        if (e instanceof BoundExpression.And and) {
            return new PhysicalExpression.And(lower(and.left(), creator, variables), lower(and.right(), creator, variables));
        }
        if (e instanceof BoundExpression.Or or) {
            return new PhysicalExpression.Or(lower(or.left(), creator, variables), lower(or.right(), creator, variables));
        }
        if (e instanceof BoundExpression.Not not) {
            return new PhysicalExpression.Not(lower(not.operand(), creator, variables));
        }
        if (e instanceof BoundExpression.Compare cmp) {
            return new PhysicalExpression.Compare(term(cmp.left(), creator, variables), cmp.op(),
                term(cmp.right(), creator, variables));
        }
        throw new IllegalArgumentException("Not a condition: " + e);
    }

    private static PhysicalExpression.Term term(BoundExpression e, PhysicalPlanCreator creator, Variables variables) {
        if (e instanceof BoundExpression.ColumnRef col) return new PhysicalExpression.ColumnTerm(col.index(), col.name());
        if (e instanceof BoundExpression.Constant c) {
            String name = creator.newVariableName("const");
            variables.bind(name, c.value());
            return new PhysicalExpression.VariableTerm(name);
        }
        throw new IllegalArgumentException("Not a comparison operand: " + e);
    }

    @Override
    public List<String> outputColumns() { return input.outputColumns(); }

    @Override
    public String toString() { return "Filter(" + condition + ", " + input + ")"; }
}
