package logq.engine.exec;

import logq.engine.exception.CreateStreamException;
import logq.engine.query.ComparisonOp;
import logq.engine.types.Value;
import logq.engine.types.Variables;

/**
 * Filter condition as stored in a physical plan. Literal values are not embedded; they are
 * referenced by variable name and looked up when the plan is turned into a stream.
 */
public interface PhysicalExpression {

    Predicate bind(Variables variables);

    /** Operand of a comparison before variables are bound. */
    interface Term {
        Operand bind(Variables variables);
    }

    record ColumnTerm(int index, String name) implements Term {
        @Override public Operand bind(Variables variables) { return new Operand.Column(index, name); }
        @Override public String toString() { return name; }
    }

    record VariableTerm(String variable) implements Term {
        @Override
        public Operand bind(Variables variables) {
            Value v = variables.get(variable);
            if (v == null) throw new CreateStreamException("Variable '" + variable + "' is not bound");
            return new Operand.Constant(v);
        }

        @Override public String toString() { return ":" + variable; }
    }

    record Compare(Term left, ComparisonOp op, Term right) implements PhysicalExpression {
        @Override
        public Predicate bind(Variables variables) {
            return new ComparisonPredicate(left.bind(variables), op, right.bind(variables));
        }

        @Override public String toString() { return left + " " + op.symbol() + " " + right; }
    }

    record And(PhysicalExpression left, PhysicalExpression right) implements PhysicalExpression {
        @Override
        public Predicate bind(Variables variables) {
            return CompoundPredicate.and(left.bind(variables), right.bind(variables));
        }

        @Override public String toString() { return "(" + left + " AND " + right + ")"; }
    }

    record Or(PhysicalExpression left, PhysicalExpression right) implements PhysicalExpression {
        @Override
        public Predicate bind(Variables variables) {
            return CompoundPredicate.or(left.bind(variables), right.bind(variables));
        }

        @Override public String toString() { return "(" + left + " OR " + right + ")"; }
    }

    record Not(PhysicalExpression operand) implements PhysicalExpression {
        @Override
        public Predicate bind(Variables variables) { return CompoundPredicate.not(operand.bind(variables)); }

        @Override public String toString() { return "NOT " + operand; }
    }
}
