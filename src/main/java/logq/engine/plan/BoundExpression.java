package logq.engine.plan;

import java.util.BitSet;

import logq.engine.catalog.DataType;
import logq.engine.query.ComparisonOp;
import logq.engine.types.Value;

/**
 * Filter expression after name resolution and type checking: columns are schema positions
 * and literals are already converted to the type of the column they are compared with.
 */
public interface BoundExpression {

    /** Marks every schema column the expression reads. */
    void collectColumns(BitSet columns);

    record ColumnRef(int index, String name, DataType type) implements BoundExpression {
        @Override public void collectColumns(BitSet columns) { columns.set(index); }
        @Override public String toString() { return name; }
    }

    record Constant(Value value) implements BoundExpression {
        @Override public void collectColumns(BitSet columns) {}
        @Override public String toString() { return value.asText(); }
    }

    record Compare(BoundExpression left, ComparisonOp op, BoundExpression right) implements BoundExpression {
        @Override
        public void collectColumns(BitSet columns) {
            left.collectColumns(columns);
            right.collectColumns(columns);
        }

        @Override public String toString() { return left + " " + op.symbol() + " " + right; }
    }

    record And(BoundExpression left, BoundExpression right) implements BoundExpression {
        @Override
        public void collectColumns(BitSet columns) {
            left.collectColumns(columns);
            right.collectColumns(columns);
        }

        @Override public String toString() { return "(" + left + " AND " + right + ")"; }
    }

    record Or(BoundExpression left, BoundExpression right) implements BoundExpression {
        @Override
        public void collectColumns(BitSet columns) {
            left.collectColumns(columns);
            right.collectColumns(columns);
        }

        @Override public String toString() { return "(" + left + " OR " + right + ")"; }
    }

    record Not(BoundExpression operand) implements BoundExpression {
        @Override public void collectColumns(BitSet columns) { operand.collectColumns(columns); }
        @Override public String toString() { return "NOT " + operand; }
    }
}
