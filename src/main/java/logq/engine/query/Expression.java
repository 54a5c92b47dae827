package logq.engine.query;

import logq.engine.catalog.DataType;
import logq.engine.types.Value;

/**
 * WHERE clause syntax tree. Comparisons take a column reference or a literal on either side;
 * AND, OR and NOT combine them.
 */
public interface Expression {

    record Column(String name) implements Expression {
        @Override public String toString() { return name; }
    }

    record Literal(Value value) implements Expression {
        @Override
        public String toString() {
            if (value.type() == DataType.STRING) return "'" + value.asText().replace("'", "''") + "'";
            return value.asText();
        }
    }

    record Comparison(Expression left, ComparisonOp op, Expression right) implements Expression {
        public Comparison {
            if (!isOperand(left) || !isOperand(right)) {
                throw new IllegalArgumentException("comparison operands must be columns or literals");
            }
        }

        private static boolean isOperand(Expression e) { return e instanceof Column || e instanceof Literal; }

        @Override public String toString() { return left + " " + op.symbol() + " " + right; }
    }

    record And(Expression left, Expression right) implements Expression {
        @Override public String toString() { return "(" + left + " AND " + right + ")"; }
    }

    record Or(Expression left, Expression right) implements Expression {
        @Override public String toString() { return "(" + left + " OR " + right + ")"; }
    }

    record Not(Expression operand) implements Expression {
        @Override public String toString() { return "NOT " + operand; }
    }
}
