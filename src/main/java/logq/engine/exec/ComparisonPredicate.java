package logq.engine.exec;

import logq.engine.query.ComparisonOp;
import logq.engine.types.Tuple;
import logq.engine.types.Value;
import logq.engine.types.Values;

/**
 * Compares two operands. Either side being NULL makes the result UNKNOWN for every operator,
 * including = and !=.
 */
public class ComparisonPredicate implements Predicate {
    private final Operand left;
    private final ComparisonOp op;
    private final Operand right;

    public ComparisonPredicate(Operand left, ComparisonOp op, Operand right) {
        this.left = left;
        this.op = op;
        this.right = right;
    }

    @Override
    public Truth evaluate(Tuple tuple) {
        Value l = left.resolve(tuple);
        Value r = right.resolve(tuple);
        if (l.isNull() || r.isNull()) return Truth.UNKNOWN;
        return Truth.of(switch (op) {
            case EQ -> Values.equalTo(l, r);
            case NE -> !Values.equalTo(l, r);
            case LT -> Values.compare(l, r) < 0;
            case LTE -> Values.compare(l, r) <= 0;
            case GT -> Values.compare(l, r) > 0;
            case GTE -> Values.compare(l, r) >= 0;
        });
    }

    @Override
    public String toString() { return left + " " + op.symbol() + " " + right; }
}
