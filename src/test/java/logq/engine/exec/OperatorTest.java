package logq.engine.exec;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import logq.engine.query.ComparisonOp;
import logq.engine.types.Tuple;
import logq.engine.types.Value;

public class OperatorTest {

    private static ListOperator rows() {
        return new ListOperator(List.of(
            List.of(Value.of(1L), Value.of("a")),
            List.of(Value.NULL, Value.of("b")),
            List.of(Value.of(3L), Value.NULL),
            List.of(Value.of(4L), Value.of("d"))));
    }

    private static List<Tuple> drain(Operator op) {
        List<Tuple> out = new ArrayList<>();
        op.open();
        for (Tuple t = op.next(); t != null; t = op.next()) out.add(t);
        op.close();
        return out;
    }

    @Test
    void limitStopsAndStaysExhausted() {
        ListOperator source = rows();
        LimitOperator limit = new LimitOperator(source, 2);
        limit.open();
        assertNotNull(limit.next());
        assertNotNull(limit.next());
        assertNull(limit.next());
        int pulls = source.pulls;
        assertNull(limit.next());
        assertEquals(pulls, source.pulls);
        limit.close();
    }

    @Test
    void limitZeroNeverPulls() {
        ListOperator source = rows();
        assertTrue(drain(new LimitOperator(source, 0)).isEmpty());
        assertEquals(0, source.pulls);
    }

    @Test
    void filterExcludesNullComparisonsInEveryDirection() {
        for (ComparisonOp op : ComparisonOp.values()) {
            Predicate p = new ComparisonPredicate(new Operand.Column(0, "n"), op, new Operand.Constant(Value.of(2L)));
            for (Tuple t : drain(new FilterOperator(rows(), p))) {
                assertFalse(t.get(0).isNull(), op.symbol());
            }
            Predicate flipped = new ComparisonPredicate(new Operand.Constant(Value.of(2L)), op, new Operand.Column(0, "n"));
            for (Tuple t : drain(new FilterOperator(rows(), flipped))) {
                assertFalse(t.get(0).isNull(), op.symbol());
            }
        }
    }

    @Test
    void nullLiteralMatchesNothing() {
        Predicate eq = new ComparisonPredicate(new Operand.Column(0, "n"), ComparisonOp.EQ, new Operand.Constant(Value.NULL));
        Predicate ne = new ComparisonPredicate(new Operand.Column(0, "n"), ComparisonOp.NE, new Operand.Constant(Value.NULL));
        assertTrue(drain(new FilterOperator(rows(), eq)).isEmpty());
        assertTrue(drain(new FilterOperator(rows(), ne)).isEmpty());
    }

    @Test
    void notOfUnknownStillExcludes() {
        Predicate gt = new ComparisonPredicate(new Operand.Column(0, "n"), ComparisonOp.GT, new Operand.Constant(Value.of(2L)));
        List<Tuple> out = drain(new FilterOperator(rows(), CompoundPredicate.not(gt)));
        assertEquals(1, out.size());
        assertEquals(Value.of(1L), out.get(0).get(0));
    }

    @Test
    void orWithUnknownSideKeepsRowWhenOtherSideTrue() {
        Predicate n = new ComparisonPredicate(new Operand.Column(0, "n"), ComparisonOp.GT, new Operand.Constant(Value.of(2L)));
        Predicate s = new ComparisonPredicate(new Operand.Column(1, "s"), ComparisonOp.EQ, new Operand.Constant(Value.of("b")));
        List<Tuple> out = drain(new FilterOperator(rows(), CompoundPredicate.or(n, s)));
        assertEquals(3, out.size());
    }

    @Test
    void projectionReordersColumns() {
        List<Tuple> out = drain(new ProjectionOperator(rows(), new int[] {1, 0}));
        assertEquals(List.of(Value.of("a"), Value.of(1L)), out.get(0).values());
    }
}
