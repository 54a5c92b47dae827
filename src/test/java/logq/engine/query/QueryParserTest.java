package logq.engine.query;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import logq.engine.exception.SyntaxException;
import logq.engine.types.Value;

public class QueryParserTest {
    private final QueryParser parser = new QueryParser();

    @Test
    void parsesSelectAllWithoutClauses() {
        ParseResult r = parser.parse("SELECT * FROM elb");
        assertEquals("", r.remaining());
        assertEquals("elb", r.statement().tableName());
        assertTrue(r.statement().isSelectAll());
        assertNull(r.statement().where());
        assertNull(r.statement().limit());
    }

    @Test
    void keywordsAreCaseInsensitiveAndColumnsKeepOrder() {
        ParseResult r = parser.parse("select elb_status_code, timestamp from elb limit 3;");
        assertEquals(List.of("elb_status_code", "timestamp"), r.statement().columns());
        assertEquals(3L, r.statement().limit());
        assertEquals("", r.remaining());
    }

    @Test
    void andBindsTighterThanOr() {
        SelectStatement s = parser.parse("SELECT * FROM elb WHERE a = 1 OR b = 2 AND c = 3").statement();
        Expression.Or or = assertInstanceOf(Expression.Or.class, s.where());
        assertInstanceOf(Expression.Comparison.class, or.left());
        assertInstanceOf(Expression.And.class, or.right());
    }

    @Test
    void parenthesesAndNotOverridePrecedence() {
        SelectStatement s = parser.parse("SELECT * FROM elb WHERE NOT (a = 1 OR b = 2) AND c <> 'x'").statement();
        Expression.And and = assertInstanceOf(Expression.And.class, s.where());
        Expression.Not not = assertInstanceOf(Expression.Not.class, and.left());
        assertInstanceOf(Expression.Or.class, not.operand());
        Expression.Comparison c = assertInstanceOf(Expression.Comparison.class, and.right());
        assertEquals(ComparisonOp.NE, c.op());
        assertEquals(new Expression.Literal(Value.of("x")), c.right());
    }

    @Test
    void parsesLiteralKinds() {
        SelectStatement s = parser.parse(
            "SELECT * FROM elb WHERE a = -42 AND b >= 0.5 AND c = \"it's\" AND d = 'a''b' AND e = TRUE AND f != NULL")
            .statement();
        String text = s.where().toString();
        assertTrue(text.contains("a = -42"), text);
        assertTrue(text.contains("b >= 0.5"), text);
        assertTrue(text.contains("e = true"), text);
        assertTrue(text.contains("f != NULL"), text);
    }

    @Test
    void returnsTrailingInputUnconsumed() {
        ParseResult r = parser.parse("SELECT * FROM s3 WHERE status = 200 extra_garbage");
        assertEquals("extra_garbage", r.remaining());
        assertNotNull(r.statement().where());
    }

    @Test
    void missingFromReportsPositionAndContext() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parser.parse("SELECT a b FROM elb"));
        assertEquals(9, e.offset());
        String msg = e.getMessage();
        assertTrue(msg.contains("expected FROM"), msg);
        assertTrue(msg.contains("expected ','"), msg);
        assertTrue(msg.contains("SELECT a b FROM elb"), msg);
        assertTrue(msg.endsWith("^"), msg);
    }

    @Test
    void accumulatesEveryAlternativeAtFailurePoint() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parser.parse("SELECT * FROM elb WHERE = 3"));
        List<String> d = e.diagnostics();
        assertTrue(d.size() >= 3, d.toString());
        assertTrue(d.stream().anyMatch(x -> x.contains("expected '('")), d.toString());
        assertTrue(d.stream().anyMatch(x -> x.contains("expected literal")), d.toString());
        assertTrue(d.stream().anyMatch(x -> x.contains("expected identifier")), d.toString());
        assertTrue(d.stream().allMatch(x -> x.contains("WHERE clause")), d.toString());
    }

    @Test
    void committedLimitClauseFailsHard() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parser.parse("SELECT * FROM elb LIMIT ten"));
        assertTrue(e.getMessage().contains("unsigned integer"), e.getMessage());
        assertTrue(e.getMessage().contains("LIMIT clause"), e.getMessage());
    }

    @Test
    void keywordIsNotAnIdentifier() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parser.parse("SELECT from FROM elb"));
        assertTrue(e.getMessage().contains("found keyword FROM"), e.getMessage());
    }

    @Test
    void unterminatedStringIsReported() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parser.parse("SELECT * FROM elb WHERE a = 'abc"));
        assertTrue(e.getMessage().contains("closing '"), e.getMessage());
    }
}
