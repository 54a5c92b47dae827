package logq.engine.query;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import logq.engine.exception.SyntaxException;
import logq.engine.types.Value;

/**
 * Recursive-descent parser for the query language:
 * <pre>
 *   SELECT &lt;cols|*&gt; FROM &lt;format&gt; [WHERE &lt;condition&gt;] [LIMIT &lt;n&gt;] [;]
 * </pre>
 * Conditions compare a column or literal with a column or literal using =, !=, &lt;&gt;, &lt;, &lt;=, &gt;, &gt;=
 * and combine comparisons with NOT, AND, OR and parentheses. AND binds tighter than OR.
 * Keywords are case-insensitive. Literals: 'text' or "text" (quote doubled to escape),
 * integers, decimals, TRUE, FALSE, NULL.
 *
 * <p>The parser stops after the statement and hands back the rest of the input untouched;
 * rejecting leftovers is up to the caller. On failure every expectation that failed at the
 * furthest position reached is reported, not only the first one.
 */
public class QueryParser {
    private static final Set<String> KEYWORDS = Set.of(
        "SELECT", "FROM", "WHERE", "LIMIT", "AND", "OR", "NOT", "TRUE", "FALSE", "NULL");

    public ParseResult parse(String query) {
        if (query == null) throw new IllegalArgumentException("query must not be null");
        return new Run(query).select();
    }

    /** State of a single parse; the parser itself stays reusable. */
    private static final class Run {
        private final String input;
        private int pos;
        private int furthest = -1;
        private final Set<String> expectations = new LinkedHashSet<>();
        private final Deque<String> contexts = new ArrayDeque<>();

        Run(String input) { this.input = input; }

        ParseResult select() {
            contexts.push("SELECT statement");
            skipWs();
            if (!keyword("SELECT")) throw failure();
            List<String> columns = projection();
            skipWs();
            if (!keyword("FROM")) throw failure();
            contexts.push("FROM clause");
            skipWs();
            String table = identifier();
            if (table == null) throw failure();
            contexts.pop();

            Expression where = null;
            int save = pos;
            skipWs();
            if (keyword("WHERE")) {
                contexts.push("WHERE clause");
                where = orExpr();
                contexts.pop();
            } else {
                pos = save;
            }

            Long limit = null;
            save = pos;
            skipWs();
            if (keyword("LIMIT")) {
                contexts.push("LIMIT clause");
                skipWs();
                limit = unsignedInteger();
                if (limit == null) throw failure();
                contexts.pop();
            } else {
                pos = save;
            }

            skipWs();
            if (peek() == ';') pos++;
            skipWs();
            return new ParseResult(input.substring(pos), new SelectStatement(table, columns, where, limit));
        }

        private List<String> projection() {
            contexts.push("projection");
            skipWs();
            List<String> columns = new ArrayList<>();
            if (peek() == '*') {
                pos++;
                contexts.pop();
                return columns;
            }
            expect("'*'");
            String first = identifier();
            if (first == null) throw failure();
            columns.add(first);
            while (true) {
                int save = pos;
                skipWs();
                if (peek() != ',') {
                    expect("','");
                    pos = save;
                    break;
                }
                pos++;
                skipWs();
                String next = identifier();
                if (next == null) throw failure();
                columns.add(next);
            }
            contexts.pop();
            return columns;
        }

        private Expression orExpr() {
            Expression left = andExpr();
            while (true) {
                int save = pos;
                skipWs();
                if (!keyword("OR")) {
                    pos = save;
                    return left;
                }
                left = new Expression.Or(left, andExpr());
            }
        }

        private Expression andExpr() {
            Expression left = notExpr();
            while (true) {
                int save = pos;
                skipWs();
                if (!keyword("AND")) {
                    pos = save;
                    return left;
                }
                left = new Expression.And(left, notExpr());
            }
        }

        private Expression notExpr() {
            skipWs();
            if (keyword("NOT")) return new Expression.Not(notExpr());
            return primary();
        }

        private Expression primary() {
            skipWs();
            if (peek() == '(') {
                pos++;
                Expression inner = orExpr();
                skipWs();
                if (peek() != ')') {
                    expect("')'");
                    throw failure();
                }
                pos++;
                return inner;
            }
            expect("'('");
            contexts.push("comparison");
            Expression left = operand();
            if (left == null) throw failure();
            skipWs();
            ComparisonOp op = comparisonOp();
            if (op == null) throw failure();
            skipWs();
            Expression right = operand();
            if (right == null) throw failure();
            contexts.pop();
            return new Expression.Comparison(left, op, right);
        }

        private Expression operand() {
            Value literal = literal();
            if (literal != null) return new Expression.Literal(literal);
            String name = identifier();
            if (name != null) return new Expression.Column(name);
            return null;
        }

        private ComparisonOp comparisonOp() {
            char c = peek();
            char d = peekAt(pos + 1);
            ComparisonOp op = null;
            int width = 1;
            if (c == '=') op = ComparisonOp.EQ;
            else if (c == '!' && d == '=') { op = ComparisonOp.NE; width = 2; }
            else if (c == '<' && d == '>') { op = ComparisonOp.NE; width = 2; }
            else if (c == '<' && d == '=') { op = ComparisonOp.LTE; width = 2; }
            else if (c == '<') op = ComparisonOp.LT;
            else if (c == '>' && d == '=') { op = ComparisonOp.GTE; width = 2; }
            else if (c == '>') op = ComparisonOp.GT;
            if (op == null) {
                expect("comparison operator (=, !=, <>, <, <=, >, >=)");
                return null;
            }
            pos += width;
            return op;
        }

        private Value literal() {
            char c = peek();
            if (c == '\'' || c == '"') return quoted(c);
            if (c == '-' || Character.isDigit(c)) return number();
            if (matchKeyword("TRUE")) return Value.of(true);
            if (matchKeyword("FALSE")) return Value.of(false);
            if (matchKeyword("NULL")) return Value.NULL;
            expect("literal");
            return null;
        }

        private Value quoted(char quote) {
            int start = pos;
            pos++;
            StringBuilder sb = new StringBuilder();
            while (pos < input.length()) {
                char ch = input.charAt(pos);
                if (ch == quote) {
                    if (peekAt(pos + 1) == quote) {
                        sb.append(quote);
                        pos += 2;
                        continue;
                    }
                    pos++;
                    return Value.of(sb.toString());
                }
                sb.append(ch);
                pos++;
            }
            expect("closing " + quote + " for string starting at position " + (start + 1));
            throw failure();
        }

        private Value number() {
            int start = pos;
            if (peek() == '-') pos++;
            if (!Character.isDigit(peek())) {
                pos = start;
                expect("literal");
                return null;
            }
            while (Character.isDigit(peek())) pos++;
            boolean decimal = false;
            if (peek() == '.' && Character.isDigit(peekAt(pos + 1))) {
                decimal = true;
                pos++;
                while (Character.isDigit(peek())) pos++;
            }
            if (peek() == 'e' || peek() == 'E') {
                int save = pos;
                pos++;
                if (peek() == '+' || peek() == '-') pos++;
                if (Character.isDigit(peek())) {
                    decimal = true;
                    while (Character.isDigit(peek())) pos++;
                } else {
                    pos = save;
                }
            }
            if (isIdentifierPart(peek())) {
                expect("end of number");
                throw failure();
            }
            String text = input.substring(start, pos);
            if (decimal) {
                double d = Double.parseDouble(text);
                if (Double.isInfinite(d)) {
                    pos = start;
                    expect("number in double range");
                    throw failure();
                }
                return Value.of(d);
            }
            try {
                return Value.of(Long.parseLong(text));
            } catch (NumberFormatException e) {
                pos = start;
                expect("integer in 64-bit range");
                throw failure();
            }
        }

        private Long unsignedInteger() {
            int start = pos;
            while (Character.isDigit(peek())) pos++;
            if (start == pos || isIdentifierPart(peek())) {
                pos = start;
                expect("unsigned integer");
                return null;
            }
            try {
                return Long.parseLong(input.substring(start, pos));
            } catch (NumberFormatException e) {
                pos = start;
                expect("unsigned integer in 64-bit range");
                return null;
            }
        }

        private String identifier() {
            int start = pos;
            if (!isIdentifierStart(peek())) {
                expect("identifier");
                return null;
            }
            while (isIdentifierPart(peek())) pos++;
            String word = input.substring(start, pos);
            if (KEYWORDS.contains(word.toUpperCase(Locale.ROOT))) {
                pos = start;
                expect("identifier (found keyword " + word.toUpperCase(Locale.ROOT) + ")");
                return null;
            }
            return word;
        }

        private boolean keyword(String kw) {
            if (matchKeyword(kw)) return true;
            expect(kw);
            return false;
        }

        private boolean matchKeyword(String kw) {
            int end = pos + kw.length();
            if (input.regionMatches(true, pos, kw, 0, kw.length()) && !isIdentifierPart(peekAt(end))) {
                pos = end;
                return true;
            }
            return false;
        }

        private void expect(String what) {
            if (pos > furthest) {
                furthest = pos;
                expectations.clear();
            }
            if (pos == furthest) expectations.add(what + "|" + contextPath());
        }

        private SyntaxException failure() {
            int at = Math.max(furthest, 0);
            String found = at >= input.length()
                ? "end of input"
                : "\"" + abbreviate(input.substring(at)) + "\"";
            List<String> diagnostics = new ArrayList<>();
            for (String e : expectations) {
                int bar = e.lastIndexOf('|');
                diagnostics.add("in " + e.substring(bar + 1) + ": expected " + e.substring(0, bar)
                    + " at position " + (at + 1) + ", found " + found);
            }
            if (diagnostics.isEmpty()) diagnostics.add("unexpected " + found + " at position " + (at + 1));
            return new SyntaxException(input, at, diagnostics);
        }

        private String contextPath() {
            StringBuilder sb = new StringBuilder();
            Iterator<String> it = contexts.descendingIterator();
            while (it.hasNext()) {
                if (sb.length() > 0) sb.append(" > ");
                sb.append(it.next());
            }
            return sb.toString();
        }

        private void skipWs() {
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) pos++;
        }

        private char peek() { return peekAt(pos); }

        private char peekAt(int i) { return i < input.length() ? input.charAt(i) : '\0'; }

        private static boolean isIdentifierStart(char c) {
            return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
        }

        private static boolean isIdentifierPart(char c) {
            return isIdentifierStart(c) || (c >= '0' && c <= '9');
        }

        private static String abbreviate(String s) {
            return s.length() <= 24 ? s : s.substring(0, 24) + "...";
        }
    }
}
