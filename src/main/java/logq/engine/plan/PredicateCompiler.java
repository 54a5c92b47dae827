package logq.engine.plan;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import logq.engine.catalog.ColumnSchema;
import logq.engine.catalog.DataType;
import logq.engine.catalog.LogSchema;
import logq.engine.exception.PlanningException;
import logq.engine.query.ComparisonOp;
import logq.engine.query.Expression;
import logq.engine.types.Host;
import logq.engine.types.HttpRequest;
import logq.engine.types.Value;

/**
 * Resolves the column names of a WHERE expression against a log schema and type-checks it.
 * Literals compared with a column are converted to that column's type here, so a bad literal
 * fails the query before any line is read.
 */
public class PredicateCompiler {

    public BoundExpression compile(Expression expression, LogSchema schema) {
        if (expression == null) throw new IllegalArgumentException("expression must not be null");
        if (expression instanceof Expression.And and) {
            return new BoundExpression.And(compile(and.left(), schema), compile(and.right(), schema));
        }
        if (expression instanceof Expression.Or or) {
            return new BoundExpression.Or(compile(or.left(), schema), compile(or.right(), schema));
        }
        if (expression instanceof Expression.Not not) {
            return new BoundExpression.Not(compile(not.operand(), schema));
        }
        if (expression instanceof Expression.Comparison cmp) {
            return compileComparison(cmp, schema);
        }
        throw new PlanningException("Not a boolean condition: " + expression);
    }

    private BoundExpression compileComparison(Expression.Comparison cmp, LogSchema schema) {
        Expression left = cmp.left();
        Expression right = cmp.right();
        ComparisonOp op = cmp.op();

        if (left instanceof Expression.Column lc && right instanceof Expression.Column rc) {
            BoundExpression.ColumnRef l = resolve(lc.name(), schema);
            BoundExpression.ColumnRef r = resolve(rc.name(), schema);
            if (!compatible(l.type(), r.type())) {
                throw new PlanningException("Cannot compare column '" + l.name() + "' (" + l.type() + ") with column '"
                    + r.name() + "' (" + r.type() + ")");
            }
            checkOperator(op, l.type(), "column '" + l.name() + "'");
            return new BoundExpression.Compare(l, op, r);
        }
        if (left instanceof Expression.Column lc && right instanceof Expression.Literal lit) {
            BoundExpression.ColumnRef col = resolve(lc.name(), schema);
            checkOperator(op, col.type(), "column '" + col.name() + "'");
            return new BoundExpression.Compare(col, op, new BoundExpression.Constant(coerce(lit.value(), col)));
        }
        if (left instanceof Expression.Literal lit && right instanceof Expression.Column rc) {
            BoundExpression.ColumnRef col = resolve(rc.name(), schema);
            checkOperator(op, col.type(), "column '" + col.name() + "'");
            return new BoundExpression.Compare(new BoundExpression.Constant(coerce(lit.value(), col)), op, col);
        }
        Value l = ((Expression.Literal) left).value();
        Value r = ((Expression.Literal) right).value();
        if (!compatible(l.type(), r.type())) {
            throw new PlanningException("Cannot compare literal " + left + " (" + l.type() + ") with literal "
                + right + " (" + r.type() + ")");
        }
        checkOperator(op, l.isNull() ? r.type() : l.type(), "literal " + left);
        return new BoundExpression.Compare(new BoundExpression.Constant(l), op, new BoundExpression.Constant(r));
    }

    private BoundExpression.ColumnRef resolve(String name, LogSchema schema) {
        int idx = schema.indexOf(name);
        if (idx < 0) {
            throw new PlanningException("Unknown column '" + name + "' in format " + schema.name()
                + ", known columns: " + schema.columnNames());
        }
        ColumnSchema c = schema.column(idx);
        return new BoundExpression.ColumnRef(idx, c.name(), c.type());
    }

    private static boolean compatible(DataType a, DataType b) {
        return a == b || a == DataType.NULL || b == DataType.NULL || (a.isNumeric() && b.isNumeric());
    }

    private static void checkOperator(ComparisonOp op, DataType type, String what) {
        if (op.isOrdering() && type != DataType.NULL && !type.isOrdered()) {
            throw new PlanningException("Operator " + op.symbol() + " is not supported for " + what + " of type " + type
                + ", only = and != are");
        }
    }

    /**
     * Converts a literal to the type of the column it is compared with. NULL passes through, and so
     * does a FLOAT literal against an INT column, since numbers compare across the two types.
     */
    Value coerce(Value literal, BoundExpression.ColumnRef column) {
        DataType target = column.type();
        DataType source = literal.type();
        if (source == DataType.NULL || source == target) return literal;
        try {
            Value converted = switch (target) {
                case FLOAT -> source == DataType.INT ? Value.of((double) ((Value.IntValue) literal).value()) : null;
                case DATE_TIME -> source == DataType.STRING ? Value.of(parseTimestamp(literal.asText())) : null;
                case HOST -> source == DataType.STRING ? Value.of(Host.parse(literal.asText())) : null;
                case HTTP_REQUEST -> source == DataType.STRING ? Value.of(HttpRequest.parse(literal.asText())) : null;
                case INT -> source == DataType.FLOAT ? literal : null;
                case STRING, BOOLEAN -> null;
                case NULL -> throw new IllegalStateException("column '" + column.name() + "' has type NULL");
            };
            if (converted != null) return converted;
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new PlanningException(mismatch(column, literal) + ": " + e.getMessage(), e);
        }
        throw new PlanningException(mismatch(column, literal));
    }

    private static String mismatch(BoundExpression.ColumnRef column, Value literal) {
        return "Type mismatch for column '" + column.name() + "': expected " + column.type() + " but got "
            + new Expression.Literal(literal) + " (" + literal.type() + ")";
    }

    /**
     * Accepts 2019-02-06T00:00:38Z / +01:00 offsets, a local date-time (read as UTC), or a bare date
     * (midnight UTC).
     */
    static OffsetDateTime parseTimestamp(String text) {
        String s = text.trim();
        try {
            return OffsetDateTime.parse(s, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        } catch (DateTimeParseException ignored) {
            // try the offset-less forms below
        }
        try {
            return LocalDateTime.parse(s, DateTimeFormatter.ISO_LOCAL_DATE_TIME).atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // fall through to plain dates
        }
        return LocalDate.parse(s, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay().atOffset(ZoneOffset.UTC);
    }
}
