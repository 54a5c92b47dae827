package logq.engine.exec;

import java.util.Arrays;
import java.util.List;

import logq.engine.types.Tuple;

/**
 * CompoundPredicate composes child predicates with logical AND / OR / NOT under three-valued logic.
 * Supports variable arity for AND / OR and a single child for NOT.
 * AND stops at the first FALSE child, OR at the first TRUE one.
 */
public final class CompoundPredicate implements Predicate {
    public enum Type { AND, OR, NOT }

    private final Type type;
    private final List<Predicate> children; // for NOT size == 1

    private CompoundPredicate(Type type, List<Predicate> children) {
        if (type == Type.NOT && children.size() != 1) {
            throw new IllegalArgumentException("NOT requires exactly one child predicate");
        }
        if ((type == Type.AND || type == Type.OR) && children.size() < 2) {
            throw new IllegalArgumentException(type + " requires at least two child predicates");
        }
        this.type = type;
        this.children = children;
    }

    public static CompoundPredicate and(Predicate... predicates) {
        return new CompoundPredicate(Type.AND, Arrays.asList(predicates));
    }

    public static CompoundPredicate or(Predicate... predicates) {
        return new CompoundPredicate(Type.OR, Arrays.asList(predicates));
    }

    public static CompoundPredicate not(Predicate predicate) {
        return new CompoundPredicate(Type.NOT, List.of(predicate));
    }

    @Override
    public Truth evaluate(Tuple tuple) {
        return switch (type) {
            case AND -> {
                Truth acc = Truth.TRUE;
                for (Predicate p : children) {
                    acc = acc.and(p.evaluate(tuple));
                    if (acc == Truth.FALSE) break;
                }
                yield acc;
            }
            case OR -> {
                Truth acc = Truth.FALSE;
                for (Predicate p : children) {
                    acc = acc.or(p.evaluate(tuple));
                    if (acc == Truth.TRUE) break;
                }
                yield acc;
            }
            case NOT -> children.get(0).evaluate(tuple).not();
        };
    }

    @Override
    public String toString() {
        return switch (type) {
            case AND -> join("AND");
            case OR -> join("OR");
            case NOT -> "NOT(" + children.get(0) + ")";
        };
    }

    private String join(String op) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) sb.append(' ').append(op).append(' ');
            sb.append(children.get(i));
        }
        sb.append(')');
        return sb.toString();
    }
}
