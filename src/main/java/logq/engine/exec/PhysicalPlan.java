package logq.engine.exec;

import java.util.List;

import logq.engine.types.Variables;

/**
 * Executable blueprint of a query. Holds no per-execution state: every call to
 * {@link #get(Variables)} builds a fresh operator tree with its own reader.
 */
public interface PhysicalPlan {

    /** Instantiates the operator subtree; throws CreateStreamException on missing or bad bindings. */
    Operator createOperator(Variables variables);

    List<String> outputColumns();

    /** Appends this node and its children to {@code out}, one node per line. */
    void explain(StringBuilder out, int depth);

    default RecordStream get(Variables variables) {
        return new RecordStream(createOperator(variables), outputColumns());
    }

    default String explain() {
        StringBuilder sb = new StringBuilder();
        explain(sb, 0);
        return sb.toString();
    }

    static void indent(StringBuilder out, int depth) {
        out.append("  ".repeat(depth));
    }
}
