package logq.engine.plan;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;

import logq.engine.exception.PhysicalPlanException;
import logq.engine.storage.DataSource;
import logq.engine.storage.MalformedLinePolicy;

/**
 * State shared by one lowering pass: the data source the scan binds to, fresh variable
 * names, and the schema columns referenced by the nodes above the scan.
 */
public class PhysicalPlanCreator {
    private final DataSource source;
    private final MalformedLinePolicy policy;
    private final Map<String, Integer> counters = new HashMap<>();
    private final BitSet referenced = new BitSet();

    public PhysicalPlanCreator(DataSource source) {
        this(source, MalformedLinePolicy.FAIL);
    }

    public PhysicalPlanCreator(DataSource source, MalformedLinePolicy policy) {
        if (source == null) throw new IllegalArgumentException("data source must not be null");
        this.source = source;
        this.policy = policy == null ? MalformedLinePolicy.FAIL : policy;
    }

    public MalformedLinePolicy policy() { return policy; }

    /** Returns prefix_0, prefix_1, ... for each prefix. */
    public String newVariableName(String prefix) {
        int k = counters.merge(prefix, 1, Integer::sum) - 1;
        return prefix + "_" + k;
    }

    public void referenceColumns(BitSet columns) { referenced.or(columns); }

    public void referenceColumn(int index) { referenced.set(index); }

    /** Columns the scan must decode; all others are left NULL. */
    public boolean[] decodeMask(int columnCount) {
        boolean[] mask = new boolean[columnCount];
        for (int i = referenced.nextSetBit(0); i >= 0 && i < columnCount; i = referenced.nextSetBit(i + 1)) {
            mask[i] = true;
        }
        return mask;
    }

    public DataSource bindDataSource() {
        try {
            source.bind();
        } catch (IOException e) {
            throw new PhysicalPlanException(source.describe(), reason(e), e);
        }
        return source;
    }

    private static String reason(IOException e) {
        if (e instanceof NoSuchFileException) return "file not found";
        if (e instanceof AccessDeniedException) return "permission denied";
        return e.getMessage();
    }
}
