package logq.engine.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named runtime bindings produced while compiling a physical plan and consumed when the
 * plan is turned into a stream. Keys are unique; iteration follows binding order.
 */
public final class Variables {
    private final Map<String, Value> bindings = new LinkedHashMap<>();

    public static Variables empty() { return new Variables(); }

    public void bind(String name, Value value) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("variable name must not be empty");
        if (value == null) throw new IllegalArgumentException("variable '" + name + "' bound to null, use Value.NULL");
        if (bindings.putIfAbsent(name, value) != null) {
            throw new IllegalStateException("variable already bound: " + name);
        }
    }

    /** Returns the bound value or null when the name is unbound. */
    public Value get(String name) { return bindings.get(name); }

    public boolean contains(String name) { return bindings.containsKey(name); }

    public int size() { return bindings.size(); }

    public Map<String, Value> asMap() { return Collections.unmodifiableMap(bindings); }

    /** Adds every binding of {@code other}; a name bound on both sides is an error. */
    public Variables merge(Variables other) {
        for (Map.Entry<String, Value> e : other.bindings.entrySet()) bind(e.getKey(), e.getValue());
        return this;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Value> e : bindings.entrySet()) {
            if (!first) sb.append(", ");
            sb.append(e.getKey()).append('=').append(e.getValue().asText());
            first = false;
        }
        return sb.append('}').toString();
    }
}
