package io.maptransform.expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable table of the functions an expression may call. Extending a table always yields a
 * new instance; the receiver is never modified.
 */
public final class FunctionTable {
    private static final FunctionTable EMPTY = new FunctionTable(Map.of());

    private final Map<String, MapFunction> functions;

    private FunctionTable(Map<String, MapFunction> functions) {
        this.functions = functions;
    }

    public static FunctionTable empty() {
        return EMPTY;
    }

    public static FunctionTable of(Map<String, MapFunction> functions) {
        return EMPTY.withAll(functions);
    }

    public FunctionTable with(String name, MapFunction function) {
        return withAll(Map.of(name, function));
    }

    public FunctionTable withAll(FunctionTable other) {
        return withAll(other.functions);
    }

    public FunctionTable withAll(Map<String, MapFunction> additions) {
        Map<String, MapFunction> copy = new LinkedHashMap<>(functions);
        for (Map.Entry<String, MapFunction> entry : additions.entrySet()) {
            Objects.requireNonNull(entry.getKey(), "function name");
            copy.put(entry.getKey(), Objects.requireNonNull(entry.getValue(), entry.getKey()));
        }
        return new FunctionTable(Collections.unmodifiableMap(copy));
    }

    public MapFunction get(String name) {
        return functions.get(name);
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public Set<String> names() {
        return functions.keySet();
    }

    public int size() {
        return functions.size();
    }
}
