package co.fanki.machineflow.expression.domain;

import co.fanki.machineflow.shared.Preconditions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable mapping from variable names to values, used to evaluate
 * guards and templates.
 *
 * <p>Dotted names decompose into nested structured values: putting
 * {@code Requirements.needsCustomTool} stores a map {@code Requirements}
 * holding {@code needsCustomTool}. Looking the dotted name up, or
 * traversing {@code Requirements} and then {@code needsCustomTool},
 * yields the same value.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class VariableContext {

    private static final VariableContext EMPTY =
            new VariableContext(Map.of());

    private final Map<String, Value> variables;

    private VariableContext(final Map<String, Value> theVariables) {
        this.variables = Collections.unmodifiableMap(
                new LinkedHashMap<>(theVariables));
    }

    /**
     * Returns the empty context.
     *
     * @return the empty context
     */
    public static VariableContext empty() {
        return EMPTY;
    }

    /**
     * Creates a builder for a new context.
     *
     * @return the builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a context from plain Java objects. Keys may be dotted.
     *
     * @param values the values keyed by variable name
     * @return the context
     */
    public static VariableContext fromJava(final Map<String, ?> values) {
        final Builder builder = builder();
        if (values != null) {
            values.forEach((name, value) ->
                    builder.put(name, Value.fromJava(value)));
        }
        return builder.build();
    }

    /**
     * Resolves a possibly dotted variable name.
     *
     * @param name the variable name, e.g. {@code Requirements.needsTool}
     * @return the value, or {@link Value#UNDEFINED} when any segment is
     *         missing
     */
    public Value lookup(final String name) {
        if (name == null || name.isEmpty()) {
            return Value.UNDEFINED;
        }
        final String[] segments = name.split("\\.");
        Value current = variables.get(segments[0]);
        if (current == null) {
            return Value.UNDEFINED;
        }
        for (int i = 1; i < segments.length; i++) {
            current = current.member(segments[i]);
            if (current.isUndefined()) {
                return current;
            }
        }
        return current;
    }

    /**
     * Checks whether a possibly dotted variable name resolves.
     *
     * @param name the variable name
     * @return true if the name resolves to a value, null included
     */
    public boolean contains(final String name) {
        return !lookup(name).isUndefined();
    }

    /**
     * Returns the top level variables.
     *
     * @return unmodifiable map of root names to values
     */
    public Map<String, Value> variables() {
        return variables;
    }

    /**
     * Returns a copy of this context with one more variable.
     *
     * @param name the possibly dotted variable name
     * @param value the value
     * @return the new context
     */
    public VariableContext with(final String name, final Value value) {
        return builder().putAll(this).put(name, value).build();
    }

    @Override
    public String toString() {
        return "VariableContext" + variables;
    }

    /**
     * Accumulates variables, merging dotted names into nested maps.
     */
    public static final class Builder {

        private final Map<String, Object> tree = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Adds a variable. Later puts override earlier ones; structured
         * values merge with what is already stored under the same name.
         *
         * @param name the possibly dotted name
         * @param value the value
         * @return this builder
         */
        public Builder put(final String name, final Value value) {
            Preconditions.requireNonBlank(name, "Variable name is required");
            Preconditions.requireNonNull(value, "Variable value is required");

            final String[] segments = name.split("\\.");
            Map<String, Object> level = tree;
            for (int i = 0; i < segments.length - 1; i++) {
                level = childLevel(level, segments[i]);
            }
            store(level, segments[segments.length - 1], value);
            return this;
        }

        /**
         * Adds every variable of another context.
         *
         * @param other the context to copy from
         * @return this builder
         */
        public Builder putAll(final VariableContext other) {
            other.variables.forEach(this::put);
            return this;
        }

        /**
         * Builds the immutable context.
         *
         * @return the context
         */
        public VariableContext build() {
            final Map<String, Value> result = new LinkedHashMap<>();
            tree.forEach((name, node) -> result.put(name, freeze(node)));
            return new VariableContext(result);
        }

        @SuppressWarnings("unchecked")
        private static Map<String, Object> childLevel(
                final Map<String, Object> level, final String key) {
            final Object existing = level.get(key);
            if (existing instanceof Map<?, ?>) {
                return (Map<String, Object>) existing;
            }
            final Map<String, Object> child = new LinkedHashMap<>();
            if (existing instanceof Value && ((Value) existing).isMap()) {
                ((Value) existing).asMap().forEach(
                        (k, v) -> store(child, k, v));
            }
            level.put(key, child);
            return child;
        }

        private static void store(final Map<String, Object> level,
                final String key, final Value value) {
            if (value.isMap()) {
                final Map<String, Object> child = childLevel(level, key);
                value.asMap().forEach((k, v) -> store(child, k, v));
            } else {
                level.put(key, value);
            }
        }

        @SuppressWarnings("unchecked")
        private static Value freeze(final Object node) {
            if (node instanceof Value) {
                return (Value) node;
            }
            final Map<String, Value> entries = new LinkedHashMap<>();
            ((Map<String, Object>) node).forEach(
                    (k, v) -> entries.put(k, freeze(v)));
            return Value.map(entries);
        }
    }

}
