package co.fanki.machineflow.execution.domain;

import co.fanki.machineflow.expression.domain.Value;
import co.fanki.machineflow.expression.domain.VariableContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runtime values written to context nodes.
 *
 * <p>The only state shared between paths. Every write builds a new map and
 * swaps it in, so a reader always sees either all or none of a write.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ContextStore {

    private volatile Map<String, Map<String, Value>> contexts = Map.of();

    /**
     * Merges fields into a context, replacing fields with the same name.
     *
     * @param contextName the context node
     * @param fields the fields to write
     */
    public void merge(final String contextName,
            final Map<String, Value> fields) {
        if (fields.isEmpty()) {
            return;
        }
        final Map<String, Map<String, Value>> next =
                new LinkedHashMap<>(contexts);
        final Map<String, Value> merged = new LinkedHashMap<>(
                next.getOrDefault(contextName, Map.of()));
        merged.putAll(fields);
        next.put(contextName, Collections.unmodifiableMap(merged));
        contexts = Collections.unmodifiableMap(next);
    }

    /**
     * Returns the values of one context.
     *
     * @param contextName the context node
     * @return the fields, empty if never written
     */
    public Map<String, Value> values(final String contextName) {
        return contexts.getOrDefault(contextName, Map.of());
    }

    /**
     * Returns every written context.
     *
     * @return context name to fields
     */
    public Map<String, Map<String, Value>> all() {
        return contexts;
    }

    /**
     * Publishes the stored values as {@code Context.field} variables.
     *
     * @param builder the builder receiving the variables
     * @return the same builder
     */
    public VariableContext.Builder publish(
            final VariableContext.Builder builder) {
        contexts.forEach((name, fields) -> fields.forEach(
                (field, value) -> builder.put(name + "." + field, value)));
        return builder;
    }

}
