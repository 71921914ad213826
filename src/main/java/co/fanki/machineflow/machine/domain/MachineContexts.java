package co.fanki.machineflow.machine.domain;

import co.fanki.machineflow.expression.domain.VariableContext;

import java.util.Set;

/**
 * Builds the variable contexts a machine exposes to expressions.
 *
 * <p>Node attributes are published under {@code Node.attribute}; nested
 * nodes are also reachable through their qualified path. The built-in
 * variables are {@code errorCount}, its alias {@code errors}, and
 * {@code activeState}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class MachineContexts {

    /** Number of failures recorded so far. */
    public static final String ERROR_COUNT = "errorCount";

    /** Alias of {@link #ERROR_COUNT}. */
    public static final String ERRORS = "errors";

    /** Name of the state node the path last entered. */
    public static final String ACTIVE_STATE = "activeState";

    /** Machine attributes that describe the machine and hold no data. */
    public static final Set<String> METADATA_ATTRIBUTES = Set.of(
            "description", "desc", "prompt", "style", "version");

    private MachineContexts() {
    }

    /**
     * Publishes the declared attribute defaults of every executable node.
     *
     * @param machine the machine
     * @param builder the builder receiving the variables
     * @return the same builder
     */
    public static VariableContext.Builder attributeDefaults(
            final Machine machine, final VariableContext.Builder builder) {
        for (final MachineNode node : machine.nodes()) {
            if (node.isDecoration()) {
                continue;
            }
            final String qualified = machine.qualifiedName(node.name());
            for (final Attribute attribute : node.attributes()) {
                builder.put(node.name() + "." + attribute.name(),
                        attribute.value());
                if (!qualified.equals(node.name())) {
                    builder.put(qualified + "." + attribute.name(),
                            attribute.value());
                }
            }
        }
        return builder;
    }

}
