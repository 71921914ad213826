package co.fanki.machineflow.machine.domain;

import co.fanki.machineflow.shared.DomainException;

import java.util.Locale;

/**
 * The kind of a machine node.
 *
 * <p>{@link #NOTE} and {@link #STYLE} are decorations: they never take part
 * in adjacency, traversal or reachability.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum NodeKind {

    /** Entry node of a workflow. */
    INIT,

    /** A unit of work, usually backed by a prompt or a tool call. */
    TASK,

    /** A named state; may group child nodes as a module. */
    STATE,

    /** A data holder written at runtime. */
    CONTEXT,

    /** An external tool binding. */
    TOOL,

    /** Free text attached to the diagram. */
    NOTE,

    /** Visual styling. */
    STYLE;

    /**
     * Whether this kind is a non-executable decoration.
     *
     * @return true for notes and styles
     */
    public boolean isDecoration() {
        return this == NOTE || this == STYLE;
    }

    /**
     * Resolves a kind from its textual type, case-insensitive.
     *
     * <p>A missing type means {@link #TASK}.</p>
     *
     * @param type the type text, may be null
     * @return the kind
     * @throws DomainException with code {@code MACHINE_UNKNOWN_NODE_TYPE}
     *         when the type is not recognized
     */
    public static NodeKind fromType(final String type) {
        if (type == null || type.isBlank()) {
            return TASK;
        }
        try {
            return valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new DomainException("Unknown node type: " + type,
                    "MACHINE_UNKNOWN_NODE_TYPE", e);
        }
    }

}
