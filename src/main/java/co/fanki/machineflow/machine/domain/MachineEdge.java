package co.fanki.machineflow.machine.domain;

import co.fanki.machineflow.shared.Preconditions;

import java.util.List;

/**
 * A directed edge between two nodes.
 *
 * <p>A missing guard means the edge is always eligible. When no explicit
 * guard is given the guard is extracted from the label, see
 * {@link EdgeConditions}.</p>
 *
 * @param source the source node name
 * @param target the target node name
 * @param arrowKind the arrow kind
 * @param label the label, may be null
 * @param guard the guard condition, may be null
 * @param annotations the annotations
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record MachineEdge(String source, String target, ArrowKind arrowKind,
        String label, String guard, List<Annotation> annotations) {

    public MachineEdge {
        Preconditions.requireNonBlank(source, "Edge source is required");
        Preconditions.requireNonBlank(target, "Edge target is required");
        arrowKind = arrowKind == null ? ArrowKind.ASSOCIATION : arrowKind;
        guard = guard == null || guard.isBlank() ? null : guard.trim();
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
    }

    /**
     * Creates an unguarded association edge.
     *
     * @param source the source
     * @param target the target
     * @return the edge
     */
    public static MachineEdge of(final String source, final String target) {
        return new MachineEdge(source, target, ArrowKind.ASSOCIATION, null,
                null, null);
    }

    /**
     * Creates an edge whose guard is taken from its label.
     *
     * @param source the source
     * @param target the target
     * @param label the label, e.g. {@code when: errorCount > 0}
     * @return the edge
     */
    public static MachineEdge labeled(final String source, final String target,
            final String label) {
        return new MachineEdge(source, target, ArrowKind.ASSOCIATION, label,
                EdgeConditions.extract(label), null);
    }

    /**
     * Creates an edge with an explicit guard.
     *
     * @param source the source
     * @param target the target
     * @param guard the guard
     * @return the edge
     */
    public static MachineEdge guarded(final String source, final String target,
            final String guard) {
        return new MachineEdge(source, target, ArrowKind.ASSOCIATION, null,
                guard, null);
    }

    public boolean hasGuard() {
        return guard != null;
    }

    public boolean isBidirectional() {
        return arrowKind == ArrowKind.BIDIRECTIONAL;
    }

}
