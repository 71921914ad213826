package co.fanki.machineflow.execution.domain;

import co.fanki.machineflow.machine.domain.Annotation;
import co.fanki.machineflow.machine.domain.MachineEdge;

import java.util.Optional;
import java.util.Set;

/**
 * Reads the edge annotations that change how paths cross an edge.
 *
 * <p>{@code @barrier}, {@code @wait} and {@code @sync} hold a path until
 * every live path reached the same barrier; {@code @join} and
 * {@code @merge} do the same and then fold the arrived paths into one.
 * {@code @async}, {@code @spawn}, {@code @parallel} and {@code @fork}
 * start a new path on the target instead of moving the current one.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class EdgeAnnotations {

    /** Barrier used when the annotation names none. */
    public static final String DEFAULT_BARRIER = "default";

    private static final Set<String> BARRIER_NAMES = Set.of("barrier", "wait",
            "sync", "join", "merge");

    private static final Set<String> MERGING_NAMES = Set.of("join", "merge");

    private static final Set<String> SPAWN_NAMES = Set.of("async", "spawn",
            "parallel", "fork");

    private EdgeAnnotations() {
    }

    /**
     * A barrier an edge synchronizes on.
     *
     * @param id the barrier id
     * @param merge whether arrived paths fold into the releasing one
     */
    public record Barrier(String id, boolean merge) {}

    /**
     * Returns the barrier of an edge.
     *
     * <p>Accepted values: none ({@code @barrier}), an id
     * ({@code @barrier("group")}, {@code @join(Context.results)}, where
     * dots become underscores) or {@code id}/{@code merge} pairs
     * ({@code @barrier(id: group, merge: true)}).</p>
     *
     * @param edge the edge
     * @return the barrier, empty when the edge has none
     */
    public static Optional<Barrier> barrier(final MachineEdge edge) {
        for (final Annotation annotation : edge.annotations()) {
            if (BARRIER_NAMES.contains(annotation.name())) {
                return Optional.of(parseBarrier(annotation));
            }
        }
        return Optional.empty();
    }

    /**
     * Whether crossing the edge spawns a new path. {@code @async(false)}
     * disables the annotation.
     *
     * @param edge the edge
     * @return true when the edge spawns
     */
    public static boolean spawns(final MachineEdge edge) {
        for (final Annotation annotation : edge.annotations()) {
            if (SPAWN_NAMES.contains(annotation.name())) {
                return annotation.value() == null || !"false"
                        .equalsIgnoreCase(unquote(annotation.value()));
            }
        }
        return false;
    }

    private static Barrier parseBarrier(final Annotation annotation) {
        boolean merge = MERGING_NAMES.contains(annotation.name());
        final String value = annotation.value() == null
                ? "" : annotation.value().trim();
        if (value.isEmpty()) {
            return new Barrier(DEFAULT_BARRIER, merge);
        }
        if (value.indexOf(':') < 0 && value.indexOf('=') < 0) {
            return new Barrier(toId(value), merge);
        }
        String id = DEFAULT_BARRIER;
        for (final String pair : value.split(",")) {
            final String[] parts = pair.split("[:=]", 2);
            if (parts.length != 2) {
                continue;
            }
            final String key = parts[0].trim();
            final String argument = unquote(parts[1]);
            if ("id".equals(key) && !argument.isEmpty()) {
                id = toId(argument);
            } else if ("merge".equals(key)) {
                merge = "true".equalsIgnoreCase(argument);
            }
        }
        return new Barrier(id, merge);
    }

    private static String toId(final String value) {
        return unquote(value).replace('.', '_');
    }

    private static String unquote(final String value) {
        return value.trim().replace("\"", "").replace("'", "");
    }

}
