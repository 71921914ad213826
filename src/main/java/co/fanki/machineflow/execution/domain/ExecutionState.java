package co.fanki.machineflow.execution.domain;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of an engine.
 *
 * <p>{@code version} grows with every engine mutation; a consumer holding
 * a snapshot with a lower version holds stale data.</p>
 *
 * @param version the engine version at snapshot time
 * @param paths the paths in creation order
 * @param metadata engine-wide counters
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ExecutionState(long version, List<PathSnapshot> paths,
        Metadata metadata) {

    public ExecutionState {
        paths = List.copyOf(paths);
    }

    /**
     * Engine-wide counters.
     *
     * @param errorCount failures recorded so far
     * @param stepCount transitions taken by all paths
     * @param startedAt when the engine was created
     */
    public record Metadata(int errorCount, long stepCount, Instant startedAt) {}

    /**
     * Finds a path by id.
     *
     * @param pathId the id
     * @return the path snapshot
     */
    public Optional<PathSnapshot> path(final String pathId) {
        return paths.stream().filter(p -> p.id().equals(pathId)).findFirst();
    }

}
