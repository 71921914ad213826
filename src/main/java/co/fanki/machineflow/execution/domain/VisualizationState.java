package co.fanki.machineflow.execution.domain;

import java.util.List;
import java.util.Map;

/**
 * Projection of an engine for progress displays.
 *
 * @param version the engine version
 * @param nodeStates per node visit count and status
 * @param activePaths paths not yet terminal
 * @param currentNodes nodes on which a non-terminal path sits
 * @param errorCount failures recorded so far
 * @param availableTransitions edges leaving the current nodes
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record VisualizationState(
        long version,
        Map<String, NodeState> nodeStates,
        int activePaths,
        List<String> currentNodes,
        int errorCount,
        List<AvailableTransition> availableTransitions) {

    /** How a node appears in the display. */
    public enum NodeStatus {
        CURRENT,
        VISITED,
        PENDING
    }

    /**
     * Display state of a node.
     *
     * @param visitCount entries by all paths
     * @param status the status
     */
    public record NodeState(int visitCount, NodeStatus status) {}

    /**
     * An edge a non-terminal path could take next.
     *
     * @param pathId the path
     * @param source the node the path sits on
     * @param target the edge target
     * @param label the edge label, may be null
     * @param condition the guard, may be null
     * @param eligible whether the guard currently holds
     */
    public record AvailableTransition(String pathId, String source,
            String target, String label, String condition,
            boolean eligible) {}

}
