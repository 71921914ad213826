package co.fanki.machineflow.execution.domain;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable copy of a path at one point in time.
 *
 * @param id the path id
 * @param startNode the node the path was created on
 * @param currentNode the node the path sits on
 * @param status the status
 * @param history the transitions, oldest first
 * @param nodeInvocationCounts how many times each node was entered
 * @param stateTransitions the state nodes entered, oldest first
 * @param failureReason why the path failed, null otherwise
 * @param stepCount transitions taken
 * @param startedAt creation time
 * @param lastUpdatedAt time of the last change
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record PathSnapshot(
        String id,
        String startNode,
        String currentNode,
        PathStatus status,
        List<Transition> history,
        Map<String, Integer> nodeInvocationCounts,
        List<StateTransition> stateTransitions,
        String failureReason,
        int stepCount,
        Instant startedAt,
        Instant lastUpdatedAt) {

    /**
     * Returns how many times a node was entered.
     *
     * @param node the node
     * @return the count, zero if never
     */
    public int invocations(final String node) {
        return nodeInvocationCounts.getOrDefault(node, 0);
    }

}
