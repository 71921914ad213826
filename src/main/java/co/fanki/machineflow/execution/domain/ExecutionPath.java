package co.fanki.machineflow.execution.domain;

import co.fanki.machineflow.shared.DomainException;
import co.fanki.machineflow.shared.Preconditions;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One thread of execution through a machine.
 *
 * <p>Entity owned by the {@link ExecutionEngine}. History is append-only;
 * every status change goes through {@link PathStateMachine}. A fork copies
 * history, counts and state transitions, so paths never share mutable
 * structures.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ExecutionPath {

    private final String id;

    private final String startNode;

    private final List<Transition> history;

    private final Map<String, Integer> nodeInvocationCounts;

    private final List<StateTransition> stateTransitions;

    private final Instant startedAt;

    private String currentNode;

    private PathStatus status;

    private String failureReason;

    private int stepCount;

    private Instant lastUpdatedAt;

    private ExecutionPath(final String theId, final String theStartNode,
            final String theCurrentNode, final PathStatus theStatus,
            final List<Transition> theHistory,
            final Map<String, Integer> theCounts,
            final List<StateTransition> theStateTransitions,
            final int theStepCount, final Instant theStartedAt,
            final Instant theLastUpdatedAt) {
        this.id = theId;
        this.startNode = theStartNode;
        this.currentNode = theCurrentNode;
        this.status = theStatus;
        this.history = new ArrayList<>(theHistory);
        this.nodeInvocationCounts = new LinkedHashMap<>(theCounts);
        this.stateTransitions = new ArrayList<>(theStateTransitions);
        this.stepCount = theStepCount;
        this.startedAt = theStartedAt;
        this.lastUpdatedAt = theLastUpdatedAt;
    }

    /**
     * Starts a path on a node. The start node counts as entered once.
     *
     * @param id the path id
     * @param startNode the start node
     * @param startIsState whether the start node is a state node
     * @param now the creation time
     * @return the new active path
     */
    static ExecutionPath start(final String id, final String startNode,
            final boolean startIsState, final Instant now) {
        Preconditions.requireNonBlank(id, "Path id is required");
        Preconditions.requireNonBlank(startNode, "Start node is required");
        final List<StateTransition> states = new ArrayList<>();
        if (startIsState) {
            states.add(new StateTransition(startNode, now));
        }
        return new ExecutionPath(id, startNode, startNode, PathStatus.ACTIVE,
                List.of(), Map.of(startNode, 1), states, 0, now, now);
    }

    /**
     * Creates an active copy of this path under a new id.
     *
     * @param newId the id of the fork
     * @param now the fork time
     * @return the fork
     */
    ExecutionPath fork(final String newId, final Instant now) {
        return new ExecutionPath(newId, startNode, currentNode,
                PathStatus.ACTIVE, history, nodeInvocationCounts,
                stateTransitions, stepCount, startedAt, now);
    }

    /**
     * Moves the path along a transition.
     *
     * @param transition the history entry, its {@code from} must be the
     *        current node
     * @param enteredStates the state nodes entered on the way, in order
     */
    void advance(final Transition transition,
            final List<String> enteredStates) {
        Preconditions.require(transition.from().equals(currentNode),
                "Transition must leave the current node " + currentNode);
        status = PathStateMachine.transition(status, PathStatus.ACTIVE);
        history.add(transition);
        nodeInvocationCounts.merge(transition.to(), 1, Integer::sum);
        for (final String state : enteredStates) {
            stateTransitions.add(new StateTransition(state,
                    transition.timestamp()));
        }
        currentNode = transition.to();
        stepCount++;
        lastUpdatedAt = transition.timestamp();
    }

    void complete(final Instant now) {
        status = PathStateMachine.transition(status, PathStatus.COMPLETED);
        lastUpdatedAt = now;
    }

    void fail(final String reason, final Instant now) {
        status = PathStateMachine.transition(status, PathStatus.FAILED);
        failureReason = reason;
        lastUpdatedAt = now;
    }

    void suspend(final Instant now) {
        status = PathStateMachine.transition(status, PathStatus.WAITING);
        lastUpdatedAt = now;
    }

    /**
     * Wakes a waiting path, attaching the output to the history entry that
     * entered the current node.
     *
     * @param output the result, may be null
     * @param now the resume time
     * @throws DomainException with code {@code PATH_NOT_WAITING} when the
     *         path is not waiting
     */
    void resume(final String output, final Instant now) {
        Preconditions.requireDomain(status == PathStatus.WAITING,
                "Path " + id + " is not waiting but " + status,
                "PATH_NOT_WAITING");
        status = PathStateMachine.transition(status, PathStatus.ACTIVE);
        if (output != null && !history.isEmpty()) {
            final int last = history.size() - 1;
            history.set(last, history.get(last).withOutput(output));
        }
        lastUpdatedAt = now;
    }

    public String id() {
        return id;
    }

    public String startNode() {
        return startNode;
    }

    public String currentNode() {
        return currentNode;
    }

    public PathStatus status() {
        return status;
    }

    public List<Transition> history() {
        return Collections.unmodifiableList(history);
    }

    public Map<String, Integer> nodeInvocationCounts() {
        return Collections.unmodifiableMap(nodeInvocationCounts);
    }

    public List<StateTransition> stateTransitions() {
        return Collections.unmodifiableList(stateTransitions);
    }

    public Optional<String> failureReason() {
        return Optional.ofNullable(failureReason);
    }

    public int stepCount() {
        return stepCount;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant lastUpdatedAt() {
        return lastUpdatedAt;
    }

    public int invocations(final String node) {
        return nodeInvocationCounts.getOrDefault(node, 0);
    }

    /**
     * Returns the last state node entered.
     *
     * @return the state name, empty string if none
     */
    public String activeState() {
        if (stateTransitions.isEmpty()) {
            return "";
        }
        return stateTransitions.get(stateTransitions.size() - 1).stateName();
    }

    /**
     * Returns the most recent output recorded on this path.
     *
     * @return the output
     */
    public Optional<String> lastOutput() {
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).output() != null) {
                return Optional.of(history.get(i).output());
            }
        }
        return Optional.empty();
    }

    /**
     * Copies this path into an immutable snapshot.
     *
     * @return the snapshot
     */
    public PathSnapshot snapshot() {
        return new PathSnapshot(id, startNode, currentNode, status,
                List.copyOf(history),
                Collections.unmodifiableMap(
                        new LinkedHashMap<>(nodeInvocationCounts)),
                List.copyOf(stateTransitions), failureReason, stepCount,
                startedAt, lastUpdatedAt);
    }

}
