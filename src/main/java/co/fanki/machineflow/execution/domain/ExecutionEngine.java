package co.fanki.machineflow.execution.domain;

import co.fanki.machineflow.analysis.domain.GraphAnalyzer;
import co.fanki.machineflow.execution.domain.VisualizationState.AvailableTransition;
import co.fanki.machineflow.execution.domain.VisualizationState.NodeState;
import co.fanki.machineflow.execution.domain.VisualizationState.NodeStatus;
import co.fanki.machineflow.expression.domain.ExpressionError;
import co.fanki.machineflow.expression.domain.ExpressionEvaluator;
import co.fanki.machineflow.expression.domain.Value;
import co.fanki.machineflow.expression.domain.VariableContext;
import co.fanki.machineflow.machine.domain.Annotation;
import co.fanki.machineflow.machine.domain.Attribute;
import co.fanki.machineflow.machine.domain.Machine;
import co.fanki.machineflow.machine.domain.MachineEdge;
import co.fanki.machineflow.machine.domain.MachineNode;
import co.fanki.machineflow.machine.domain.NodeKind;
import co.fanki.machineflow.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Drives execution paths through a machine.
 *
 * <p>Cooperative and single writer: {@link #step()} takes the paths that
 * are ACTIVE when the tick starts and moves each of them once, in creation
 * order. Paths forked during a tick are stepped from the next tick on.
 * Every public method is synchronized, so readers see the state as of the
 * last completed operation.</p>
 *
 * <p>Per path and tick the engine collects the edges leaving the current
 * node (those of the enclosing module when the node has none), keeps the
 * ones whose guard holds against the path's runtime context, and then:</p>
 * <ul>
 *   <li>with no eligible edge, completes the path on an exit or context
 *       node and fails it anywhere else;</li>
 *   <li>with one, moves the path along it;</li>
 *   <li>with several, moves the path along the first and forks one new
 *       path per remaining edge.</li>
 * </ul>
 *
 * <p>Entering a node whose invocation count already reached its ceiling
 * fails the path instead. A guard that cannot be evaluated makes its edge
 * ineligible and is logged.</p>
 *
 * <p>Edge annotations, see {@link EdgeAnnotations}: an eligible spawning
 * edge starts a fresh path on its target, and a path whose other edges
 * are all spawning completes. A path crossing a barrier edge waits until
 * every live path not held at another barrier arrived; the barrier then
 * moves all of them across, or with merge only the last one to arrive
 * while the others complete.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ExecutionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(
            ExecutionEngine.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Attribute or annotation overriding the invocation ceiling. */
    static final String MAX_STEPS = "maxSteps";

    private final Machine machine;

    private final ExpressionEvaluator evaluator;

    private final ExecutionLimits limits;

    private final WaitPolicy waitPolicy;

    private final Clock clock;

    private final RuntimeContextFactory contextFactory;

    private final ContextStore contextStore = new ContextStore();

    private final Map<String, ExecutionPath> paths = new LinkedHashMap<>();

    private final GraphAnalyzer analyzer;

    /** Paths held at each barrier, with the edge each one crosses. */
    private final Map<String, BarrierState> barriers = new LinkedHashMap<>();

    private final Instant startedAt;

    private Instant lastInstant;

    private long version;

    private int errorCount;

    private long stepCount;

    private int nextPathNumber = 1;

    /**
     * Creates an engine waiting on {@code @external} nodes, on the system
     * clock.
     *
     * @param theMachine the machine to run
     * @param theEvaluator the guard evaluator
     * @param theLimits the limits
     */
    public ExecutionEngine(final Machine theMachine,
            final ExpressionEvaluator theEvaluator,
            final ExecutionLimits theLimits) {
        this(theMachine, theEvaluator, theLimits,
                WaitPolicy.EXTERNAL_ANNOTATION, Clock.systemUTC());
    }

    /**
     * Creates a new engine.
     *
     * @param theMachine the machine to run
     * @param theEvaluator the guard evaluator
     * @param theLimits the limits
     * @param theWaitPolicy decides which entered nodes suspend a path
     * @param theClock the time source
     */
    public ExecutionEngine(final Machine theMachine,
            final ExpressionEvaluator theEvaluator,
            final ExecutionLimits theLimits, final WaitPolicy theWaitPolicy,
            final Clock theClock) {
        this.machine = Preconditions.requireNonNull(theMachine,
                "Machine is required");
        this.evaluator = Preconditions.requireNonNull(theEvaluator,
                "Evaluator is required");
        this.limits = Preconditions.requireNonNull(theLimits,
                "Limits are required");
        this.waitPolicy = Preconditions.requireNonNull(theWaitPolicy,
                "Wait policy is required");
        this.clock = Preconditions.requireNonNull(theClock,
                "Clock is required");
        this.contextFactory = new RuntimeContextFactory(theMachine);
        this.analyzer = new GraphAnalyzer(theMachine);
        this.startedAt = theClock.instant();
        this.lastInstant = startedAt;
    }

    public Machine machine() {
        return machine;
    }

    /**
     * Starts a path on the default entry: the first init node, else the
     * first entry point.
     *
     * @return the path id
     * @throws EngineFault if the machine has no entry point
     */
    public synchronized String start() {
        return start(null);
    }

    /**
     * Starts a path on a node.
     *
     * @param entryNode the node, null for the default entry
     * @return the path id
     * @throws EngineFault if the node is unknown or is a decoration
     */
    public synchronized String start(final String entryNode) {
        final String entry = entryNode != null ? entryNode : defaultEntry();
        final MachineNode node = requireNode(entry);
        if (node.isDecoration()) {
            throw new EngineFault("Cannot start on decoration " + entry);
        }
        final ExecutionPath path = ExecutionPath.start(nextPathId(), entry,
                node.kind() == NodeKind.STATE, now());
        paths.put(path.id(), path);
        version++;
        LOG.info("Started path {} on {}", path.id(), entry);
        return path.id();
    }

    private String defaultEntry() {
        for (final MachineNode node : machine.nodes()) {
            if (node.kind() == NodeKind.INIT) {
                return node.name();
            }
        }
        final List<String> entries = analyzer.findEntryPoints();
        if (entries.isEmpty()) {
            throw new EngineFault("Machine has no entry point");
        }
        return entries.get(0);
    }

    /**
     * Runs one tick.
     *
     * @return how many paths were stepped
     */
    public synchronized int step() {
        final List<ExecutionPath> active = new ArrayList<>();
        for (final ExecutionPath path : paths.values()) {
            if (path.status() == PathStatus.ACTIVE) {
                active.add(path);
            }
        }
        for (final ExecutionPath path : active) {
            if (path.status() == PathStatus.ACTIVE) {
                stepPath(path);
            }
        }
        releaseBarriers();
        if (!active.isEmpty()) {
            version++;
        }
        return active.size();
    }

    /**
     * Steps until no path is ACTIVE or the tick budget is spent.
     *
     * @param maxTicks the most ticks to run
     * @return the ticks run
     */
    public synchronized int runUntilQuiescent(final int maxTicks) {
        Preconditions.requireNonNegative(maxTicks,
                "maxTicks must not be negative");
        int ticks = 0;
        while (ticks < maxTicks && step() > 0) {
            ticks++;
        }
        return ticks;
    }

    private void stepPath(final ExecutionPath path) {
        final String current = path.currentNode();
        if (limits.maxSteps() > 0 && path.stepCount() >= limits.maxSteps()) {
            fail(path, "exceeded maximum steps (" + limits.maxSteps() + ")");
            return;
        }

        final List<MachineEdge> edges = transitionsFrom(current);
        final VariableContext context = contextFactory.create(path,
                contextStore, errorCount);
        final List<MachineEdge> eligible = new ArrayList<>();
        for (final MachineEdge edge : edges) {
            if (isEligible(edge, context, path)) {
                eligible.add(edge);
            }
        }

        if (eligible.isEmpty()) {
            final MachineNode node = requireNode(current);
            if (edges.isEmpty() || node.kind() == NodeKind.CONTEXT) {
                path.complete(now());
                LOG.info("Path {} completed at {}", path.id(), current);
            } else {
                fail(path, "dead end: no applicable transition from "
                        + current);
            }
            return;
        }

        final List<MachineEdge> followed = new ArrayList<>();
        int spawned = 0;
        for (final MachineEdge edge : eligible) {
            if (!EdgeAnnotations.spawns(edge)) {
                followed.add(edge);
            } else if (spawn(path, edge)) {
                spawned++;
            }
        }
        if (followed.isEmpty()) {
            path.complete(now());
            LOG.info("Path {} completed at {} after spawning {} paths",
                    path.id(), current, spawned);
            return;
        }

        final List<ExecutionPath> forks = new ArrayList<>();
        for (int i = 1; i < followed.size(); i++) {
            if (paths.size() + forks.size() >= limits.maxPaths()) {
                LOG.warn("Path {} cannot fork to {}: {} paths reached",
                        path.id(), followed.get(i).target(),
                        limits.maxPaths());
                forks.add(null);
                continue;
            }
            forks.add(path.fork(nextPathId(), now()));
        }

        for (final ExecutionPath fork : forks) {
            if (fork != null) {
                paths.put(fork.id(), fork);
                LOG.debug("Path {} forked into {}", path.id(), fork.id());
            }
        }
        cross(path, followed.get(0));
        for (int i = 0; i < forks.size(); i++) {
            if (forks.get(i) != null) {
                cross(forks.get(i), followed.get(i + 1));
            }
        }
    }

    private boolean spawn(final ExecutionPath parent, final MachineEdge edge) {
        if (paths.size() >= limits.maxPaths()) {
            LOG.warn("Path {} cannot spawn on {}: {} paths reached",
                    parent.id(), edge.target(), limits.maxPaths());
            return false;
        }
        final String target = enterModules(edge.target(), new ArrayList<>());
        final MachineNode node = requireNode(target);
        final ExecutionPath child = ExecutionPath.start(nextPathId(), target,
                node.kind() == NodeKind.STATE, now());
        paths.put(child.id(), child);
        LOG.info("Path {} spawned {} on {}", parent.id(), child.id(), target);
        if (waitPolicy.shouldWait(node, child)) {
            child.suspend(now());
        }
        return true;
    }

    private void cross(final ExecutionPath path, final MachineEdge edge) {
        final Optional<EdgeAnnotations.Barrier> barrier =
                EdgeAnnotations.barrier(edge);
        if (barrier.isEmpty()) {
            take(path, edge);
            return;
        }
        final String id = barrier.get().id();
        path.suspend(now());
        barriers.computeIfAbsent(id, key -> new BarrierState())
                .arrive(path.id(), edge, barrier.get().merge());
        LOG.debug("Path {} waiting at barrier '{}'", path.id(), id);
        release(id);
    }

    private void releaseBarriers() {
        for (final String id : new ArrayList<>(barriers.keySet())) {
            release(id);
        }
    }

    private void release(final String id) {
        final BarrierState state = barriers.get(id);
        if (state == null || state.arrivals.isEmpty()) {
            barriers.remove(id);
            return;
        }
        for (final ExecutionPath path : paths.values()) {
            if (!path.status().isTerminal()
                    && !state.arrivals.containsKey(path.id())
                    && !heldAtOtherBarrier(path.id(), id)) {
                return;
            }
        }
        barriers.remove(id);
        final List<String> arrived = new ArrayList<>(state.arrivals.keySet());
        final String last = arrived.get(arrived.size() - 1);
        LOG.info("Barrier '{}' released for {} paths", id, arrived.size());
        for (final String pathId : arrived) {
            final ExecutionPath path = paths.get(pathId);
            path.resume(null, now());
            if (state.merge && !pathId.equals(last)) {
                path.complete(now());
                LOG.info("Path {} merged into {}", pathId, last);
            } else {
                take(path, state.arrivals.get(pathId));
            }
        }
    }

    private boolean heldAtOtherBarrier(final String pathId,
            final String barrierId) {
        for (final Map.Entry<String, BarrierState> entry
                : barriers.entrySet()) {
            if (!entry.getKey().equals(barrierId)
                    && entry.getValue().arrivals.containsKey(pathId)) {
                return true;
            }
        }
        return false;
    }

    private boolean atBarrier(final String pathId) {
        return heldAtOtherBarrier(pathId, null);
    }

    private void leaveBarriers(final String pathId) {
        for (final BarrierState state : barriers.values()) {
            state.arrivals.remove(pathId);
        }
    }

    private boolean isEligible(final MachineEdge edge,
            final VariableContext context, final ExecutionPath path) {
        if (!edge.hasGuard()) {
            return true;
        }
        try {
            return evaluator.evaluateCondition(edge.guard(), context);
        } catch (final ExpressionError e) {
            LOG.warn("Path {}: guard of {} -> {} skipped: {}", path.id(),
                    edge.source(), edge.target(), e.getMessage());
            return false;
        }
    }

    private List<MachineEdge> transitionsFrom(final String nodeName) {
        List<MachineEdge> edges = machine.outgoing(nodeName);
        Optional<String> parent = requireNode(nodeName).parent();
        while (edges.isEmpty() && parent.isPresent()) {
            edges = machine.outgoing(parent.get());
            parent = requireNode(parent.get()).parent();
        }
        return edges;
    }

    private void take(final ExecutionPath path, final MachineEdge edge) {
        final List<String> modules = new ArrayList<>();
        final String target = enterModules(edge.target(), modules);
        final MachineNode node = requireNode(target);

        final int ceiling = ceiling(node);
        final int invocations = path.invocations(target);
        if (invocations >= ceiling) {
            fail(path, "cycle exceeded budget: node '" + target
                    + "' reached " + invocations + " invocations");
            return;
        }

        String label = edge.label() != null ? edge.label()
                : edge.guard() != null ? edge.guard() : "";
        if (!modules.isEmpty()) {
            label = label + " (module entry: " + String.join(" -> ", modules)
                    + " -> " + target + ")";
        }
        final List<String> states = new ArrayList<>(modules);
        if (node.kind() == NodeKind.STATE) {
            states.add(target);
        }

        path.advance(new Transition(path.currentNode(), target, label, now(),
                null), states);
        stepCount++;
        LOG.debug("Path {} moved {} -> {}", path.id(), edge.source(), target);

        if (node.kind() == NodeKind.CONTEXT) {
            path.lastOutput().ifPresent(
                    output -> writeOutput(target, output, path));
        }
        if (waitPolicy.shouldWait(node, path)) {
            path.suspend(now());
            LOG.debug("Path {} waiting on {}", path.id(), target);
        }
    }

    private String enterModules(final String target,
            final List<String> modules) {
        String current = target;
        while (requireNode(current).kind() == NodeKind.STATE) {
            final String child = firstChild(current);
            if (child == null) {
                break;
            }
            modules.add(current);
            current = child;
        }
        return current;
    }

    /** Returns the child a module is entered on, null when it has none. */
    private String firstChild(final String module) {
        final List<MachineNode> children = new ArrayList<>();
        for (final MachineNode child : machine.children(module)) {
            if (!child.isDecoration()) {
                children.add(child);
            }
        }
        if (children.isEmpty()) {
            return null;
        }
        for (final NodeKind preferred : List.of(NodeKind.TASK,
                NodeKind.STATE)) {
            for (final MachineNode child : children) {
                if (child.kind() == preferred) {
                    return child.name();
                }
            }
        }
        for (final MachineNode child : children) {
            if (child.kind() != NodeKind.CONTEXT) {
                return child.name();
            }
        }
        return children.get(0).name();
    }

    private int ceiling(final MachineNode node) {
        final Optional<Integer> fromAttribute = node.attribute(MAX_STEPS)
                .map(Attribute::value)
                .map(Value::numericValue)
                .map(Double::intValue);
        if (fromAttribute.isPresent() && fromAttribute.get() > 0) {
            return fromAttribute.get();
        }
        final Optional<Integer> fromAnnotation = node.annotation(MAX_STEPS)
                .map(Annotation::value)
                .map(Value::of)
                .map(Value::numericValue)
                .map(Double::intValue);
        if (fromAnnotation.isPresent() && fromAnnotation.get() > 0) {
            return fromAnnotation.get();
        }
        return limits.maxNodeInvocations();
    }

    private void writeOutput(final String contextName, final String output,
            final ExecutionPath path) {
        final JsonNode json;
        try {
            json = MAPPER.readTree(output);
        } catch (final JsonProcessingException e) {
            LOG.debug("Path {}: output is not JSON, context {} unchanged",
                    path.id(), contextName);
            return;
        }
        if (json == null || !json.isObject()) {
            return;
        }
        contextStore.merge(contextName, Value.fromJson(json).asMap());
        LOG.debug("Path {} wrote context {}", path.id(), contextName);
    }

    private void fail(final ExecutionPath path, final String reason) {
        leaveBarriers(path.id());
        path.fail(reason, now());
        errorCount++;
        LOG.info("Path {} failed at {}: {}", path.id(), path.currentNode(),
                reason);
    }

    /**
     * Resumes a waiting path, attaching the output to the history entry
     * that entered the node it waits on.
     *
     * @param pathId the path
     * @param output the result of the waiting node, may be null
     * @throws EngineFault if the path is unknown
     * @throws co.fanki.machineflow.shared.DomainException with code
     *         {@code PATH_NOT_WAITING} if the path is not waiting, or
     *         {@code PATH_AT_BARRIER} if it waits at a barrier
     */
    public synchronized void resume(final String pathId, final String output) {
        final ExecutionPath path = requirePath(pathId);
        Preconditions.requireDomain(!atBarrier(pathId), "Path " + pathId
                + " waits at a barrier and is released by it",
                "PATH_AT_BARRIER");
        path.resume(output, now());
        version++;
        LOG.debug("Path {} resumed on {}", pathId, path.currentNode());
    }

    /**
     * Cancels a path. Cancelling a completed or failed path does nothing.
     *
     * @param pathId the path
     * @throws EngineFault if the path is unknown
     */
    public synchronized void cancel(final String pathId) {
        final ExecutionPath path = requirePath(pathId);
        if (path.status().isTerminal()) {
            return;
        }
        leaveBarriers(pathId);
        path.fail("cancelled", now());
        version++;
        LOG.info("Path {} cancelled at {}", pathId, path.currentNode());
        releaseBarriers();
    }

    /**
     * Records a failure reported by whoever runs the node work. Guards see
     * the new {@code errorCount} from the next step on.
     *
     * @param message the failure description
     */
    public synchronized void recordError(final String message) {
        errorCount++;
        version++;
        LOG.info("Error recorded ({} so far): {}", errorCount, message);
    }

    /**
     * Writes fields into a context node.
     *
     * @param contextName the context node
     * @param values the fields
     * @throws EngineFault if the node is unknown or not a context
     */
    public synchronized void writeContext(final String contextName,
            final Map<String, Value> values) {
        final MachineNode node = requireNode(contextName);
        if (node.kind() != NodeKind.CONTEXT) {
            throw new EngineFault(contextName + " is not a context node");
        }
        contextStore.merge(contextName, values);
        version++;
    }

    /**
     * Returns the values written to a context node.
     *
     * @param contextName the context node
     * @return the fields
     */
    public synchronized Map<String, Value> contextValues(
            final String contextName) {
        return contextStore.values(contextName);
    }

    /**
     * Removes terminal paths last updated before the retention window.
     *
     * @param retention how long terminal paths are kept
     * @return how many paths were removed
     */
    public synchronized int prune(final Duration retention) {
        final Instant cutoff = now().minus(retention);
        int removed = 0;
        final Iterator<ExecutionPath> iterator = paths.values().iterator();
        while (iterator.hasNext()) {
            final ExecutionPath path = iterator.next();
            if (path.status().isTerminal()
                    && !path.lastUpdatedAt().isAfter(cutoff)) {
                iterator.remove();
                removed++;
            }
        }
        if (removed > 0) {
            version++;
            LOG.debug("Pruned {} terminal paths", removed);
        }
        return removed;
    }

    /**
     * Fails waiting paths that waited longer than the wait timeout.
     *
     * @param at the reference time
     * @return how many paths expired, zero when the timeout is disabled
     */
    public synchronized int expireWaiting(final Instant at) {
        if (limits.waitTimeout().isZero()) {
            return 0;
        }
        int expired = 0;
        for (final ExecutionPath path : paths.values()) {
            if (path.status() == PathStatus.WAITING && path.lastUpdatedAt()
                    .plus(limits.waitTimeout()).isBefore(at)) {
                fail(path, "wait timeout");
                expired++;
            }
        }
        if (expired > 0) {
            releaseBarriers();
            version++;
        }
        return expired;
    }

    /**
     * Takes an immutable snapshot.
     *
     * @return the snapshot
     */
    public synchronized ExecutionState snapshot() {
        final List<PathSnapshot> snapshots = new ArrayList<>();
        for (final ExecutionPath path : paths.values()) {
            snapshots.add(path.snapshot());
        }
        return new ExecutionState(version, snapshots,
                new ExecutionState.Metadata(errorCount, stepCount, startedAt));
    }

    /**
     * Returns the snapshot of one path.
     *
     * @param pathId the path
     * @return the snapshot
     * @throws EngineFault if the path is unknown
     */
    public synchronized PathSnapshot path(final String pathId) {
        return requirePath(pathId).snapshot();
    }

    /**
     * Projects the engine state for progress displays.
     *
     * @return the projection
     */
    public synchronized VisualizationState visualization() {
        final Map<String, Integer> visits = new LinkedHashMap<>();
        final Set<String> currentNodes = new LinkedHashSet<>();
        final List<AvailableTransition> available = new ArrayList<>();
        int activePaths = 0;

        for (final ExecutionPath path : paths.values()) {
            path.nodeInvocationCounts().forEach(
                    (node, count) -> visits.merge(node, count, Integer::sum));
            if (path.status().isTerminal()) {
                continue;
            }
            activePaths++;
            currentNodes.add(path.currentNode());
            final VariableContext context = contextFactory.create(path,
                    contextStore, errorCount);
            for (final MachineEdge edge : transitionsFrom(
                    path.currentNode())) {
                available.add(new AvailableTransition(path.id(),
                        path.currentNode(), edge.target(), edge.label(),
                        edge.guard(), isEligible(edge, context, path)));
            }
        }

        final Map<String, NodeState> nodeStates = new LinkedHashMap<>();
        for (final MachineNode node : machine.nodes()) {
            if (node.isDecoration()) {
                continue;
            }
            final int count = visits.getOrDefault(node.name(), 0);
            final NodeStatus status = currentNodes.contains(node.name())
                    ? NodeStatus.CURRENT
                    : count > 0 ? NodeStatus.VISITED : NodeStatus.PENDING;
            nodeStates.put(node.name(), new NodeState(count, status));
        }
        return new VisualizationState(version, nodeStates, activePaths,
                List.copyOf(currentNodes), errorCount, available);
    }

    /**
     * Counts paths by status.
     *
     * @return the statistics
     */
    public synchronized PathStatistics statistics() {
        int active = 0;
        int waiting = 0;
        int completed = 0;
        int failed = 0;
        for (final ExecutionPath path : paths.values()) {
            switch (path.status()) {
                case ACTIVE -> active++;
                case WAITING -> waiting++;
                case COMPLETED -> completed++;
                default -> failed++;
            }
        }
        return new PathStatistics(paths.size(), active, waiting, completed,
                failed, stepCount);
    }

    /**
     * Builds the runtime context a path's guards currently see.
     *
     * @param pathId the path
     * @return the context
     * @throws EngineFault if the path is unknown
     */
    public synchronized VariableContext runtimeContext(final String pathId) {
        return contextFactory.create(requirePath(pathId), contextStore,
                errorCount);
    }

    /**
     * Returns the paths held at each barrier, in arrival order.
     *
     * @return barrier id to path ids
     */
    public synchronized Map<String, List<String>> barriers() {
        final Map<String, List<String>> held = new LinkedHashMap<>();
        barriers.forEach((id, state) -> held.put(id,
                List.copyOf(state.arrivals.keySet())));
        return held;
    }

    public synchronized long version() {
        return version;
    }

    public synchronized int errorCount() {
        return errorCount;
    }

    public synchronized boolean isQuiescent() {
        return paths.values().stream()
                .noneMatch(p -> p.status() == PathStatus.ACTIVE);
    }

    private MachineNode requireNode(final String name) {
        return machine.node(name).orElseThrow(
                () -> new EngineFault("Unknown node: " + name));
    }

    private ExecutionPath requirePath(final String pathId) {
        final ExecutionPath path = paths.get(pathId);
        if (path == null) {
            throw new EngineFault("Unknown path: " + pathId);
        }
        return path;
    }

    private String nextPathId() {
        return "path_" + nextPathNumber++;
    }

    /** Arrivals at one barrier. */
    private static final class BarrierState {

        private final Map<String, MachineEdge> arrivals =
                new LinkedHashMap<>();

        private boolean merge;

        void arrive(final String pathId, final MachineEdge edge,
                final boolean mergeArrivals) {
            arrivals.put(pathId, edge);
            merge = merge || mergeArrivals;
        }
    }

    private Instant now() {
        final Instant instant = clock.instant();
        if (instant.isAfter(lastInstant)) {
            lastInstant = instant;
        }
        return lastInstant;
    }

}
