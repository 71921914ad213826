package co.fanki.machineflow.execution.application;

import co.fanki.machineflow.execution.domain.ExecutionEngine;
import co.fanki.machineflow.execution.domain.ExecutionLimits;
import co.fanki.machineflow.execution.domain.ExecutionState;
import co.fanki.machineflow.execution.domain.PathSnapshot;
import co.fanki.machineflow.execution.domain.PathStatistics;
import co.fanki.machineflow.execution.domain.VisualizationState;
import co.fanki.machineflow.execution.domain.WaitPolicy;
import co.fanki.machineflow.expression.domain.ExpressionEvaluator;
import co.fanki.machineflow.expression.domain.Value;
import co.fanki.machineflow.machine.application.MachineRegistry;
import co.fanki.machineflow.machine.application.RegisteredMachine;
import co.fanki.machineflow.shared.DomainException;
import co.fanki.machineflow.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Application service for running machines.
 *
 * <p>Each run owns one {@link ExecutionEngine}. The engine serialises its
 * own operations, so this service only keeps the run index.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ExecutionService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ExecutionService.class);

    /** Error code for a run that does not exist. */
    public static final String NOT_FOUND = "RUN_NOT_FOUND";

    private final Map<String, ExecutionRun> runs = new ConcurrentHashMap<>();

    private final MachineRegistry machineRegistry;

    private final ExpressionEvaluator expressionEvaluator;

    private final ExecutionLimits executionLimits;

    private final WaitPolicy waitPolicy;

    private final Clock clock;

    /**
     * Creates a new ExecutionService.
     *
     * @param theMachineRegistry the machine registry
     * @param theExpressionEvaluator the guard evaluator
     * @param theExecutionLimits the limits of every new run
     * @param theWaitPolicy the wait policy of every new run
     * @param theClock the clock
     */
    public ExecutionService(final MachineRegistry theMachineRegistry,
            final ExpressionEvaluator theExpressionEvaluator,
            final ExecutionLimits theExecutionLimits,
            final WaitPolicy theWaitPolicy, final Clock theClock) {
        this.machineRegistry = theMachineRegistry;
        this.expressionEvaluator = theExpressionEvaluator;
        this.executionLimits = theExecutionLimits;
        this.waitPolicy = theWaitPolicy;
        this.clock = theClock;
    }

    /**
     * Creates a run and starts its first path.
     *
     * @param machineIdOrName the machine
     * @param entryNode the node to start on, null for the default entry
     * @return the run
     */
    public ExecutionRun create(final String machineIdOrName,
            final String entryNode) {
        final RegisteredMachine machine = machineRegistry.resolve(
                machineIdOrName);
        final ExecutionEngine engine = new ExecutionEngine(machine.machine(),
                expressionEvaluator, executionLimits, waitPolicy, clock);
        engine.start(entryNode);

        final ExecutionRun run = new ExecutionRun(
                UUID.randomUUID().toString(), machine.id(), machine.name(),
                engine, clock.instant());
        runs.put(run.id(), run);

        LOG.info("Created run {} of machine '{}'", run.id(), machine.name());
        return run;
    }

    /**
     * Starts another path in an existing run.
     *
     * @param runId the run
     * @param entryNode the node to start on, null for the default entry
     * @return the new path id
     */
    public String startPath(final String runId, final String entryNode) {
        return get(runId).engine().start(entryNode);
    }

    /**
     * Returns a run.
     *
     * @param runId the run id
     * @return the run
     * @throws DomainException with code {@link #NOT_FOUND}
     */
    public ExecutionRun get(final String runId) {
        final ExecutionRun run = runId == null ? null : runs.get(runId);
        if (run == null) {
            throw new DomainException("Run not found: " + runId, NOT_FOUND);
        }
        return run;
    }

    /**
     * Lists the runs, oldest first.
     *
     * @return the runs
     */
    public List<ExecutionRun> list() {
        final List<ExecutionRun> all = new ArrayList<>(runs.values());
        all.sort(Comparator.comparing(ExecutionRun::createdAt)
                .thenComparing(ExecutionRun::id));
        return all;
    }

    /**
     * Runs one tick.
     *
     * @param runId the run
     * @return the state after the tick
     */
    public ExecutionState step(final String runId) {
        final ExecutionEngine engine = get(runId).engine();
        final int stepped = engine.step();
        LOG.debug("Run {} stepped {} path(s)", runId, stepped);
        return engine.snapshot();
    }

    /**
     * Steps until no path is active or the tick budget is spent.
     *
     * @param runId the run
     * @param maxTicks the most ticks to run
     * @return the ticks run and the final state
     */
    public RunResult run(final String runId, final int maxTicks) {
        final ExecutionEngine engine = get(runId).engine();
        final int ticks = engine.runUntilQuiescent(maxTicks);
        LOG.info("Run {} ran {} tick(s), quiescent: {}", runId, ticks,
                engine.isQuiescent());
        return new RunResult(ticks, engine.isQuiescent(), engine.snapshot());
    }

    public void resume(final String runId, final String pathId,
            final String output) {
        get(runId).engine().resume(pathId, output);
    }

    public void cancel(final String runId, final String pathId) {
        get(runId).engine().cancel(pathId);
    }

    public void recordError(final String runId, final String message) {
        get(runId).engine().recordError(message);
    }

    /**
     * Writes fields into a context node of a run.
     *
     * @param runId the run
     * @param contextName the context node
     * @param fields plain Java values, as read from JSON
     */
    public void writeContext(final String runId, final String contextName,
            final Map<String, Object> fields) {
        Preconditions.requireNonNull(fields, "Context fields are required");
        final Map<String, Value> values = new LinkedHashMap<>();
        fields.forEach((name, value) -> values.put(name,
                Value.fromJava(value)));
        get(runId).engine().writeContext(contextName, values);
    }

    public Map<String, Value> contextValues(final String runId,
            final String contextName) {
        return get(runId).engine().contextValues(contextName);
    }

    /**
     * Returns the paths each barrier of a run holds.
     *
     * @param runId the run
     * @return barrier id to waiting path ids
     */
    public Map<String, List<String>> barriers(final String runId) {
        return get(runId).engine().barriers();
    }

    public ExecutionState state(final String runId) {
        return get(runId).engine().snapshot();
    }

    public PathSnapshot path(final String runId, final String pathId) {
        return get(runId).engine().path(pathId);
    }

    public VisualizationState visualization(final String runId) {
        return get(runId).engine().visualization();
    }

    public PathStatistics statistics(final String runId) {
        return get(runId).engine().statistics();
    }

    /**
     * Returns the variables a path's guards currently see.
     *
     * @param runId the run
     * @param pathId the path
     * @return the top level variables
     */
    public Map<String, Value> runtimeContext(final String runId,
            final String pathId) {
        return get(runId).engine().runtimeContext(pathId).variables();
    }

    /**
     * Removes a run and its engine.
     *
     * @param runId the run
     * @return true if it existed
     */
    public boolean remove(final String runId) {
        final boolean removed = runId != null && runs.remove(runId) != null;
        if (removed) {
            LOG.info("Removed run {}", runId);
        }
        return removed;
    }

    public int runCount() {
        return runs.size();
    }

    /**
     * Expires long waits and prunes old terminal paths on every run.
     *
     * @param retention how long terminal paths are kept
     * @return the expired and pruned counts
     */
    public MaintenanceResult maintain(final Duration retention) {
        final Instant now = clock.instant();
        int expired = 0;
        int pruned = 0;
        for (final ExecutionRun run : runs.values()) {
            expired += run.engine().expireWaiting(now);
            pruned += run.engine().prune(retention);
        }
        return new MaintenanceResult(expired, pruned);
    }

    /**
     * Result of running a machine until quiescent.
     *
     * @param ticks the ticks run
     * @param quiescent whether no path is left active
     * @param state the state after the last tick
     */
    public record RunResult(int ticks, boolean quiescent,
            ExecutionState state) {}

    /**
     * Result of a maintenance sweep.
     *
     * @param expiredPaths waiting paths failed by timeout
     * @param prunedPaths terminal paths removed
     */
    public record MaintenanceResult(int expiredPaths, int prunedPaths) {}

}
