package co.fanki.machineflow.execution.domain;

import co.fanki.machineflow.shared.Preconditions;

import java.time.Duration;

/**
 * Bounds applied by the engine.
 *
 * @param maxNodeInvocations how many times a path may enter the same node,
 *        unless the node sets its own {@code maxSteps}
 * @param maxSteps transitions a single path may take, zero for no limit
 * @param maxPaths paths an engine may hold, forks beyond it are refused
 * @param waitTimeout how long a path may wait, zero disables expiry
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ExecutionLimits(int maxNodeInvocations, int maxSteps,
        int maxPaths, Duration waitTimeout) {

    /** Default ceiling of node invocations. */
    public static final int DEFAULT_MAX_NODE_INVOCATIONS = 100;

    /** Default per-path step limit. */
    public static final int DEFAULT_MAX_STEPS = 1000;

    /** Default path limit. */
    public static final int DEFAULT_MAX_PATHS = 100;

    public ExecutionLimits {
        Preconditions.requirePositive(maxNodeInvocations,
                "maxNodeInvocations must be positive");
        Preconditions.requireNonNegative(maxSteps,
                "maxSteps must not be negative");
        Preconditions.requirePositive(maxPaths, "maxPaths must be positive");
        waitTimeout = waitTimeout == null ? Duration.ZERO : waitTimeout;
        Preconditions.require(!waitTimeout.isNegative(),
                "waitTimeout must not be negative");
    }

    /**
     * Returns the default limits.
     *
     * @return the defaults
     */
    public static ExecutionLimits defaults() {
        return new ExecutionLimits(DEFAULT_MAX_NODE_INVOCATIONS,
                DEFAULT_MAX_STEPS, DEFAULT_MAX_PATHS, Duration.ZERO);
    }

    /**
     * Returns a copy with another invocation ceiling.
     *
     * @param ceiling the ceiling
     * @return the new limits
     */
    public ExecutionLimits withMaxNodeInvocations(final int ceiling) {
        return new ExecutionLimits(ceiling, maxSteps, maxPaths, waitTimeout);
    }

}
