package co.fanki.machineflow.execution.domain;

/**
 * Path counts by status.
 *
 * @param totalPaths every path ever started or forked and not pruned
 * @param activePaths paths in ACTIVE
 * @param waitingPaths paths in WAITING
 * @param completedPaths paths in COMPLETED
 * @param failedPaths paths in FAILED
 * @param totalSteps transitions taken by all paths
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record PathStatistics(int totalPaths, int activePaths,
        int waitingPaths, int completedPaths, int failedPaths,
        long totalSteps) {}
