package co.fanki.machineflow.analysis.domain;

/**
 * Size and shape figures of a machine graph.
 *
 * @param nodeCount executable nodes
 * @param edgeCount directed adjacency entries
 * @param entryPointCount entry points
 * @param exitPointCount exit points
 * @param maxDepth node count of the longest entry-to-exit path
 * @param cycleCount detected cycles
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphStatistics(
        int nodeCount,
        int edgeCount,
        int entryPointCount,
        int exitPointCount,
        int maxDepth,
        int cycleCount) {}
