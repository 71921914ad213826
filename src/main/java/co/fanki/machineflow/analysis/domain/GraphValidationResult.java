package co.fanki.machineflow.analysis.domain;

import java.util.List;

/**
 * Outcome of a structural validation.
 *
 * <p>A graph is valid when it has no unreachable nodes, no orphaned nodes
 * and at least one entry point. Cycles, multiple entry points and a missing
 * exit are only reported as warnings.</p>
 *
 * @param valid whether the graph passes
 * @param unreachableNodes nodes not reachable from any init node
 * @param orphanedNodes nodes without any edge
 * @param cycles the detected cycles
 * @param missingEntryPoints whether no entry point exists
 * @param missingExitPoints whether no exit point exists
 * @param warnings human readable warnings
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphValidationResult(
        boolean valid,
        List<String> unreachableNodes,
        List<String> orphanedNodes,
        List<List<String>> cycles,
        boolean missingEntryPoints,
        boolean missingExitPoints,
        List<String> warnings) {

    public GraphValidationResult {
        unreachableNodes = List.copyOf(unreachableNodes);
        orphanedNodes = List.copyOf(orphanedNodes);
        cycles = cycles.stream().map(List::copyOf).toList();
        warnings = List.copyOf(warnings);
    }

}
