package co.fanki.machineflow.analysis.domain;

import co.fanki.machineflow.analysis.domain.StructuralWarning.Code;
import co.fanki.machineflow.analysis.domain.StructuralWarning.Severity;
import co.fanki.machineflow.machine.domain.Machine;
import co.fanki.machineflow.machine.domain.MachineEdge;
import co.fanki.machineflow.machine.domain.MachineNode;
import co.fanki.machineflow.machine.domain.NodeKind;
import co.fanki.machineflow.shared.Preconditions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * Static structure analysis of a machine graph.
 *
 * <p>Builds forward and reverse adjacency once, then answers entry and exit
 * points, reachability, orphans, cycles and paths. Decorations (notes and
 * styles) are not part of the graph. Bidirectional edges count as two
 * directed edges.</p>
 *
 * <p>All traversals are iterative, so deep graphs cannot exhaust the call
 * stack. Results follow node declaration order.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GraphAnalyzer {

    /**
     * Forward and reverse adjacency lists.
     *
     * @param forward node to the nodes it points to
     * @param reverse node to the nodes pointing at it
     */
    public record Adjacency(Map<String, List<String>> forward,
            Map<String, List<String>> reverse) {

        /**
         * Returns the successors of a node.
         *
         * @param name the node
         * @return the successors, empty for unknown nodes
         */
        public List<String> successors(final String name) {
            return forward.getOrDefault(name, List.of());
        }

        /**
         * Returns the predecessors of a node.
         *
         * @param name the node
         * @return the predecessors, empty for unknown nodes
         */
        public List<String> predecessors(final String name) {
            return reverse.getOrDefault(name, List.of());
        }
    }

    private final Map<String, MachineNode> nodes;

    private final Adjacency adjacency;

    /**
     * Creates an analyzer for a machine.
     *
     * @param machine the machine, never null
     */
    public GraphAnalyzer(final Machine machine) {
        Preconditions.requireNonNull(machine, "Machine is required");
        this.nodes = new LinkedHashMap<>();
        for (final MachineNode node : machine.nodes()) {
            if (!node.isDecoration()) {
                nodes.put(node.name(), node);
            }
        }
        this.adjacency = buildAdjacency(machine.nodes(), machine.edges());
    }

    /**
     * Builds ordered, duplicate-free adjacency lists.
     *
     * <p>Edges touching decorations or unknown nodes are ignored.
     * Bidirectional edges are added in both directions.</p>
     *
     * @param nodes the nodes in declaration order
     * @param edges the edges, already expanded from chains
     * @return the adjacency
     */
    public static Adjacency buildAdjacency(final List<MachineNode> nodes,
            final List<MachineEdge> edges) {
        final Map<String, List<String>> forward = new LinkedHashMap<>();
        final Map<String, List<String>> reverse = new LinkedHashMap<>();
        for (final MachineNode node : nodes) {
            if (!node.isDecoration()) {
                forward.put(node.name(), new ArrayList<>());
                reverse.put(node.name(), new ArrayList<>());
            }
        }
        for (final MachineEdge edge : edges) {
            if (!forward.containsKey(edge.source())
                    || !forward.containsKey(edge.target())) {
                continue;
            }
            link(forward, reverse, edge.source(), edge.target());
            if (edge.isBidirectional()) {
                link(forward, reverse, edge.target(), edge.source());
            }
        }
        return new Adjacency(freeze(forward), freeze(reverse));
    }

    private static void link(final Map<String, List<String>> forward,
            final Map<String, List<String>> reverse, final String source,
            final String target) {
        final List<String> successors = forward.get(source);
        if (!successors.contains(target)) {
            successors.add(target);
        }
        final List<String> predecessors = reverse.get(target);
        if (!predecessors.contains(source)) {
            predecessors.add(source);
        }
    }

    private static Map<String, List<String>> freeze(
            final Map<String, List<String>> lists) {
        final Map<String, List<String>> frozen = new LinkedHashMap<>();
        lists.forEach((name, list) -> frozen.put(name, List.copyOf(list)));
        return Collections.unmodifiableMap(frozen);
    }

    public Adjacency adjacency() {
        return adjacency;
    }

    /**
     * Finds the entry points: init nodes and nodes without incoming edges.
     *
     * @return the entry points in declaration order
     */
    public List<String> findEntryPoints() {
        final List<String> entries = new ArrayList<>();
        for (final MachineNode node : nodes.values()) {
            if (node.kind() == NodeKind.INIT
                    || adjacency.predecessors(node.name()).isEmpty()) {
                entries.add(node.name());
            }
        }
        return entries;
    }

    /**
     * Finds the exit points: nodes without outgoing edges, context nodes
     * excluded.
     *
     * @return the exit points in declaration order
     */
    public List<String> findExitPoints() {
        final List<String> exits = new ArrayList<>();
        for (final MachineNode node : nodes.values()) {
            if (node.kind() != NodeKind.CONTEXT
                    && adjacency.successors(node.name()).isEmpty()) {
                exits.add(node.name());
            }
        }
        return exits;
    }

    /**
     * Finds the nodes that cannot be reached from an init node.
     *
     * <p>Only init nodes seed the search; a graph without init nodes
     * therefore reports every non-context node.</p>
     *
     * @return the unreachable nodes, context nodes excluded
     */
    public List<String> findUnreachableNodes() {
        final Set<String> visited = new HashSet<>();
        final Queue<String> queue = new ArrayDeque<>();
        for (final MachineNode node : nodes.values()) {
            if (node.kind() == NodeKind.INIT && visited.add(node.name())) {
                queue.add(node.name());
            }
        }
        while (!queue.isEmpty()) {
            final String current = queue.poll();
            for (final String next : adjacency.successors(current)) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        final List<String> unreachable = new ArrayList<>();
        for (final MachineNode node : nodes.values()) {
            if (!visited.contains(node.name())
                    && node.kind() != NodeKind.CONTEXT) {
                unreachable.add(node.name());
            }
        }
        return unreachable;
    }

    /**
     * Finds nodes with neither incoming nor outgoing edges, excluding init
     * and context nodes.
     *
     * @return the orphaned nodes
     */
    public List<String> findOrphanedNodes() {
        final List<String> orphaned = new ArrayList<>();
        for (final MachineNode node : nodes.values()) {
            if (node.kind() != NodeKind.INIT
                    && node.kind() != NodeKind.CONTEXT
                    && adjacency.predecessors(node.name()).isEmpty()
                    && adjacency.successors(node.name()).isEmpty()) {
                orphaned.add(node.name());
            }
        }
        return orphaned;
    }

    /**
     * Detects cycles with a depth-first search.
     *
     * <p>Roots are taken in declaration order. Whenever the search meets a
     * node already on the current path, the cycle is the path slice from
     * that node to the current one, closed by the node again: a self-loop
     * on {@code A} yields {@code [A, A]}. One cycle is reported per such
     * back edge, without deduplication.</p>
     *
     * @return the cycles, empty for an acyclic graph
     */
    public List<List<String>> detectCycles() {
        final List<List<String>> cycles = new ArrayList<>();
        final Set<String> visited = new HashSet<>();
        final List<String> path = new ArrayList<>();
        final Map<String, Integer> onPath = new HashMap<>();
        final ArrayDeque<int[]> cursors = new ArrayDeque<>();

        for (final String root : nodes.keySet()) {
            if (visited.contains(root)) {
                continue;
            }
            enter(root, visited, path, onPath, cursors, cycles);
            while (!cursors.isEmpty()) {
                final int[] cursor = cursors.peek();
                final String current = path.get(path.size() - 1);
                final List<String> successors = adjacency.successors(current);
                if (cursor[0] < successors.size()) {
                    final String next = successors.get(cursor[0]++);
                    enter(next, visited, path, onPath, cursors, cycles);
                } else {
                    cursors.pop();
                    onPath.remove(path.remove(path.size() - 1));
                }
            }
        }
        return cycles;
    }

    private static void enter(final String name, final Set<String> visited,
            final List<String> path, final Map<String, Integer> onPath,
            final ArrayDeque<int[]> cursors,
            final List<List<String>> cycles) {
        final Integer start = onPath.get(name);
        if (start != null) {
            final List<String> cycle = new ArrayList<>(
                    path.subList(start, path.size()));
            cycle.add(name);
            cycles.add(List.copyOf(cycle));
            return;
        }
        if (!visited.add(name)) {
            return;
        }
        onPath.put(name, path.size());
        path.add(name);
        cursors.push(new int[] {0});
    }

    /**
     * Whether a node takes part in any detected cycle.
     *
     * @param name the node
     * @return true if some cycle contains it
     */
    public boolean isNodeInCycle(final String name) {
        return detectCycles().stream().anyMatch(c -> c.contains(name));
    }

    /**
     * Finds a shortest path by edge count.
     *
     * @param source the start node
     * @param target the end node
     * @return the nodes along the path, {@code [source]} when both are the
     *         same, empty when no path exists
     */
    public List<String> findPath(final String source, final String target) {
        if (!nodes.containsKey(source) || !nodes.containsKey(target)) {
            return List.of();
        }
        final Map<String, String> cameFrom = new HashMap<>();
        final Queue<String> queue = new ArrayDeque<>();
        cameFrom.put(source, null);
        queue.add(source);
        while (!queue.isEmpty()) {
            final String current = queue.poll();
            if (current.equals(target)) {
                return trace(cameFrom, target);
            }
            for (final String next : adjacency.successors(current)) {
                if (!cameFrom.containsKey(next)) {
                    cameFrom.put(next, current);
                    queue.add(next);
                }
            }
        }
        return List.of();
    }

    private static List<String> trace(final Map<String, String> cameFrom,
            final String target) {
        final List<String> path = new ArrayList<>();
        String current = target;
        while (current != null) {
            path.add(current);
            current = cameFrom.get(current);
        }
        Collections.reverse(path);
        return List.copyOf(path);
    }

    /**
     * Finds the longest of the shortest paths between every entry and exit
     * pair. The first one found wins ties.
     *
     * @return the path, empty when there is no entry or no exit
     */
    public List<String> findLongestPath() {
        final List<String> entries = findEntryPoints();
        final List<String> exits = findExitPoints();
        List<String> longest = List.of();
        for (final String entry : entries) {
            for (final String exit : exits) {
                final List<String> path = findPath(entry, exit);
                if (path.size() > longest.size()) {
                    longest = path;
                }
            }
        }
        return longest;
    }

    /**
     * Runs every structural check.
     *
     * @return the validation result
     */
    public GraphValidationResult validate() {
        final List<String> unreachable = findUnreachableNodes();
        final List<String> orphaned = findOrphanedNodes();
        final List<List<String>> cycles = detectCycles();
        final List<String> entries = findEntryPoints();
        final List<String> exits = findExitPoints();

        final List<String> warnings = new ArrayList<>();
        if (entries.isEmpty()) {
            warnings.add("No entry points found. Consider adding an init node"
                    + " or a node with no incoming edges.");
        }
        if (entries.size() > 1) {
            warnings.add("Multiple entry points found: "
                    + String.join(", ", entries)
                    + ". This may lead to ambiguous execution.");
        }
        if (exits.isEmpty()) {
            warnings.add("No exit points found. The machine may not have a"
                    + " clear termination condition.");
        }
        if (!cycles.isEmpty()) {
            warnings.add("Detected " + cycles.size() + " cycle(s) in the"
                    + " graph. This may lead to infinite loops.");
        }

        final boolean valid = unreachable.isEmpty() && orphaned.isEmpty()
                && !entries.isEmpty();

        return new GraphValidationResult(valid, unreachable, orphaned, cycles,
                entries.isEmpty(), exits.isEmpty(), warnings);
    }

    /**
     * Computes the graph statistics.
     *
     * @return the statistics
     */
    public GraphStatistics statistics() {
        int edgeCount = 0;
        for (final List<String> successors : adjacency.forward().values()) {
            edgeCount += successors.size();
        }
        return new GraphStatistics(nodes.size(), edgeCount,
                findEntryPoints().size(), findExitPoints().size(),
                findLongestPath().size(), detectCycles().size());
    }

    /**
     * Describes every structural finding as a warning with a suggestion.
     *
     * @return the warnings, unreachable nodes first
     */
    public List<StructuralWarning> structuralWarnings() {
        final List<StructuralWarning> warnings = new ArrayList<>();
        for (final String node : findUnreachableNodes()) {
            warnings.add(new StructuralWarning(Code.UNREACHABLE_NODE,
                    Severity.ERROR, node,
                    "Node '" + node + "' is unreachable from entry points",
                    "Add an edge from an entry point or init node to this"
                            + " node, or remove it if unused"));
        }
        for (final String node : findOrphanedNodes()) {
            warnings.add(new StructuralWarning(Code.ORPHANED_NODE,
                    Severity.ERROR, node,
                    "Node '" + node + "' is orphaned (no incoming or outgoing"
                            + " edges)",
                    "Connect this node to the graph or remove it if unused"));
        }
        for (final List<String> cycle : detectCycles()) {
            final String description = String.join(" -> ", cycle);
            for (final String node : new LinkedHashSet<>(cycle)) {
                warnings.add(new StructuralWarning(Code.CYCLE_DETECTED,
                        Severity.WARNING, node,
                        "Cycle detected: " + description,
                        "Ensure the cycle has an exit condition or a"
                                + " maxSteps budget"));
            }
        }
        final List<String> entries = findEntryPoints();
        if (entries.isEmpty()) {
            warnings.add(new StructuralWarning(Code.MISSING_ENTRY,
                    Severity.ERROR, null, "No entry points found in machine",
                    "Add an init node or designate an entry node"));
        } else if (entries.size() > 1) {
            warnings.add(new StructuralWarning(Code.MULTIPLE_ENTRY,
                    Severity.WARNING, null,
                    "Multiple entry points found: "
                            + String.join(", ", entries),
                    "Keep a single init node unless parallel starts are"
                            + " intended"));
        }
        if (findExitPoints().isEmpty()) {
            warnings.add(new StructuralWarning(Code.MISSING_EXIT,
                    Severity.WARNING, null, "No exit points found in machine",
                    "Add a terminal node without outgoing edges"));
        }
        return warnings;
    }

}
