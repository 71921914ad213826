package co.fanki.machineflow.machine.domain;

import co.fanki.machineflow.shared.DomainException;
import co.fanki.machineflow.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A loaded machine: nodes, edges and machine-level attributes.
 *
 * <p>Immutable after construction. The constructor checks that node names
 * are unique, that every edge names existing nodes and that every parent
 * chain ends at a top level node without looping.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Machine {

    private final String title;

    private final List<Attribute> attributes;

    private final Map<String, MachineNode> nodes;

    private final List<MachineEdge> edges;

    /**
     * Creates a machine.
     *
     * @param theTitle the title, may be null
     * @param theAttributes machine-level attributes, may be null
     * @param theNodes the nodes in declaration order
     * @param theEdges the edges in declaration order
     * @throws DomainException if the model is inconsistent
     */
    public Machine(final String theTitle, final List<Attribute> theAttributes,
            final List<MachineNode> theNodes, final List<MachineEdge> theEdges) {
        Preconditions.requireNonNull(theNodes, "Nodes are required");
        this.title = theTitle;
        this.attributes = theAttributes == null
                ? List.of() : List.copyOf(theAttributes);

        final Map<String, MachineNode> byName = new LinkedHashMap<>();
        for (final MachineNode node : theNodes) {
            if (byName.putIfAbsent(node.name(), node) != null) {
                throw new DomainException("Duplicate node name: "
                        + node.name(), "MACHINE_DUPLICATE_NODE");
            }
        }
        this.nodes = Collections.unmodifiableMap(byName);
        this.edges = theEdges == null ? List.of() : List.copyOf(theEdges);

        checkParents();
        checkEdges();
    }

    /**
     * Creates a machine from nodes and edges only.
     *
     * @param nodes the nodes
     * @param edges the edges
     * @return the machine
     */
    public static Machine of(final List<MachineNode> nodes,
            final List<MachineEdge> edges) {
        return new Machine(null, null, nodes, edges);
    }

    private void checkParents() {
        for (final MachineNode node : nodes.values()) {
            final Set<String> seen = new HashSet<>();
            seen.add(node.name());
            Optional<String> parent = node.parent();
            while (parent.isPresent()) {
                final MachineNode parentNode = nodes.get(parent.get());
                if (parentNode == null) {
                    throw new DomainException("Node " + node.name()
                            + " has unknown parent " + parent.get(),
                            "MACHINE_INVALID_PARENT");
                }
                if (!seen.add(parentNode.name())) {
                    throw new DomainException("Parent chain of " + node.name()
                            + " loops at " + parentNode.name(),
                            "MACHINE_INVALID_PARENT");
                }
                parent = parentNode.parent();
            }
        }
    }

    private void checkEdges() {
        for (final MachineEdge edge : edges) {
            if (!nodes.containsKey(edge.source())
                    || !nodes.containsKey(edge.target())) {
                throw new DomainException("Edge " + edge.source() + " -> "
                        + edge.target() + " references an unknown node",
                        "MACHINE_UNKNOWN_NODE");
            }
        }
    }

    public Optional<String> title() {
        return Optional.ofNullable(title);
    }

    public List<Attribute> attributes() {
        return attributes;
    }

    /**
     * Returns the nodes in declaration order.
     *
     * @return the nodes
     */
    public List<MachineNode> nodes() {
        return List.copyOf(nodes.values());
    }

    public List<MachineEdge> edges() {
        return edges;
    }

    public Optional<MachineNode> node(final String name) {
        return Optional.ofNullable(nodes.get(name));
    }

    public boolean contains(final String name) {
        return nodes.containsKey(name);
    }

    /**
     * Returns the direct children of a node, in declaration order.
     *
     * @param name the parent name
     * @return the children
     */
    public List<MachineNode> children(final String name) {
        final List<MachineNode> children = new ArrayList<>();
        for (final MachineNode node : nodes.values()) {
            if (node.parent().filter(name::equals).isPresent()) {
                children.add(node);
            }
        }
        return children;
    }

    /**
     * Returns the dotted path of a node through its parents, e.g.
     * {@code Review.Draft}. Names that already carry their parent's
     * prefix are not prefixed twice.
     *
     * @param name the node name
     * @return the qualified name
     */
    public String qualifiedName(final String name) {
        final MachineNode node = nodes.get(name);
        if (node == null || node.parent().isEmpty()) {
            return name;
        }
        final String parentPath = qualifiedName(node.parent().get());
        if (name.startsWith(parentPath + ".")) {
            return name;
        }
        return parentPath + "." + node.localName();
    }

    public boolean hasChildren(final String name) {
        return !children(name).isEmpty();
    }

    /**
     * Returns the edges that can be taken from the given node, in
     * declaration order.
     *
     * <p>Bidirectional edges ending at the node are returned reversed.
     * Edges touching a decoration are never returned.</p>
     *
     * @param name the source node
     * @return the outgoing edges
     */
    public List<MachineEdge> outgoing(final String name) {
        final List<MachineEdge> outgoing = new ArrayList<>();
        for (final MachineEdge edge : edges) {
            if (isDecoration(edge.source()) || isDecoration(edge.target())) {
                continue;
            }
            if (edge.source().equals(name)) {
                outgoing.add(edge);
            } else if (edge.isBidirectional() && edge.target().equals(name)) {
                outgoing.add(new MachineEdge(edge.target(), edge.source(),
                        edge.arrowKind(), edge.label(), edge.guard(),
                        edge.annotations()));
            }
        }
        return outgoing;
    }

    private boolean isDecoration(final String name) {
        final MachineNode node = nodes.get(name);
        return node != null && node.isDecoration();
    }

}
