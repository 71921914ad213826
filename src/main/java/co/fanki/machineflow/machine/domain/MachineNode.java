package co.fanki.machineflow.machine.domain;

import co.fanki.machineflow.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A node of a machine.
 *
 * <p>Immutable. Nested nodes carry their dotted qualified name and the name
 * of their parent.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class MachineNode {

    private final String name;

    private final NodeKind kind;

    private final String parent;

    private final String title;

    private final List<Attribute> attributes;

    private final List<Annotation> annotations;

    /**
     * Creates a new node.
     *
     * @param theName the unique name, never blank
     * @param theKind the kind, never null
     * @param theParent the parent name, null for top level nodes
     * @param theTitle the display title, may be null
     * @param theAttributes the attributes in declaration order
     * @param theAnnotations the annotations in declaration order
     */
    public MachineNode(final String theName, final NodeKind theKind,
            final String theParent, final String theTitle,
            final List<Attribute> theAttributes,
            final List<Annotation> theAnnotations) {
        this.name = Preconditions.requireNonBlank(theName,
                "Node name is required");
        this.kind = Preconditions.requireNonNull(theKind,
                "Node kind is required");
        this.parent = theParent == null || theParent.isBlank()
                ? null : theParent;
        this.title = theTitle;
        this.attributes = theAttributes == null
                ? List.of() : Collections.unmodifiableList(
                        new ArrayList<>(theAttributes));
        this.annotations = theAnnotations == null
                ? List.of() : Collections.unmodifiableList(
                        new ArrayList<>(theAnnotations));
    }

    /**
     * Creates a top level node with no attributes.
     *
     * @param name the name
     * @param kind the kind
     * @return the node
     */
    public static MachineNode of(final String name, final NodeKind kind) {
        return new MachineNode(name, kind, null, null, null, null);
    }

    public String name() {
        return name;
    }

    public NodeKind kind() {
        return kind;
    }

    public Optional<String> parent() {
        return Optional.ofNullable(parent);
    }

    public Optional<String> title() {
        return Optional.ofNullable(title);
    }

    public List<Attribute> attributes() {
        return attributes;
    }

    public List<Annotation> annotations() {
        return annotations;
    }

    public boolean isDecoration() {
        return kind.isDecoration();
    }

    /**
     * Finds an attribute by name.
     *
     * @param attributeName the attribute name
     * @return the first attribute with that name
     */
    public Optional<Attribute> attribute(final String attributeName) {
        return attributes.stream()
                .filter(a -> a.name().equals(attributeName))
                .findFirst();
    }

    /**
     * Finds an annotation by name.
     *
     * @param annotationName the name, without {@code @}
     * @return the first annotation with that name
     */
    public Optional<Annotation> annotation(final String annotationName) {
        return annotations.stream()
                .filter(a -> a.name().equals(annotationName))
                .findFirst();
    }

    public boolean hasAnnotation(final String annotationName) {
        return annotation(annotationName).isPresent();
    }

    /**
     * Returns the last segment of the dotted name.
     *
     * @return the local name
     */
    public String localName() {
        final int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(dot + 1);
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof MachineNode)) {
            return false;
        }
        return name.equals(((MachineNode) other).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return name + ":" + kind;
    }

}
