package co.fanki.machineflow.machine.application;

import co.fanki.machineflow.expression.domain.Value;
import co.fanki.machineflow.machine.domain.Annotation;
import co.fanki.machineflow.machine.domain.ArrowKind;
import co.fanki.machineflow.machine.domain.Attribute;
import co.fanki.machineflow.machine.domain.AttributeValues;
import co.fanki.machineflow.machine.domain.EdgeChain;
import co.fanki.machineflow.machine.domain.EdgeConditions;
import co.fanki.machineflow.machine.domain.Machine;
import co.fanki.machineflow.machine.domain.MachineEdge;
import co.fanki.machineflow.machine.domain.MachineNode;
import co.fanki.machineflow.machine.domain.NodeKind;
import co.fanki.machineflow.shared.DomainException;
import co.fanki.machineflow.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the JSON form of a loaded machine.
 *
 * <p>Expected shape:</p>
 * <pre>
 * {
 *   "title": "...",
 *   "attributes": [{"name": "...", "type": "...", "value": ...}],
 *   "nodes": [{"name": "...", "type": "task", "parent": "...", "title": "...",
 *              "attributes": [...], "annotations": [{"name": "external"}],
 *              "nodes": [...], "edges": [...]}],
 *   "edges": [{"source": "A", "target": "B", "arrowType": "-&gt;",
 *              "label": "when: x &gt; 1", "condition": "...",
 *              "annotations": [...]}]
 * }
 * </pre>
 *
 * <p>An edge may instead carry {@code sources} and {@code segments}
 * ({@code [{"targets": [...], "arrowType": ..., "label": ...}]}) which are
 * expanded with chain semantics. Nested {@code nodes} get the enclosing
 * node as parent.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class MachineJsonReader {

    private static final Logger LOG = LoggerFactory.getLogger(
            MachineJsonReader.class);

    private final ObjectMapper objectMapper;

    /**
     * Creates a new MachineJsonReader.
     *
     * @param theObjectMapper the mapper used to read JSON text
     */
    public MachineJsonReader(final ObjectMapper theObjectMapper) {
        this.objectMapper = theObjectMapper;
    }

    /**
     * Reads a machine from JSON text.
     *
     * @param json the JSON text
     * @return the machine
     * @throws DomainException with code {@code MACHINE_INVALID_JSON} when
     *         the text is not valid JSON, or the model is inconsistent
     */
    public Machine read(final String json) {
        try {
            return read(objectMapper.readTree(json));
        } catch (final JsonProcessingException e) {
            throw new DomainException("Machine JSON is not valid: "
                    + e.getOriginalMessage(), "MACHINE_INVALID_JSON", e);
        }
    }

    /**
     * Reads a machine from a JSON tree.
     *
     * @param root the tree
     * @return the machine
     */
    public Machine read(final JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new DomainException("Machine JSON must be an object",
                    "MACHINE_INVALID_JSON");
        }
        final List<MachineNode> nodes = new ArrayList<>();
        final List<MachineEdge> edges = new ArrayList<>();

        readNodes(root.path("nodes"), null, nodes, edges);
        readEdges(root.path("edges"), edges);

        final Machine machine = new Machine(text(root, "title"),
                readAttributes(root.path("attributes")), nodes, edges);

        LOG.debug("Read machine '{}' with {} nodes and {} edges",
                machine.title().orElse(""), nodes.size(), edges.size());
        return machine;
    }

    private void readNodes(final JsonNode array, final String enclosing,
            final List<MachineNode> nodes, final List<MachineEdge> edges) {
        for (final JsonNode node : array) {
            final String name = text(node, "name");
            Preconditions.requireDomain(name != null, "Node without a name",
                    "MACHINE_INVALID_JSON");
            final String parent = text(node, "parent") != null
                    ? text(node, "parent") : enclosing;
            nodes.add(new MachineNode(name,
                    NodeKind.fromType(text(node, "type")), parent,
                    text(node, "title"),
                    readAttributes(node.path("attributes")),
                    readAnnotations(node.path("annotations"))));

            readNodes(node.path("nodes"), name, nodes, edges);
            readEdges(node.path("edges"), edges);
        }
    }

    private void readEdges(final JsonNode array,
            final List<MachineEdge> edges) {
        for (final JsonNode edge : array) {
            if (edge.has("segments")) {
                edges.addAll(readChain(edge).expand());
                continue;
            }
            final String label = text(edge, "label");
            final String condition = text(edge, "condition");
            edges.add(new MachineEdge(text(edge, "source"),
                    text(edge, "target"), arrow(edge), label,
                    condition != null ? condition
                            : EdgeConditions.extract(label),
                    readAnnotations(edge.path("annotations"))));
        }
    }

    private EdgeChain readChain(final JsonNode edge) {
        final List<String> sources = edge.has("sources")
                ? strings(edge.path("sources"))
                : List.of(text(edge, "source"));
        final List<EdgeChain.Segment> segments = new ArrayList<>();
        for (final JsonNode segment : edge.path("segments")) {
            segments.add(new EdgeChain.Segment(
                    strings(segment.path("targets")), arrow(segment),
                    text(segment, "label"), text(segment, "condition"),
                    readAnnotations(segment.path("annotations"))));
        }
        return new EdgeChain(sources, segments);
    }

    private static ArrowKind arrow(final JsonNode edge) {
        final String arrow = text(edge, "arrowType");
        return ArrowKind.parse(arrow != null ? arrow : text(edge, "arrowKind"));
    }

    private static List<Attribute> readAttributes(final JsonNode array) {
        final List<Attribute> attributes = new ArrayList<>();
        for (final JsonNode attribute : array) {
            final String name = text(attribute, "name");
            final String type = text(attribute, "type");
            final JsonNode value = attribute.get("value");
            if (value != null && value.isTextual()) {
                attributes.add(Attribute.parse(name, type, value.asText()));
            } else if (value != null && !value.isNull()
                    && "string".equalsIgnoreCase(type)) {
                attributes.add(new Attribute(name, type,
                        Value.of(AttributeValues.stripQuotes(value.toString()))));
            } else {
                attributes.add(new Attribute(name, type, Value.fromJson(value)));
            }
        }
        return attributes;
    }

    private static List<Annotation> readAnnotations(final JsonNode array) {
        final List<Annotation> annotations = new ArrayList<>();
        for (final JsonNode annotation : array) {
            if (annotation.isTextual()) {
                annotations.add(Annotation.of(annotation.asText()));
            } else {
                annotations.add(new Annotation(text(annotation, "name"),
                        text(annotation, "value")));
            }
        }
        return annotations;
    }

    private static List<String> strings(final JsonNode array) {
        final List<String> values = new ArrayList<>();
        if (array.isTextual()) {
            values.add(array.asText());
            return values;
        }
        for (final JsonNode item : array) {
            values.add(item.asText());
        }
        return values;
    }

    private static String text(final JsonNode node, final String field) {
        final JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

}
