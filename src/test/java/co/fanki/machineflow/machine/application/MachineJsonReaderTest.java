package co.fanki.machineflow.machine.application;

import co.fanki.machineflow.expression.domain.Value;
import co.fanki.machineflow.machine.domain.ArrowKind;
import co.fanki.machineflow.machine.domain.Machine;
import co.fanki.machineflow.machine.domain.MachineEdge;
import co.fanki.machineflow.machine.domain.MachineNode;
import co.fanki.machineflow.machine.domain.NodeKind;
import co.fanki.machineflow.shared.DomainException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link MachineJsonReader}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class MachineJsonReaderTest {

    private MachineJsonReader reader;

    @BeforeEach
    void setUp() {
        reader = new MachineJsonReader(new ObjectMapper());
    }

    @Test
    void whenReading_givenFlatMachine_shouldBuildNodesAndEdges() {
        final Machine machine = reader.read("""
                {
                  "title": "Review flow",
                  "attributes": [{"name": "retries", "type": "number", "value": "3"}],
                  "nodes": [
                    {"name": "Start", "type": "init"},
                    {"name": "Draft", "type": "task",
                     "attributes": [{"name": "prompt", "value": "'write it'"}],
                     "annotations": ["async", {"name": "maxSteps", "value": "4"}]},
                    {"name": "Done", "type": "state"}
                  ],
                  "edges": [
                    {"source": "Start", "target": "Draft"},
                    {"source": "Draft", "target": "Done", "arrowType": "-->",
                     "label": "when: retries > 1"}
                  ]
                }
                """);

        assertEquals("Review flow", machine.title().orElseThrow());
        assertEquals(Value.of(3), machine.attributes().get(0).value());
        assertEquals(3, machine.nodes().size());
        final MachineNode draft = machine.node("Draft").orElseThrow();
        assertEquals(NodeKind.TASK, draft.kind());
        assertEquals(Value.of("write it"),
                draft.attribute("prompt").orElseThrow().value());
        assertTrue(draft.hasAnnotation("async"));
        assertEquals("4", draft.annotation("maxSteps").orElseThrow().value());

        final MachineEdge edge = machine.edges().get(1);
        assertEquals(ArrowKind.DEPENDENCY, edge.arrowKind());
        assertEquals("retries > 1", edge.guard());
        assertNull(machine.edges().get(0).guard());
    }

    @Test
    void whenReading_givenExplicitCondition_shouldPreferItOverLabel() {
        final Machine machine = reader.read("""
                {"nodes": [{"name": "A"}, {"name": "B"}],
                 "edges": [{"source": "A", "target": "B",
                            "label": "when: x > 1", "condition": "y == 2"}]}
                """);

        assertEquals("y == 2", machine.edges().get(0).guard());
        assertEquals(NodeKind.TASK, machine.node("A").orElseThrow().kind());
    }

    @Test
    void whenReading_givenNestedNodes_shouldAssignEnclosingParent() {
        final Machine machine = reader.read("""
                {"nodes": [
                  {"name": "Review", "type": "state",
                   "nodes": [{"name": "Draft"}, {"name": "Check"}],
                   "edges": [{"source": "Draft", "target": "Check"}]}
                ]}
                """);

        assertEquals("Review",
                machine.node("Draft").orElseThrow().parent().orElseThrow());
        assertEquals(List.of("Draft", "Check"), machine.children("Review")
                .stream().map(MachineNode::name).toList());
        assertEquals("Review.Draft", machine.qualifiedName("Draft"));
        assertEquals(1, machine.edges().size());
    }

    @Test
    void whenReading_givenChainedSegments_shouldExpandEveryHop() {
        final Machine machine = reader.read("""
                {"nodes": [{"name": "A"}, {"name": "B"}, {"name": "C"},
                           {"name": "D"}],
                 "edges": [{"sources": ["A"],
                            "segments": [{"targets": ["B", "C"]},
                                         {"targets": ["D"],
                                          "label": "when: ready"}]}]}
                """);

        final List<MachineEdge> edges = machine.edges();
        assertEquals(4, edges.size());
        assertEquals("A", edges.get(0).source());
        assertEquals("B", edges.get(0).target());
        assertEquals("A", edges.get(1).source());
        assertEquals("C", edges.get(1).target());
        assertEquals("D", edges.get(3).target());
        assertEquals("ready", edges.get(3).guard());
    }

    @Test
    void whenReading_givenBrokenJson_shouldThrowInvalidJson() {
        final DomainException ex = assertThrows(DomainException.class,
                () -> reader.read("{\"nodes\": ["));
        assertEquals("MACHINE_INVALID_JSON", ex.getErrorCode());
    }

    @Test
    void whenReading_givenNodeWithoutName_shouldThrowInvalidJson() {
        final DomainException ex = assertThrows(DomainException.class,
                () -> reader.read("{\"nodes\": [{\"type\": \"task\"}]}"));
        assertEquals("MACHINE_INVALID_JSON", ex.getErrorCode());
    }

    @Test
    void whenReading_givenEdgeToUnknownNode_shouldThrowUnknownNode() {
        final DomainException ex = assertThrows(DomainException.class,
                () -> reader.read("""
                        {"nodes": [{"name": "A"}],
                         "edges": [{"source": "A", "target": "Ghost"}]}
                        """));
        assertEquals("MACHINE_UNKNOWN_NODE", ex.getErrorCode());
    }

    @Test
    void whenReading_givenUnknownNodeType_shouldThrow() {
        final DomainException ex = assertThrows(DomainException.class,
                () -> reader.read("{\"nodes\": [{\"name\": \"A\", "
                        + "\"type\": \"robot\"}]}"));
        assertEquals("MACHINE_UNKNOWN_NODE_TYPE", ex.getErrorCode());
    }

}
