package co.fanki.machineflow.analysis.domain;

import co.fanki.machineflow.analysis.domain.EdgeEvaluator.EdgeEvaluation;
import co.fanki.machineflow.expression.domain.ExpressionEvaluator;
import co.fanki.machineflow.expression.domain.Value;
import co.fanki.machineflow.expression.domain.VariableContext;
import co.fanki.machineflow.machine.domain.Attribute;
import co.fanki.machineflow.machine.domain.Machine;
import co.fanki.machineflow.machine.domain.MachineEdge;
import co.fanki.machineflow.machine.domain.MachineNode;
import co.fanki.machineflow.machine.domain.NodeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link EdgeEvaluator}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class EdgeEvaluatorTest {

    private EdgeEvaluator edgeEvaluator;

    @BeforeEach
    void setUp() {
        edgeEvaluator = new EdgeEvaluator(new ExpressionEvaluator());
    }

    @Test
    void whenEvaluatingEdge_givenNoGuard_shouldBeActive() {
        final EdgeEvaluation evaluation = edgeEvaluator.evaluateEdge(
                MachineEdge.of("A", "B"), VariableContext.empty());

        assertTrue(evaluation.active());
        assertFalse(evaluation.hasCondition());
    }

    @Test
    void whenEvaluatingEdge_givenGuardOnDefaults_shouldFollowIt() {
        final VariableContext context = edgeEvaluator.createDefaultContext(
                List.of());

        assertTrue(edgeEvaluator.evaluateEdge(
                MachineEdge.labeled("A", "B", "when: errorCount == 0"),
                context).active());
        assertFalse(edgeEvaluator.evaluateEdge(
                MachineEdge.labeled("A", "C", "when: errorCount > 0"),
                context).active());
    }

    @Test
    void whenEvaluatingEdge_givenBrokenGuard_shouldBeInactiveWithError() {
        final EdgeEvaluation evaluation = edgeEvaluator.evaluateEdge(
                MachineEdge.guarded("A", "B", "a >"), VariableContext.empty());

        assertFalse(evaluation.active());
        assertTrue(evaluation.hasCondition());
        assertNotNull(evaluation.error());
    }

    @Test
    void whenCreatingDefaultContext_givenMachineAttributes_shouldSkipMetadata() {
        final VariableContext context = edgeEvaluator.createDefaultContext(
                List.of(
                        new Attribute("description", null, Value.of("x")),
                        new Attribute("mode", null, Value.of("'fast'")),
                        new Attribute("errorCount", null, Value.of(2)),
                        new Attribute("activeState", null, Value.of("Review"))));

        assertTrue(context.lookup("description").isUndefined());
        assertEquals(Value.of("fast"), context.lookup("mode"));
        assertEquals(Value.of("fast"), context.lookup("attributes.mode"));
        assertEquals(Value.of(2), context.lookup("errorCount"));
        assertEquals(Value.of(2), context.lookup("errors"));
        assertEquals(Value.of("Review"), context.lookup("activeState"));
    }

    @Test
    void whenEvaluatingEdges_givenMachine_shouldUseNodeDefaults() {
        final Machine machine = new Machine("Preview", null, List.of(
                MachineNode.of("Start", NodeKind.INIT),
                new MachineNode("Config", NodeKind.CONTEXT, null, null,
                        List.of(new Attribute("retries", "number",
                                Value.of(3))), null),
                MachineNode.of("Retry", NodeKind.TASK),
                MachineNode.of("Stop", NodeKind.TASK)),
                List.of(
                        MachineEdge.labeled("Start", "Retry",
                                "when: Config.retries > 0"),
                        MachineEdge.labeled("Start", "Stop",
                                "unless: Config.retries > 0")));

        final List<EdgeEvaluation> evaluations =
                edgeEvaluator.evaluateEdges(machine);

        assertTrue(evaluations.get(0).active());
        assertFalse(evaluations.get(1).active());
        assertEquals("!(Config.retries > 0)", evaluations.get(1).condition());
    }

}
