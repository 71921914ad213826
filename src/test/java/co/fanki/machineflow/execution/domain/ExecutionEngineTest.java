package co.fanki.machineflow.execution.domain;

import co.fanki.machineflow.expression.domain.ExpressionEvaluator;
import co.fanki.machineflow.expression.domain.Value;
import co.fanki.machineflow.machine.domain.Annotation;
import co.fanki.machineflow.machine.domain.ArrowKind;
import co.fanki.machineflow.machine.domain.Attribute;
import co.fanki.machineflow.machine.domain.Machine;
import co.fanki.machineflow.machine.domain.MachineEdge;
import co.fanki.machineflow.machine.domain.MachineNode;
import co.fanki.machineflow.machine.domain.NodeKind;
import co.fanki.machineflow.shared.DomainException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ExecutionEngine}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ExecutionEngineTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();

    @Test
    void whenStarting_givenInitNode_shouldCreateActivePathOnIt() {
        final ExecutionEngine engine = engine(Machine.of(
                List.of(node("Task", NodeKind.TASK),
                        node("Begin", NodeKind.INIT)),
                List.of(MachineEdge.of("Begin", "Task"))));

        final String pathId = engine.start();

        final PathSnapshot path = engine.path(pathId);
        assertEquals("path_1", pathId);
        assertEquals("Begin", path.currentNode());
        assertEquals(PathStatus.ACTIVE, path.status());
        assertEquals(1, path.invocations("Begin"));
        assertTrue(path.history().isEmpty());
        assertEquals(NOW, path.startedAt());
    }

    @Test
    void whenStarting_givenNoInitNode_shouldUseFirstEntryPoint() {
        final ExecutionEngine engine = engine(Machine.of(
                List.of(node("B", NodeKind.TASK), node("A", NodeKind.TASK)),
                List.of(MachineEdge.of("A", "B"))));

        assertEquals("A", engine.path(engine.start()).currentNode());
    }

    @Test
    void whenStarting_givenUnknownNode_shouldThrowEngineFault() {
        final ExecutionEngine engine = engine(linear(3));

        final EngineFault fault = assertThrows(EngineFault.class,
                () -> engine.start("Nope"));
        assertEquals(EngineFault.CODE, fault.getErrorCode());
    }

    @Test
    void whenStarting_givenDecorationNode_shouldThrowEngineFault() {
        final ExecutionEngine engine = engine(Machine.of(
                List.of(node("A", NodeKind.INIT), node("Hint", NodeKind.NOTE)),
                List.of()));

        assertThrows(EngineFault.class, () -> engine.start("Hint"));
    }

    @Test
    void whenStepping_givenLinearChain_shouldRecordOneHistoryEntryPerStep() {
        final ExecutionEngine engine = engine(linear(6));
        final String pathId = engine.start();

        for (int i = 0; i < 4; i++) {
            engine.step();
        }

        final PathSnapshot path = engine.path(pathId);
        assertEquals(4, path.history().size());
        assertEquals(4, path.stepCount());
        assertEquals("N4", path.currentNode());
        for (int i = 0; i < 4; i++) {
            final Transition transition = path.history().get(i);
            assertEquals("N" + i, transition.from());
            assertEquals("N" + (i + 1), transition.to());
        }
    }

    @Test
    void whenRunning_givenLinearChain_shouldCompleteAtLastNode() {
        final ExecutionEngine engine = engine(linear(4));
        final String pathId = engine.start();

        engine.runUntilQuiescent(50);

        final PathSnapshot path = engine.path(pathId);
        assertEquals(PathStatus.COMPLETED, path.status());
        assertEquals("N3", path.currentNode());
        assertTrue(engine.isQuiescent());
        assertEquals(0, engine.errorCount());
    }

    @Test
    void whenStepping_givenThreeUnguardedEdges_shouldForkIntoThreePaths() {
        final ExecutionEngine engine = engine(Machine.of(
                List.of(node("Start", NodeKind.INIT),
                        node("B", NodeKind.TASK), node("C", NodeKind.TASK),
                        node("D", NodeKind.TASK), node("End", NodeKind.TASK)),
                List.of(MachineEdge.of("Start", "B"),
                        MachineEdge.of("Start", "C"),
                        MachineEdge.of("Start", "D"),
                        MachineEdge.of("B", "End"),
                        MachineEdge.of("C", "End"),
                        MachineEdge.of("D", "End"))));
        final String original = engine.start();

        assertEquals(1, engine.step());

        final ExecutionState state = engine.snapshot();
        assertEquals(3, state.paths().size());
        final Set<String> current = new HashSet<>();
        for (final PathSnapshot path : state.paths()) {
            assertEquals(PathStatus.ACTIVE, path.status());
            assertEquals("Start", path.startNode());
            assertEquals(1, path.history().size());
            current.add(path.currentNode());
        }
        assertEquals(Set.of("B", "C", "D"), current);
        assertEquals("B", engine.path(original).currentNode());
    }

    @Test
    void whenForking_givenPathLimit_shouldRefuseExtraForks() {
        final ExecutionEngine engine = new ExecutionEngine(Machine.of(
                List.of(node("Start", NodeKind.INIT),
                        node("B", NodeKind.TASK), node("C", NodeKind.TASK),
                        node("D", NodeKind.TASK)),
                List.of(MachineEdge.of("Start", "B"),
                        MachineEdge.of("Start", "C"),
                        MachineEdge.of("Start", "D"))),
                evaluator, new ExecutionLimits(10, 100, 2, Duration.ZERO),
                WaitPolicy.EXTERNAL_ANNOTATION, CLOCK);
        engine.start();

        engine.step();

        assertEquals(2, engine.statistics().totalPaths());
    }

    @Test
    void whenRunning_givenNoErrors_shouldFollowHappyGuard() {
        final ExecutionEngine engine = engine(errorRouting());
        final String pathId = engine.start();

        engine.runUntilQuiescent(10);

        final PathSnapshot path = engine.path(pathId);
        assertEquals("B", path.currentNode());
        assertEquals(PathStatus.COMPLETED, path.status());
        assertEquals(1, engine.statistics().totalPaths());
    }

    @Test
    void whenRunning_givenRecordedErrors_shouldFollowErrorGuard() {
        final ExecutionEngine engine = engine(errorRouting());
        for (int i = 0; i < 5; i++) {
            engine.recordError("tool failed");
        }
        final String pathId = engine.start();

        engine.runUntilQuiescent(10);

        final PathSnapshot path = engine.path(pathId);
        assertEquals("C", path.currentNode());
        assertEquals(PathStatus.COMPLETED, path.status());
        assertEquals("when: errorCount > 0",
                path.history().get(0).transitionLabel());
    }

    @Test
    void whenRunning_givenCycleOverCeiling_shouldFailWithBudgetReason() {
        final ExecutionEngine engine = new ExecutionEngine(Machine.of(
                List.of(node("A", NodeKind.INIT), node("B", NodeKind.TASK)),
                List.of(MachineEdge.of("A", "B"), MachineEdge.of("B", "A"))),
                evaluator, ExecutionLimits.defaults().withMaxNodeInvocations(3),
                WaitPolicy.EXTERNAL_ANNOTATION, CLOCK);
        final String pathId = engine.start();

        engine.runUntilQuiescent(100);

        final PathSnapshot path = engine.path(pathId);
        assertEquals(PathStatus.FAILED, path.status());
        assertEquals(3, path.invocations("A"));
        assertEquals(3, path.invocations("B"));
        assertEquals("cycle exceeded budget: node 'A' reached 3 invocations",
                path.failureReason());
        assertEquals(1, engine.errorCount());
    }

    @Test
    void whenRunning_givenNodeMaxStepsAttribute_shouldUseNodeCeiling() {
        final MachineNode loop = new MachineNode("Loop", NodeKind.TASK, null,
                null, List.of(new Attribute("maxSteps", "number",
                        Value.of(2))), null);
        final ExecutionEngine engine = engine(Machine.of(
                List.of(node("A", NodeKind.INIT), loop),
                List.of(MachineEdge.of("A", "Loop"),
                        MachineEdge.of("Loop", "Loop"))));
        final String pathId = engine.start();

        engine.runUntilQuiescent(100);

        final PathSnapshot path = engine.path(pathId);
        assertEquals(PathStatus.FAILED, path.status());
        assertEquals(2, path.invocations("Loop"));
    }

    @Test
    void whenRunning_givenStepLimit_shouldFailPath() {
        final ExecutionEngine engine = new ExecutionEngine(Machine.of(
                List.of(node("A", NodeKind.INIT), node("B", NodeKind.TASK)),
                List.of(MachineEdge.of("A", "B"), MachineEdge.of("B", "A"))),
                evaluator, new ExecutionLimits(100, 2, 100, Duration.ZERO),
                WaitPolicy.EXTERNAL_ANNOTATION, CLOCK);
        final String pathId = engine.start();

        engine.runUntilQuiescent(100);

        final PathSnapshot path = engine.path(pathId);
        assertEquals(PathStatus.FAILED, path.status());
        assertEquals(2, path.stepCount());
        assertEquals("exceeded maximum steps (2)", path.failureReason());
    }

    @Test
    void whenStepping_givenNoApplicableGuard_shouldFailAsDeadEnd() {
        final ExecutionEngine engine = engine(Machine.of(
                List.of(node("A", NodeKind.INIT), node("B", NodeKind.TASK)),
                List.of(MachineEdge.guarded("A", "B", "errorCount > 3"))));
        final String pathId = engine.start();

        engine.step();

        final PathSnapshot path = engine.path(pathId);
        assertEquals(PathStatus.FAILED, path.status());
        assertEquals("dead end: no applicable transition from A",
                path.failureReason());
        assertEquals(1, engine.errorCount());
    }

    @Test
    void whenStepping_givenBrokenGuard_shouldTreatEdgeAsIneligible() {
        final ExecutionEngine engine = engine(Machine.of(
                List.of(node("A", NodeKind.INIT), node("B", NodeKind.TASK),
                        node("C", NodeKind.TASK)),
                List.of(MachineEdge.guarded("A", "B", "count >"),
                        MachineEdge.of("A", "C"))));
        final String pathId = engine.start();

        engine.step();

        assertEquals("C", engine.path(pathId).currentNode());
        assertEquals(1, engine.statistics().totalPaths());
    }

    @Test
    void whenStepping_givenContextNodeWithoutTransition_shouldComplete() {
        final ExecutionEngine engine = engine(Machine.of(
                List.of(node("A", NodeKind.INIT),
                        node("Memo", NodeKind.CONTEXT),
                        node("B", NodeKind.TASK)),
                List.of(MachineEdge.of("A", "Memo"),
                        MachineEdge.guarded("Memo", "B", "false"))));
        final String pathId = engine.start();

        engine.runUntilQuiescent(10);

        assertEquals(PathStatus.COMPLETED, engine.path(pathId).status());
        assertEquals("Memo", engine.path(pathId).currentNode());
    }

    @Test
    void whenStepping_givenExternalNode_shouldWaitAndResumeWithOutput() {
        final MachineNode work = new MachineNode("Work", NodeKind.TASK, null,
                null, null, List.of(Annotation.of("external")));
        final ExecutionEngine engine = engine(Machine.of(
                List.of(node("A", NodeKind.INIT), work,
                        node("Result", NodeKind.CONTEXT)),
                List.of(MachineEdge.of("A", "Work"),
                        MachineEdge.of("Work", "Result"))));
        final String pathId = engine.start();

        engine.step();
        assertEquals(PathStatus.WAITING, engine.path(pathId).status());
        assertEquals(0, engine.step());
        assertTrue(engine.isQuiescent());

        engine.resume(pathId, "{\"score\": 7}");
        assertEquals("{\"score\": 7}",
                engine.path(pathId).history().get(0).output());

        engine.runUntilQuiescent(10);

        final PathSnapshot path = engine.path(pathId);
        assertEquals(PathStatus.COMPLETED, path.status());
        assertEquals("Result", path.currentNode());
        assertEquals(Value.of(7), engine.contextValues("Result").get("score"));
        assertEquals(Value.of(7),
                engine.runtimeContext(pathId).lookup("Result.score"));
    }

    @Test
    void whenResuming_givenActivePath_shouldThrow() {
        final ExecutionEngine engine = engine(linear(3));
        final String pathId = engine.start();

        final DomainException ex = assertThrows(DomainException.class,
                () -> engine.resume(pathId, null));
        assertEquals("PATH_NOT_WAITING", ex.getErrorCode());
    }

    @Test
    void whenCancelling_givenActivePath_shouldFailWithoutCountingError() {
        final ExecutionEngine engine = engine(linear(3));
        final String pathId = engine.start();

        engine.cancel(pathId);

        final PathSnapshot path = engine.path(pathId);
        assertEquals(PathStatus.FAILED, path.status());
        assertEquals("cancelled", path.failureReason());
        assertEquals(0, engine.errorCount());
    }

    @Test
    void whenCancelling_givenCompletedPath_shouldDoNothing() {
        final ExecutionEngine engine = engine(linear(2));
        final String pathId = engine.start();
        engine.runUntilQuiescent(10);
        final long version = engine.version();

        engine.cancel(pathId);

        assertEquals(PathStatus.COMPLETED, engine.path(pathId).status());
        assertNull(engine.path(pathId).failureReason());
        assertEquals(version, engine.version());
    }

    @Test
    void whenReadingPath_givenUnknownId_shouldThrowEngineFault() {
        final ExecutionEngine engine = engine(linear(2));

        assertThrows(EngineFault.class, () -> engine.path("path_99"));
        assertThrows(EngineFault.class, () -> engine.cancel("path_99"));
    }

    @Test
    void whenStepping_givenStateModule_shouldEnterFirstTaskChild() {
        final MachineNode draft = new MachineNode("Draft", NodeKind.TASK,
                "Review", null, null, null);
        final MachineNode approve = new MachineNode("Approve", NodeKind.STATE,
                "Review", null, null, null);
        final ExecutionEngine engine = engine(Machine.of(
                List.of(node("A", NodeKind.INIT),
                        node("Review", NodeKind.STATE), approve, draft,
                        node("Done", NodeKind.TASK)),
                List.of(MachineEdge.labeled("A", "Review", "submit"),
                        MachineEdge.of("Review", "Done"))));
        final String pathId = engine.start();

        engine.step();

        PathSnapshot path = engine.path(pathId);
        assertEquals("Draft", path.currentNode());
        assertEquals("submit (module entry: Review -> Draft)",
                path.history().get(0).transitionLabel());
        assertEquals("Review", path.stateTransitions().get(0).stateName());
        assertEquals("Review",
                engine.runtimeContext(pathId).lookup("activeState").asString());

        engine.step();

        path = engine.path(pathId);
        assertEquals("Done", path.currentNode());
    }

    @Test
    void whenWritingContext_givenTaskNode_shouldThrowEngineFault() {
        final ExecutionEngine engine = engine(linear(2));

        assertThrows(EngineFault.class,
                () -> engine.writeContext("N0", Map.of("a", Value.TRUE)));
    }

    @Test
    void whenWritingContext_givenContextNode_shouldBeVisibleToGuards() {
        final ExecutionEngine engine = engine(Machine.of(
                List.of(node("A", NodeKind.INIT), node("B", NodeKind.TASK),
                        node("Settings", NodeKind.CONTEXT)),
                List.of(MachineEdge.guarded("A", "B",
                        "Settings.enabled == true"))));
        final String pathId = engine.start();

        engine.writeContext("Settings", Map.of("enabled", Value.TRUE));
        engine.step();

        assertEquals("B", engine.path(pathId).currentNode());
    }

    @Test
    void whenPruning_givenCompletedPath_shouldRemoveIt() {
        final ExecutionEngine engine = engine(linear(2));
        final String done = engine.start();
        engine.runUntilQuiescent(10);
        final String running = engine.start();

        assertEquals(1, engine.prune(Duration.ZERO));

        assertThrows(EngineFault.class, () -> engine.path(done));
        assertEquals(PathStatus.ACTIVE, engine.path(running).status());
    }

    @Test
    void whenExpiring_givenLongWait_shouldFailWaitingPath() {
        final MachineNode work = new MachineNode("Work", NodeKind.TASK, null,
                null, null, List.of(Annotation.of("external")));
        final ExecutionEngine engine = new ExecutionEngine(Machine.of(
                List.of(node("A", NodeKind.INIT), work),
                List.of(MachineEdge.of("A", "Work"))),
                evaluator,
                new ExecutionLimits(100, 100, 100, Duration.ofMinutes(5)),
                WaitPolicy.EXTERNAL_ANNOTATION, CLOCK);
        final String pathId = engine.start();
        engine.step();

        assertEquals(0, engine.expireWaiting(NOW.plus(Duration.ofMinutes(1))));
        assertEquals(1, engine.expireWaiting(NOW.plus(Duration.ofMinutes(10))));

        final PathSnapshot path = engine.path(pathId);
        assertEquals(PathStatus.FAILED, path.status());
        assertEquals("wait timeout", path.failureReason());
    }

    @Test
    void whenExpiring_givenDisabledTimeout_shouldKeepWaiting() {
        final MachineNode work = new MachineNode("Work", NodeKind.TASK, null,
                null, null, List.of(Annotation.of("external")));
        final ExecutionEngine engine = engine(Machine.of(
                List.of(node("A", NodeKind.INIT), work),
                List.of(MachineEdge.of("A", "Work"))));
        engine.start();
        engine.step();

        assertEquals(0, engine.expireWaiting(NOW.plus(Duration.ofDays(30))));
    }

    @Test
    void whenVisualizing_givenOneStep_shouldMarkCurrentVisitedAndPending() {
        final ExecutionEngine engine = engine(linear(3));
        final String pathId = engine.start();
        engine.step();

        final VisualizationState view = engine.visualization();

        assertEquals(VisualizationState.NodeStatus.VISITED,
                view.nodeStates().get("N0").status());
        assertEquals(VisualizationState.NodeStatus.CURRENT,
                view.nodeStates().get("N1").status());
        assertEquals(VisualizationState.NodeStatus.PENDING,
                view.nodeStates().get("N2").status());
        assertEquals(1, view.activePaths());
        assertEquals(List.of("N1"), view.currentNodes());
        assertEquals(1, view.availableTransitions().size());
        final VisualizationState.AvailableTransition next =
                view.availableTransitions().get(0);
        assertEquals(pathId, next.pathId());
        assertEquals("N2", next.target());
        assertTrue(next.eligible());
    }

    @Test
    void whenCountingPaths_givenMixedOutcomes_shouldReportEachStatus() {
        final ExecutionEngine engine = engine(linear(2));
        engine.start();
        engine.runUntilQuiescent(10);
        final String cancelled = engine.start();
        engine.cancel(cancelled);
        engine.start();

        final PathStatistics statistics = engine.statistics();

        assertEquals(3, statistics.totalPaths());
        assertEquals(1, statistics.activePaths());
        assertEquals(0, statistics.waitingPaths());
        assertEquals(1, statistics.completedPaths());
        assertEquals(1, statistics.failedPaths());
        assertEquals(1, statistics.totalSteps());
    }

    @Test
    void whenForking_givenSiblingMovesOn_shouldLeaveOtherPathsUntouched() {
        final ExecutionEngine engine = engine(Machine.of(
                List.of(node("Start", NodeKind.INIT),
                        node("B", NodeKind.TASK), node("C", NodeKind.TASK),
                        node("D", NodeKind.TASK)),
                List.of(MachineEdge.of("Start", "B"),
                        MachineEdge.of("Start", "C"),
                        MachineEdge.of("B", "D"))));
        final String original = engine.start();
        engine.step();
        final PathSnapshot forkBefore = engine.path("path_2");

        engine.step();

        final PathSnapshot moved = engine.path(original);
        final PathSnapshot fork = engine.path("path_2");
        assertEquals("D", moved.currentNode());
        assertEquals(2, moved.history().size());
        assertEquals(1, moved.invocations("D"));
        assertEquals(0, moved.invocations("C"));
        assertEquals(PathStatus.COMPLETED, fork.status());
        assertEquals("C", fork.currentNode());
        assertEquals(1, fork.history().size());
        assertEquals(0, fork.invocations("D"));
        assertEquals(0, fork.invocations("B"));
        assertEquals(forkBefore.history(), fork.history());
        assertEquals(forkBefore.nodeInvocationCounts(),
                fork.nodeInvocationCounts());
    }

    @Test
    void whenStepping_givenGuardWithNonAsciiDigit_shouldSkipEdgeAndKeepRunning() {
        final ExecutionEngine engine = engine(Machine.of(
                List.of(node("A", NodeKind.INIT), node("B", NodeKind.TASK),
                        node("C", NodeKind.TASK)),
                List.of(MachineEdge.labeled("A", "B",
                                "when: errorCount == \u0663"),
                        MachineEdge.of("A", "C"))));
        final String pathId = engine.start();

        assertEquals(1, engine.step());

        final PathSnapshot path = engine.path(pathId);
        assertEquals("C", path.currentNode());
        assertEquals(PathStatus.ACTIVE, path.status());
        assertEquals(1, engine.snapshot().paths().size());
    }

    @Test
    void whenEnteringModule_givenOnlyDecorationChildren_shouldStayOnStateNode() {
        final MachineNode memo = new MachineNode("Memo", NodeKind.NOTE, "S",
                null, null, null);
        final ExecutionEngine engine = engine(Machine.of(
                List.of(node("A", NodeKind.INIT), node("S", NodeKind.STATE),
                        memo),
                List.of(MachineEdge.of("A", "S"))));
        final String pathId = engine.start();

        engine.runUntilQuiescent(10);

        final PathSnapshot path = engine.path(pathId);
        assertEquals(PathStatus.COMPLETED, path.status());
        assertEquals("S", path.currentNode());
        assertEquals("S", path.history().get(0).to());
        assertEquals("", path.history().get(0).transitionLabel());
        assertEquals(0, path.invocations("Memo"));
        assertEquals("S", path.stateTransitions().get(0).stateName());
    }

    @Test
    void whenCrossingBarrier_givenSiblingStillRunning_shouldHoldUntilItArrives() {
        final ExecutionEngine engine = engine(barrierMachine(
                Annotation.of("barrier")));
        final String first = engine.start();
        engine.step();

        engine.step();

        assertEquals(PathStatus.WAITING, engine.path(first).status());
        assertEquals("B", engine.path(first).currentNode());
        assertEquals(Map.of("default", List.of(first)), engine.barriers());
        final DomainException error = assertThrows(DomainException.class,
                () -> engine.resume(first, null));
        assertEquals("PATH_AT_BARRIER", error.getErrorCode());

        engine.step();

        assertTrue(engine.barriers().isEmpty());
        assertEquals("Join", engine.path(first).currentNode());
        assertEquals("Join", engine.path("path_2").currentNode());
        assertEquals(PathStatus.ACTIVE, engine.path(first).status());

        engine.runUntilQuiescent(10);

        assertEquals(2, engine.statistics().completedPaths());
        assertEquals("End", engine.path(first).currentNode());
        assertEquals("End", engine.path("path_2").currentNode());
    }

    @Test
    void whenCrossingJoin_givenAllPathsArrived_shouldMergeIntoLastArrival() {
        final ExecutionEngine engine = engine(barrierMachine(
                new Annotation("join", "\"results\"")));
        final String first = engine.start();

        engine.step();
        engine.step();
        assertEquals(Map.of("results", List.of(first)), engine.barriers());
        engine.step();

        final PathSnapshot merged = engine.path(first);
        final PathSnapshot survivor = engine.path("path_2");
        assertEquals(PathStatus.COMPLETED, merged.status());
        assertEquals("B", merged.currentNode());
        assertEquals(PathStatus.ACTIVE, survivor.status());
        assertEquals("Join", survivor.currentNode());
        assertEquals(0, engine.errorCount());
    }

    @Test
    void whenCancelling_givenLastPathTheBarrierWaitsFor_shouldReleaseBarrier() {
        final ExecutionEngine engine = engine(barrierMachine(
                Annotation.of("sync")));
        final String first = engine.start();
        engine.step();
        engine.step();

        engine.cancel("path_2");

        assertTrue(engine.barriers().isEmpty());
        assertEquals(PathStatus.ACTIVE, engine.path(first).status());
        assertEquals("Join", engine.path(first).currentNode());
    }

    @Test
    void whenStepping_givenOnlyAsyncEdges_shouldSpawnPathsAndCompleteParent() {
        final ExecutionEngine engine = engine(Machine.of(
                List.of(node("Start", NodeKind.INIT),
                        node("W1", NodeKind.TASK), node("W2", NodeKind.TASK)),
                List.of(annotated("Start", "W1", Annotation.of("async")),
                        annotated("Start", "W2", Annotation.of("parallel")))));
        final String parent = engine.start();

        engine.step();

        assertEquals(PathStatus.COMPLETED, engine.path(parent).status());
        assertEquals("Start", engine.path(parent).currentNode());
        final PathSnapshot first = engine.path("path_2");
        final PathSnapshot second = engine.path("path_3");
        assertEquals("W1", first.startNode());
        assertEquals("W1", first.currentNode());
        assertTrue(first.history().isEmpty());
        assertEquals(PathStatus.ACTIVE, first.status());
        assertEquals("W2", second.currentNode());

        engine.runUntilQuiescent(10);

        assertEquals(3, engine.statistics().completedPaths());
    }

    @Test
    void whenStepping_givenPlainAndSpawnEdge_shouldMoveParentAndSpawnChild() {
        final ExecutionEngine engine = engine(Machine.of(
                List.of(node("Start", NodeKind.INIT),
                        node("B", NodeKind.TASK), node("W", NodeKind.TASK)),
                List.of(MachineEdge.of("Start", "B"),
                        annotated("Start", "W", Annotation.of("spawn")))));
        final String parent = engine.start();

        engine.step();

        assertEquals("B", engine.path(parent).currentNode());
        assertEquals(PathStatus.ACTIVE, engine.path(parent).status());
        assertEquals("W", engine.path("path_2").currentNode());
        assertEquals(2, engine.snapshot().paths().size());
    }

    @Test
    void whenStepping_givenActivePaths_shouldIncreaseVersion() {
        final ExecutionEngine engine = engine(linear(3));
        engine.start();
        final long before = engine.version();

        engine.step();

        assertTrue(engine.version() > before);
        assertFalse(engine.isQuiescent());
        assertEquals(engine.version(), engine.snapshot().version());
    }

    private ExecutionEngine engine(final Machine machine) {
        return new ExecutionEngine(machine, evaluator,
                ExecutionLimits.defaults(), WaitPolicy.EXTERNAL_ANNOTATION,
                CLOCK);
    }

    private static MachineNode node(final String name, final NodeKind kind) {
        return MachineNode.of(name, kind);
    }

    private static Machine linear(final int size) {
        final List<MachineNode> nodes = new ArrayList<>();
        final List<MachineEdge> edges = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            nodes.add(node("N" + i, i == 0 ? NodeKind.INIT : NodeKind.TASK));
            if (i > 0) {
                edges.add(MachineEdge.of("N" + (i - 1), "N" + i));
            }
        }
        return Machine.of(nodes, edges);
    }

    private static MachineEdge annotated(final String source,
            final String target, final Annotation annotation) {
        return new MachineEdge(source, target, ArrowKind.ASSOCIATION, null,
                null, List.of(annotation));
    }

    /**
     * Start forks into B and C; B reaches Join in one step, C through X in
     * two, both over edges carrying the given barrier annotation.
     */
    private static Machine barrierMachine(final Annotation barrier) {
        return Machine.of(
                List.of(node("Start", NodeKind.INIT), node("B", NodeKind.TASK),
                        node("C", NodeKind.TASK), node("X", NodeKind.TASK),
                        node("Join", NodeKind.TASK),
                        node("End", NodeKind.TASK)),
                List.of(MachineEdge.of("Start", "B"),
                        MachineEdge.of("Start", "C"),
                        annotated("B", "Join", barrier),
                        MachineEdge.of("C", "X"),
                        annotated("X", "Join", barrier),
                        MachineEdge.of("Join", "End")));
    }

    private static Machine errorRouting() {
        return Machine.of(
                List.of(node("A", NodeKind.INIT), node("B", NodeKind.TASK),
                        node("C", NodeKind.TASK)),
                List.of(MachineEdge.labeled("A", "B", "when: errorCount == 0"),
                        MachineEdge.labeled("A", "C",
                                "when: errorCount > 0")));
    }

}
