package co.fanki.machineflow.execution.application;

import co.fanki.machineflow.execution.application.ExecutionService.RunResult;
import co.fanki.machineflow.execution.domain.EngineFault;
import co.fanki.machineflow.execution.domain.ExecutionEngine;
import co.fanki.machineflow.execution.domain.ExecutionState;
import co.fanki.machineflow.shared.DomainException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Unit tests for {@link ExecutionController}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ExecutionControllerTest {

    private ExecutionService executionService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        executionService = mock(ExecutionService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(
                new ExecutionController(executionService)).build();
    }

    @Test
    void whenCreatingRun_givenKnownMachine_shouldAnswerCreated()
            throws Exception {
        final ExecutionEngine engine = mock(ExecutionEngine.class);
        when(engine.version()).thenReturn(1L);
        when(executionService.create("review", null)).thenReturn(
                new ExecutionRun("run-1", "m-1", "review", engine,
                        Instant.parse("2026-02-10T08:30:00Z")));

        mockMvc.perform(post("/api/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"machine\": \"review\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("run-1"))
                .andExpect(jsonPath("$.machineName").value("review"))
                .andExpect(jsonPath("$.version").value(1));
    }

    @Test
    void whenCreatingRun_givenBlankMachine_shouldAnswerBadRequest()
            throws Exception {
        mockMvc.perform(post("/api/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"machine\": \"\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void whenReadingState_givenUnknownRun_shouldAnswerNotFound()
            throws Exception {
        when(executionService.state("missing")).thenThrow(
                new DomainException("Run not found: missing",
                        ExecutionService.NOT_FOUND));

        mockMvc.perform(get("/api/runs/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("RUN_NOT_FOUND"));
    }

    @Test
    void whenResuming_givenUnknownPath_shouldAnswerBadRequest()
            throws Exception {
        doThrow(new EngineFault("Unknown path: path_9"))
                .when(executionService).resume(eq("run-1"), eq("path_9"),
                        isNull());

        mockMvc.perform(post("/api/runs/run-1/paths/path_9/resume"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value(EngineFault.CODE));
    }

    @Test
    void whenRunning_givenNoTickLimit_shouldUseDefault() throws Exception {
        when(executionService.run("run-1",
                ExecutionController.DEFAULT_MAX_TICKS)).thenReturn(
                new RunResult(3, true, new ExecutionState(4, List.of(),
                        new ExecutionState.Metadata(0, 3,
                                Instant.parse("2026-02-10T08:30:00Z")))));

        mockMvc.perform(post("/api/runs/run-1/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ticks").value(3))
                .andExpect(jsonPath("$.quiescent").value(true))
                .andExpect(jsonPath("$.state.version").value(4));

        verify(executionService).run("run-1",
                ExecutionController.DEFAULT_MAX_TICKS);
    }

    @Test
    void whenReadingBarriers_givenHeldPaths_shouldListThemPerBarrier()
            throws Exception {
        when(executionService.barriers("run-1")).thenReturn(
                Map.of("results", List.of("path_1", "path_3")));

        mockMvc.perform(get("/api/runs/run-1/barriers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results[0]").value("path_1"))
                .andExpect(jsonPath("$.results[1]").value("path_3"));
    }

}
