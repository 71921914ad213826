package co.fanki.machineflow.execution.application;

import co.fanki.machineflow.shared.DomainException;
import co.fanki.machineflow.shared.ErrorResponses;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * REST controller driving machine runs.
 *
 * <p>A run is created for a registered machine and advanced explicitly,
 * one tick per {@code step} call or until quiescent with {@code run}.
 * Waiting paths are woken with {@code resume}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/runs")
@Tag(name = "Runs", description = "Create and drive machine executions")
public class ExecutionController {

    private static final Logger LOG = LoggerFactory.getLogger(
            ExecutionController.class);

    /** Ticks run by {@code /run} when the caller gives no limit. */
    static final int DEFAULT_MAX_TICKS = 1000;

    private final ExecutionService executionService;

    /**
     * Creates a new ExecutionController.
     *
     * @param theExecutionService the execution service
     */
    public ExecutionController(final ExecutionService theExecutionService) {
        this.executionService = theExecutionService;
    }

    /**
     * Creates a run and starts its first path.
     *
     * @param request the machine and optional entry node
     * @return the run
     */
    @PostMapping
    @Operation(summary = "Create a run",
            description = "Starts a path on the entry node, or on the first"
                    + " init node when none is given.")
    public ResponseEntity<?> create(
            @Valid @RequestBody final CreateRunRequest request) {

        LOG.info("Creating run of machine {}", request.machine());

        try {
            final ExecutionRun run = executionService.create(
                    request.machine(), request.entryNode());
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(RunResponse.from(run));
        } catch (final DomainException e) {
            LOG.warn("Run not created: {}", e.getMessage());
            return ErrorResponses.of(e);
        }
    }

    @GetMapping
    @Operation(summary = "List runs")
    public ResponseEntity<List<RunResponse>> list() {
        return ResponseEntity.ok(executionService.list().stream()
                .map(RunResponse::from)
                .toList());
    }

    @GetMapping("/{runId}")
    @Operation(summary = "Run state snapshot")
    public ResponseEntity<?> state(@PathVariable final String runId) {
        return handle(() -> executionService.state(runId));
    }

    @DeleteMapping("/{runId}")
    @Operation(summary = "Remove a run")
    public ResponseEntity<Void> remove(@PathVariable final String runId) {
        if (executionService.remove(runId)) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.notFound().build();
    }

    @PostMapping("/{runId}/paths")
    @Operation(summary = "Start another path in the run")
    public ResponseEntity<?> startPath(@PathVariable final String runId,
            @RequestBody(required = false) final StartPathRequest request) {
        return handle(() -> Map.of("pathId", executionService.startPath(
                runId, request == null ? null : request.entryNode())));
    }

    @GetMapping("/{runId}/paths/{pathId}")
    @Operation(summary = "Path snapshot")
    public ResponseEntity<?> path(@PathVariable final String runId,
            @PathVariable final String pathId) {
        return handle(() -> executionService.path(runId, pathId));
    }

    /**
     * Runs one tick.
     *
     * @param runId the run
     * @return the state after the tick
     */
    @PostMapping("/{runId}/step")
    @Operation(summary = "Advance every active path by one transition")
    public ResponseEntity<?> step(@PathVariable final String runId) {
        return handle(() -> executionService.step(runId));
    }

    /**
     * Steps until no path is active.
     *
     * @param runId the run
     * @param maxTicks the most ticks to run
     * @return the ticks run and the final state
     */
    @PostMapping("/{runId}/run")
    @Operation(summary = "Step until no path is active",
            description = "Stops early after maxTicks ticks.")
    public ResponseEntity<?> run(@PathVariable final String runId,
            @RequestParam(required = false) final Integer maxTicks) {
        return handle(() -> executionService.run(runId,
                maxTicks == null ? DEFAULT_MAX_TICKS : maxTicks));
    }

    @PostMapping("/{runId}/paths/{pathId}/resume")
    @Operation(summary = "Resume a waiting path",
            description = "The output is attached to the transition that"
                    + " entered the waiting node.")
    public ResponseEntity<?> resume(@PathVariable final String runId,
            @PathVariable final String pathId,
            @RequestBody(required = false) final ResumeRequest request) {
        return handle(() -> {
            executionService.resume(runId, pathId,
                    request == null ? null : request.output());
            return executionService.path(runId, pathId);
        });
    }

    @PostMapping("/{runId}/paths/{pathId}/cancel")
    @Operation(summary = "Cancel a path")
    public ResponseEntity<?> cancel(@PathVariable final String runId,
            @PathVariable final String pathId) {
        return handle(() -> {
            executionService.cancel(runId, pathId);
            return executionService.path(runId, pathId);
        });
    }

    @PostMapping("/{runId}/errors")
    @Operation(summary = "Record an error",
            description = "Increments errorCount, seen by guards from the"
                    + " next tick on.")
    public ResponseEntity<?> recordError(@PathVariable final String runId,
            @Valid @RequestBody final ErrorRequest request) {
        return handle(() -> {
            executionService.recordError(runId, request.message());
            return Map.of("errorCount",
                    executionService.state(runId).metadata().errorCount());
        });
    }

    @PutMapping("/{runId}/contexts/{contextName}")
    @Operation(summary = "Write fields into a context node")
    public ResponseEntity<?> writeContext(@PathVariable final String runId,
            @PathVariable final String contextName,
            @RequestBody final Map<String, Object> fields) {
        return handle(() -> {
            executionService.writeContext(runId, contextName, fields);
            return executionService.contextValues(runId, contextName);
        });
    }

    @GetMapping("/{runId}/contexts/{contextName}")
    @Operation(summary = "Read a context node")
    public ResponseEntity<?> readContext(@PathVariable final String runId,
            @PathVariable final String contextName) {
        return handle(() -> executionService.contextValues(runId,
                contextName));
    }

    @GetMapping("/{runId}/barriers")
    @Operation(summary = "Paths waiting at each barrier")
    public ResponseEntity<?> barriers(@PathVariable final String runId) {
        return handle(() -> executionService.barriers(runId));
    }

    @GetMapping("/{runId}/paths/{pathId}/variables")
    @Operation(summary = "Variables the path's guards currently see")
    public ResponseEntity<?> variables(@PathVariable final String runId,
            @PathVariable final String pathId) {
        return handle(() -> executionService.runtimeContext(runId, pathId));
    }

    @GetMapping("/{runId}/visualization")
    @Operation(summary = "Node states and available transitions")
    public ResponseEntity<?> visualization(@PathVariable final String runId) {
        return handle(() -> executionService.visualization(runId));
    }

    @GetMapping("/{runId}/statistics")
    @Operation(summary = "Path counts by status")
    public ResponseEntity<?> statistics(@PathVariable final String runId) {
        return handle(() -> executionService.statistics(runId));
    }

    private ResponseEntity<?> handle(final Supplier<Object> action) {
        try {
            return ResponseEntity.ok(action.get());
        } catch (final DomainException e) {
            LOG.warn("Run operation failed: {}", e.getMessage());
            return ErrorResponses.of(e);
        } catch (final IllegalArgumentException e) {
            LOG.warn("Run operation rejected: {}", e.getMessage());
            return ErrorResponses.of(e);
        }
    }

    /**
     * Request body for creating a run.
     *
     * @param machine the machine id or name
     * @param entryNode the node to start on, optional
     */
    public record CreateRunRequest(@NotBlank String machine,
            String entryNode) {}

    /**
     * Request body for starting another path.
     *
     * @param entryNode the node to start on, optional
     */
    public record StartPathRequest(String entryNode) {}

    /**
     * Request body for resuming a path.
     *
     * @param output the result of the waiting node, optional
     */
    public record ResumeRequest(String output) {}

    /**
     * Request body for recording an error.
     *
     * @param message what failed
     */
    public record ErrorRequest(@NotNull String message) {}

    /**
     * Summary of a run.
     */
    public record RunResponse(
            String id,
            String machineId,
            String machineName,
            Instant createdAt,
            long version,
            int errorCount,
            boolean quiescent
    ) {

        static RunResponse from(final ExecutionRun run) {
            return new RunResponse(run.id(), run.machineId(),
                    run.machineName(), run.createdAt(),
                    run.engine().version(), run.engine().errorCount(),
                    run.engine().isQuiescent());
        }
    }

}
