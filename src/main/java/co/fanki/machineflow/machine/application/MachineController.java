package co.fanki.machineflow.machine.application;

import co.fanki.machineflow.analysis.domain.GraphStatistics;
import co.fanki.machineflow.analysis.domain.GraphValidationResult;
import co.fanki.machineflow.analysis.domain.StructuralWarning;
import co.fanki.machineflow.machine.application.MachineService.EdgePreview;
import co.fanki.machineflow.shared.DomainException;
import co.fanki.machineflow.shared.ErrorResponses;
import com.fasterxml.jackson.databind.JsonNode;
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
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for loading machines and analysing them statically.
 *
 * <p>Machines are addressed by id or by the name they were registered
 * under.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/machines")
@Tag(name = "Machines",
        description = "Register machines, validate their structure and"
                + " evaluate expressions")
public class MachineController {

    private static final Logger LOG = LoggerFactory.getLogger(
            MachineController.class);

    private final MachineService machineService;

    /**
     * Creates a new MachineController.
     *
     * @param theMachineService the machine service
     */
    public MachineController(final MachineService theMachineService) {
        this.machineService = theMachineService;
    }

    /**
     * Registers a machine from its JSON form.
     *
     * @param request the machine and an optional name
     * @return the registered machine
     */
    @PostMapping
    @Operation(summary = "Register a machine",
            description = "Reads the machine JSON (nodes, edges, attributes)"
                    + " and keeps it in memory.")
    public ResponseEntity<?> register(
            @Valid @RequestBody final RegisterRequest request) {

        LOG.info("Registering machine '{}'", request.name());

        try {
            final RegisteredMachine registered = machineService.register(
                    request.name(), request.machine());
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(MachineResponse.from(registered));
        } catch (final DomainException e) {
            LOG.warn("Machine rejected: {}", e.getMessage());
            return ErrorResponses.of(e);
        } catch (final IllegalArgumentException e) {
            LOG.warn("Machine rejected: {}", e.getMessage());
            return ErrorResponses.of(e);
        }
    }

    @GetMapping
    @Operation(summary = "List registered machines")
    public ResponseEntity<List<MachineResponse>> list() {
        return ResponseEntity.ok(machineService.list().stream()
                .map(MachineResponse::from)
                .toList());
    }

    @GetMapping("/{machine}")
    @Operation(summary = "Get a machine by id or name")
    public ResponseEntity<?> get(@PathVariable final String machine) {
        try {
            return ResponseEntity.ok(MachineResponse.from(
                    machineService.get(machine)));
        } catch (final DomainException e) {
            return ErrorResponses.of(e);
        }
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Remove a machine")
    public ResponseEntity<Void> remove(@PathVariable final String id) {
        if (machineService.remove(id)) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.notFound().build();
    }

    /**
     * Runs the structural checks on a machine.
     *
     * @param machine the machine id or name
     * @return the validation result
     */
    @GetMapping("/{machine}/validation")
    @Operation(summary = "Validate the machine graph",
            description = "Reports unreachable and orphaned nodes, cycles,"
                    + " missing entry and exit points.")
    public ResponseEntity<?> validate(@PathVariable final String machine) {
        try {
            final GraphValidationResult result =
                    machineService.validate(machine);
            return ResponseEntity.ok(result);
        } catch (final DomainException e) {
            return ErrorResponses.of(e);
        }
    }

    @GetMapping("/{machine}/statistics")
    @Operation(summary = "Graph statistics")
    public ResponseEntity<?> statistics(@PathVariable final String machine) {
        try {
            final GraphStatistics statistics =
                    machineService.statistics(machine);
            return ResponseEntity.ok(statistics);
        } catch (final DomainException e) {
            return ErrorResponses.of(e);
        }
    }

    @GetMapping("/{machine}/warnings")
    @Operation(summary = "Structural warnings with severity and suggestion")
    public ResponseEntity<?> warnings(@PathVariable final String machine) {
        try {
            final List<StructuralWarning> warnings =
                    machineService.warnings(machine);
            return ResponseEntity.ok(warnings);
        } catch (final DomainException e) {
            return ErrorResponses.of(e);
        }
    }

    @GetMapping("/{machine}/path")
    @Operation(summary = "Shortest path between two nodes")
    public ResponseEntity<?> path(@PathVariable final String machine,
            @RequestParam final String from, @RequestParam final String to) {
        try {
            return ResponseEntity.ok(Map.of("path",
                    machineService.path(machine, from, to)));
        } catch (final DomainException e) {
            return ErrorResponses.of(e);
        }
    }

    @GetMapping("/{machine}/edges")
    @Operation(summary = "Preview edge guards",
            description = "Evaluates every edge guard against the machine's"
                    + " static context.")
    public ResponseEntity<?> edges(@PathVariable final String machine) {
        try {
            final List<EdgePreview> previews =
                    machineService.previewEdges(machine);
            return ResponseEntity.ok(previews);
        } catch (final DomainException e) {
            return ErrorResponses.of(e);
        }
    }

    /**
     * Evaluates a condition against the machine's static context.
     *
     * @param machine the machine id or name
     * @param request the condition and extra variables
     * @return {@code {result}} or the expression error
     */
    @PostMapping("/{machine}/conditions")
    @Operation(summary = "Evaluate a condition",
            description = "Evaluates a guard with the machine attribute"
                    + " defaults plus the given variables.")
    public ResponseEntity<?> evaluateCondition(
            @PathVariable final String machine,
            @Valid @RequestBody final ExpressionRequest request) {
        try {
            final boolean result = machineService.evaluateCondition(machine,
                    request.expression(), request.variables());
            return ResponseEntity.ok(Map.of("result", result));
        } catch (final DomainException e) {
            LOG.debug("Condition rejected: {}", e.getMessage());
            return ErrorResponses.of(e);
        }
    }

    @PostMapping("/{machine}/expressions")
    @Operation(summary = "Evaluate an expression to a value")
    public ResponseEntity<?> evaluate(@PathVariable final String machine,
            @Valid @RequestBody final ExpressionRequest request) {
        try {
            final Object value = machineService.evaluate(machine,
                    request.expression(), request.variables()).toJava();
            final Map<String, Object> body = new HashMap<>();
            body.put("value", value);
            return ResponseEntity.ok(body);
        } catch (final DomainException e) {
            return ErrorResponses.of(e);
        }
    }

    @PostMapping("/{machine}/templates")
    @Operation(summary = "Resolve a {{ }} template",
            description = "Spans that fail or are undefined stay verbatim.")
    public ResponseEntity<?> resolveTemplate(
            @PathVariable final String machine,
            @Valid @RequestBody final TemplateRequest request) {
        try {
            return ResponseEntity.ok(Map.of("text",
                    machineService.resolveTemplate(machine,
                            request.template(), request.variables())));
        } catch (final DomainException e) {
            return ErrorResponses.of(e);
        }
    }

    /**
     * Request body for registering a machine.
     *
     * @param name the name to register it under, optional
     * @param machine the machine JSON
     */
    public record RegisterRequest(String name, @NotNull JsonNode machine) {}

    /**
     * Request body for conditions and expressions.
     *
     * @param expression the expression source
     * @param variables extra variables, optional
     */
    public record ExpressionRequest(@NotBlank String expression,
            Map<String, Object> variables) {}

    /**
     * Request body for templates.
     *
     * @param template the template text
     * @param variables extra variables, optional
     */
    public record TemplateRequest(@NotNull String template,
            Map<String, Object> variables) {}

    /**
     * Summary of a registered machine.
     */
    public record MachineResponse(
            String id,
            String name,
            String title,
            int nodeCount,
            int edgeCount,
            Instant registeredAt
    ) {

        static MachineResponse from(final RegisteredMachine registered) {
            return new MachineResponse(registered.id(), registered.name(),
                    registered.machine().title().orElse(null),
                    registered.machine().nodes().size(),
                    registered.machine().edges().size(),
                    registered.registeredAt());
        }
    }

}
