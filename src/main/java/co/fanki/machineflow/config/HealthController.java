package co.fanki.machineflow.config;

import co.fanki.machineflow.execution.application.ExecutionService;
import co.fanki.machineflow.machine.application.MachineRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness and readiness endpoints.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthController {

    private final MachineRegistry machineRegistry;

    private final ExecutionService executionService;

    /**
     * Creates a new HealthController.
     *
     * @param theMachineRegistry the machine registry
     * @param theExecutionService the execution service
     */
    public HealthController(final MachineRegistry theMachineRegistry,
            final ExecutionService theExecutionService) {
        this.machineRegistry = theMachineRegistry;
        this.executionService = theExecutionService;
    }

    /**
     * Returns health status.
     *
     * @return "up" if the service is running
     */
    @GetMapping("/health")
    public String health() {
        return "up";
    }

    /**
     * Readiness probe with the size of the in-memory state.
     *
     * @return the status map
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        return ResponseEntity.ok(Map.of(
                "status", "ready",
                "machines", machineRegistry.size(),
                "runs", executionService.runCount()));
    }

}
