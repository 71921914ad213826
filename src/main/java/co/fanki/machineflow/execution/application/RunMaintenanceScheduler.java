package co.fanki.machineflow.execution.application;

import co.fanki.machineflow.execution.application.ExecutionService.MaintenanceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Scheduled component that expires long waits and prunes finished paths.
 *
 * <p>Opt-in via {@code engine.maintenance.enabled=true}. Disabled by
 * default, in which case paths are kept until their run is removed.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
@ConditionalOnProperty(
        name = "engine.maintenance.enabled",
        havingValue = "true",
        matchIfMissing = false)
public class RunMaintenanceScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(
            RunMaintenanceScheduler.class);

    private final ExecutionService executionService;

    private final Duration retention;

    /**
     * Creates a new RunMaintenanceScheduler.
     *
     * @param theExecutionService the execution service
     * @param theRetention how long terminal paths are kept
     */
    public RunMaintenanceScheduler(final ExecutionService theExecutionService,
            @Value("${engine.maintenance.retention:PT1H}")
            final Duration theRetention) {
        this.executionService = theExecutionService;
        this.retention = theRetention;
    }

    /**
     * Sweeps every run.
     */
    @Scheduled(fixedDelayString = "${engine.maintenance.interval-ms:60000}")
    public void sweep() {
        try {
            final MaintenanceResult result = executionService.maintain(
                    retention);
            if (result.expiredPaths() > 0 || result.prunedPaths() > 0) {
                LOG.info("Maintenance: expired {} waiting path(s), pruned {}"
                        + " terminal path(s)", result.expiredPaths(),
                        result.prunedPaths());
            }
        } catch (final RuntimeException e) {
            LOG.error("Run maintenance failed: {}", e.getMessage(), e);
        }
    }

}
