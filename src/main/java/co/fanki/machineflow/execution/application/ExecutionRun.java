package co.fanki.machineflow.execution.application;

import co.fanki.machineflow.execution.domain.ExecutionEngine;

import java.time.Instant;

/**
 * One execution of a registered machine, owning its engine.
 *
 * @param id the run id
 * @param machineId the id of the machine being run
 * @param machineName the name of the machine being run
 * @param engine the engine holding the paths
 * @param createdAt when the run was created
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ExecutionRun(String id, String machineId, String machineName,
        ExecutionEngine engine, Instant createdAt) {}
