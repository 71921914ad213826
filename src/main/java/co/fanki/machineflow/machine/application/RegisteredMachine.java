package co.fanki.machineflow.machine.application;

import co.fanki.machineflow.machine.domain.Machine;

import java.time.Instant;

/**
 * A machine held by the {@link MachineRegistry}.
 *
 * @param id the generated id
 * @param name the name it was registered under
 * @param machine the machine
 * @param registeredAt when it was registered
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RegisteredMachine(String id, String name, Machine machine,
        Instant registeredAt) {}
