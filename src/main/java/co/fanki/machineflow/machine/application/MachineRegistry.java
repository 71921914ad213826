package co.fanki.machineflow.machine.application;

import co.fanki.machineflow.machine.domain.Machine;
import co.fanki.machineflow.shared.DomainException;
import co.fanki.machineflow.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory cache of loaded machines.
 *
 * <p>Machines are keyed by a generated id, with a secondary index by name.
 * Registering a second machine under an existing name moves the name to
 * the new machine; the old one stays reachable by id.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class MachineRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(
            MachineRegistry.class);

    /** Error code for a machine that is not registered. */
    public static final String NOT_FOUND = "MACHINE_NOT_FOUND";

    private final Map<String, RegisteredMachine> machines =
            new ConcurrentHashMap<>();

    private final Map<String, String> nameToId = new ConcurrentHashMap<>();

    private final Clock clock;

    /**
     * Creates a new MachineRegistry.
     *
     * @param theClock the clock used for registration times
     */
    public MachineRegistry(final Clock theClock) {
        this.clock = theClock;
    }

    /**
     * Registers a machine.
     *
     * @param name the name, defaults to the machine title or the id
     * @param machine the machine
     * @return the registration
     */
    public RegisteredMachine register(final String name,
            final Machine machine) {
        Preconditions.requireNonNull(machine, "Machine is required");
        final String id = UUID.randomUUID().toString();
        final String effectiveName = name != null && !name.isBlank()
                ? name : machine.title().orElse(id);
        final RegisteredMachine registered = new RegisteredMachine(id,
                effectiveName, machine, clock.instant());

        machines.put(id, registered);
        nameToId.put(effectiveName, id);

        LOG.info("Registered machine {} as '{}' ({} nodes, {} edges)", id,
                effectiveName, machine.nodes().size(),
                machine.edges().size());
        return registered;
    }

    /**
     * Returns a machine by id.
     *
     * @param id the id
     * @return the machine, empty if unknown
     */
    public Optional<RegisteredMachine> get(final String id) {
        return id == null ? Optional.empty()
                : Optional.ofNullable(machines.get(id));
    }

    /**
     * Returns a machine by the name it was registered under.
     *
     * @param name the name
     * @return the machine, empty if unknown
     */
    public Optional<RegisteredMachine> findByName(final String name) {
        if (name == null) {
            return Optional.empty();
        }
        final String id = nameToId.get(name);
        return id == null ? Optional.empty() : get(id);
    }

    /**
     * Resolves an id or a name.
     *
     * @param idOrName the id or the name
     * @return the machine
     * @throws DomainException with code {@link #NOT_FOUND}
     */
    public RegisteredMachine resolve(final String idOrName) {
        return get(idOrName).or(() -> findByName(idOrName))
                .orElseThrow(() -> new DomainException(
                        "Machine not found: " + idOrName, NOT_FOUND));
    }

    /**
     * Lists the machines, oldest first.
     *
     * @return the machines
     */
    public List<RegisteredMachine> list() {
        final List<RegisteredMachine> all = new ArrayList<>(machines.values());
        all.sort(Comparator.comparing(RegisteredMachine::registeredAt)
                .thenComparing(RegisteredMachine::id));
        return all;
    }

    /**
     * Removes a machine.
     *
     * @param id the id
     * @return true if it was registered
     */
    public boolean remove(final String id) {
        final RegisteredMachine removed = id == null ? null
                : machines.remove(id);
        if (removed == null) {
            return false;
        }
        nameToId.remove(removed.name(), id);
        LOG.info("Removed machine {} ('{}')", id, removed.name());
        return true;
    }

    public int size() {
        return machines.size();
    }

}
