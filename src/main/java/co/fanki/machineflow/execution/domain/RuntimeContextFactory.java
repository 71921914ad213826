package co.fanki.machineflow.execution.domain;

import co.fanki.machineflow.expression.domain.Value;
import co.fanki.machineflow.expression.domain.VariableContext;
import co.fanki.machineflow.machine.domain.Machine;
import co.fanki.machineflow.machine.domain.MachineContexts;

/**
 * Builds the variable context a path's guards are evaluated against.
 *
 * <p>Layers, later ones winning: declared attribute defaults, the values
 * written to context nodes, then {@code errorCount}, {@code errors} and the
 * path's {@code activeState}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class RuntimeContextFactory {

    private final VariableContext defaults;

    /**
     * Creates a factory for a machine.
     *
     * @param machine the machine
     */
    public RuntimeContextFactory(final Machine machine) {
        this.defaults = MachineContexts.attributeDefaults(machine,
                VariableContext.builder()).build();
    }

    /**
     * Builds the runtime context of a path.
     *
     * @param path the path
     * @param store the context store
     * @param errorCount the engine error count
     * @return the context
     */
    public VariableContext create(final ExecutionPath path,
            final ContextStore store, final int errorCount) {
        return store.publish(VariableContext.builder().putAll(defaults))
                .put(MachineContexts.ERROR_COUNT, Value.of(errorCount))
                .put(MachineContexts.ERRORS, Value.of(errorCount))
                .put(MachineContexts.ACTIVE_STATE,
                        Value.of(path.activeState()))
                .build();
    }

}
