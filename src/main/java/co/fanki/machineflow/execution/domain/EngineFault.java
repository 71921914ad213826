package co.fanki.machineflow.execution.domain;

import co.fanki.machineflow.shared.DomainException;

/**
 * Raised when an engine operation would break an engine invariant, such
 * as naming an unknown node or path. The operation is aborted.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class EngineFault extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code of engine faults. */
    public static final String CODE = "ENGINE_FAULT";

    /**
     * Creates a new fault.
     *
     * @param message what went wrong
     */
    public EngineFault(final String message) {
        super(message, CODE);
    }

}
