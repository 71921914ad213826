package co.fanki.machineflow.execution.domain;

/**
 * Lifecycle status of an execution path.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum PathStatus {

    /** The path is stepped on every tick. */
    ACTIVE,

    /** The path waits for an external result before it can move on. */
    WAITING,

    /** The path reached an exit. Terminal. */
    COMPLETED,

    /** The path failed or was cancelled. Terminal. */
    FAILED;

    /**
     * Whether no further transition is possible.
     *
     * @return true for completed and failed paths
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

}
