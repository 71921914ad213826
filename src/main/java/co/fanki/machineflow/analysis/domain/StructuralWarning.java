package co.fanki.machineflow.analysis.domain;

/**
 * A structural finding about a machine graph. Collected, never thrown.
 *
 * @param code the warning code
 * @param severity the severity
 * @param node the node concerned, null for graph-wide findings
 * @param message the description
 * @param suggestion how to address it
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record StructuralWarning(
        Code code,
        Severity severity,
        String node,
        String message,
        String suggestion) {

    /** Warning codes. */
    public enum Code {
        UNREACHABLE_NODE,
        ORPHANED_NODE,
        CYCLE_DETECTED,
        MISSING_ENTRY,
        MULTIPLE_ENTRY,
        MISSING_EXIT
    }

    /** Severities. */
    public enum Severity {
        ERROR,
        WARNING,
        INFO
    }

}
