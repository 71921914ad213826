package co.fanki.machineflow.execution.domain;

import co.fanki.machineflow.shared.DomainException;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Centralizes all valid path status transitions.
 *
 * <p>Valid transitions:</p>
 * <pre>
 *   ACTIVE  → ACTIVE, WAITING, COMPLETED, FAILED
 *   WAITING → ACTIVE, FAILED
 * </pre>
 *
 * <p>COMPLETED and FAILED are terminal.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PathStateMachine {

    private static final Map<PathStatus, Set<PathStatus>> TRANSITIONS;

    static {
        TRANSITIONS = new EnumMap<>(PathStatus.class);
        TRANSITIONS.put(PathStatus.ACTIVE,    EnumSet.of(PathStatus.ACTIVE, PathStatus.WAITING, PathStatus.COMPLETED, PathStatus.FAILED));
        TRANSITIONS.put(PathStatus.WAITING,   EnumSet.of(PathStatus.ACTIVE, PathStatus.FAILED));
        TRANSITIONS.put(PathStatus.COMPLETED, EnumSet.noneOf(PathStatus.class));
        TRANSITIONS.put(PathStatus.FAILED,    EnumSet.noneOf(PathStatus.class));
    }

    private PathStateMachine() {
    }

    /**
     * Validates a status transition and returns the target status if it is
     * permitted.
     *
     * @param from the current status
     * @param to the desired status
     * @return {@code to} when the transition is valid
     * @throws DomainException with code {@code PATH_INVALID_TRANSITION} when
     *         the transition is not permitted
     * @throws NullPointerException if {@code from} or {@code to} is null
     */
    public static PathStatus transition(final PathStatus from, final PathStatus to) {
        if (from == null || to == null) {
            throw new NullPointerException("from and to must not be null");
        }
        if (!TRANSITIONS.get(from).contains(to)) {
            throw new DomainException(
                    "Invalid path transition: " + from + " → " + to,
                    "PATH_INVALID_TRANSITION");
        }
        return to;
    }

}
