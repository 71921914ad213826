package co.fanki.machineflow.shared;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link Preconditions}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PreconditionsTest {

    @Test
    void whenRequireNonNull_givenNullValue_shouldThrowIllegalArgument() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonNull(null, "Machine is required"));
    }

    @Test
    void whenRequireNonBlank_givenBlankNodeName_shouldThrowIllegalArgument() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonBlank("  ", "Node name is required"));
    }

    @Test
    void whenRequireDomain_givenBrokenRule_shouldCarryErrorCode() {
        final DomainException ex = assertThrows(DomainException.class,
                () -> Preconditions.requireDomain(false, "Path is not waiting",
                        "PATH_NOT_WAITING"));

        assertEquals("PATH_NOT_WAITING", ex.getErrorCode());
        assertEquals("Path is not waiting", ex.getMessage());
    }

    @Test
    void whenRequirePositive_givenZeroCeiling_shouldThrowIllegalArgument() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requirePositive(0, "maxPaths must be positive"));
    }

    @Test
    void whenRequireNonNegative_givenZeroSteps_shouldReturnZero() {
        assertEquals(0, Preconditions.requireNonNegative(0, "message"));
    }

    @Test
    void whenRequireNonNegative_givenNegative_shouldThrowIllegalArgument() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonNegative(-1, "negative"));
    }

    @Test
    void whenCreatingDomainException_givenNoCode_shouldUseDefaultCode() {
        assertEquals(DomainException.DEFAULT_CODE,
                new DomainException("boom").getErrorCode());
    }

}
