package co.fanki.machineflow.machine.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Unit tests for {@link EdgeConditions}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class EdgeConditionsTest {

    @Test
    void whenExtracting_givenUnquotedWhen_shouldReturnCondition() {
        assertEquals("errorCount > 0",
                EdgeConditions.extract("when: errorCount > 0"));
    }

    @Test
    void whenExtracting_givenDoubleQuotedWhen_shouldStripQuotes() {
        assertEquals("status == 'ok'",
                EdgeConditions.extract("when: \"status == 'ok'\""));
    }

    @Test
    void whenExtracting_givenSingleQuotedIf_shouldStripQuotes() {
        assertEquals("ready", EdgeConditions.extract("if: 'ready'"));
    }

    @Test
    void whenExtracting_givenUnless_shouldNegate() {
        assertEquals("!(approved)", EdgeConditions.extract("unless: approved"));
    }

    @Test
    void whenExtracting_givenUpperCaseKeyword_shouldKeepConditionCase() {
        assertEquals("Review.Done",
                EdgeConditions.extract("WHEN: Review.Done; retry"));
    }

    @Test
    void whenExtracting_givenPlainLabel_shouldReturnNull() {
        assertNull(EdgeConditions.extract("approve"));
        assertNull(EdgeConditions.extract(null));
    }

}
