package co.fanki.servicecatalog.validation.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ValidationSummary}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ValidationSummaryTest {

    @Test
    void whenBuilding_givenMixedOutcomes_shouldCountThem() {
        final ValidationSummary summary = ValidationSummary.builder()
                .success("a")
                .success("b")
                .failure("c", "Required dependency 'd' not found")
                .warning(ValidationSummary.SYSTEM, "cycle")
                .warnings("a", List.of("w1", "w2"))
                .build();

        assertEquals(2, summary.successfulCount());
        assertEquals(1, summary.failedCount());
        assertEquals(3, summary.totalCount());
        assertEquals(3, summary.warningCount());
        assertTrue(summary.hasWarnings());
        assertFalse(summary.isSuccessful());
        assertEquals("Required dependency 'd' not found",
                summary.failureOf("c"));
        assertNull(summary.failureOf("a"));
        assertEquals(List.of("w1", "w2"), summary.warningsFor("a"));
        assertTrue(summary.warningsFor("b").isEmpty());
    }

    @Test
    void whenBuilding_givenOnlySuccesses_shouldBeSuccessful() {
        final ValidationSummary summary = ValidationSummary.builder()
                .success("a")
                .build();

        assertTrue(summary.isSuccessful());
        assertFalse(summary.hasWarnings());
    }

    @Test
    void whenBuilding_givenEmptyServiceWarnings_shouldNotAddEntry() {
        final ValidationSummary summary = ValidationSummary.builder()
                .success("a")
                .warnings("a", List.of())
                .build();

        assertTrue(summary.warnings().isEmpty());
    }

    @Test
    void whenReadingCollections_givenBuiltSummary_shouldBeUnmodifiable() {
        final ValidationSummary summary = ValidationSummary.builder()
                .success("a")
                .build();

        assertThrows(UnsupportedOperationException.class,
                () -> summary.successful().add("b"));
    }

}
