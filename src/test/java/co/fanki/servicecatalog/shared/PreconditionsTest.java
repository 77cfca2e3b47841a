package co.fanki.servicecatalog.shared;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for Preconditions utility.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PreconditionsTest {

    @Test
    void whenRequireNonNull_givenNonNullValue_shouldReturnValue() {
        final String value = "test";

        final String result = Preconditions.requireNonNull(value, "message");

        assertEquals(value, result);
    }

    @Test
    void whenRequireNonNull_givenNullValue_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonNull(null, "Value is null"));
    }

    @Test
    void whenRequireNonBlank_givenBlankString_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonBlank("  ", "String is blank"));
    }

    @Test
    void whenRequireNonBlank_givenNullString_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonBlank(null, "String is null"));
    }

    @Test
    void whenRequireNoNulls_givenCleanList_shouldReturnSameList() {
        final List<String> values = List.of("a", "b");

        assertSame(values, Preconditions.requireNoNulls(values, "message"));
    }

    @Test
    void whenRequireNoNulls_givenNullElement_shouldThrowException() {
        final List<String> values = Arrays.asList("a", null);

        final IllegalArgumentException e = assertThrows(
                IllegalArgumentException.class,
                () -> Preconditions.requireNoNulls(values, "Null element"));
        assertEquals("Null element", e.getMessage());
    }

    @Test
    void whenRequire_givenTrueCondition_shouldNotThrow() {
        Preconditions.require(true, "Should not throw");
    }

    @Test
    void whenRequire_givenFalseCondition_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.require(false, "Condition is false"));
    }

}
