package co.fanki.servicecatalog.dependency.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link SemanticVersion}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SemanticVersionTest {

    @Test
    void whenParsing_givenPlainVersion_shouldReadComponents() {
        final SemanticVersion version =
                SemanticVersion.parse("2.10.3").orElseThrow();

        assertEquals(2, version.major());
        assertEquals(10, version.minor());
        assertEquals(3, version.patch());
        assertEquals("2.10.3", version.toString());
    }

    @Test
    void whenParsing_givenPreReleaseAndBuild_shouldIgnoreSuffixes() {
        assertEquals(new SemanticVersion(1, 2, 3),
                SemanticVersion.parse("1.2.3-rc.1+build.7").orElseThrow());
    }

    @Test
    void whenParsing_givenSurroundingWhitespace_shouldTrim() {
        assertEquals(new SemanticVersion(1, 0, 0),
                SemanticVersion.parse(" 1.0.0 ").orElseThrow());
    }

    @Test
    void whenParsing_givenMalformedText_shouldReturnEmpty() {
        assertTrue(SemanticVersion.parse("1.0").isEmpty());
        assertTrue(SemanticVersion.parse("v1.0.0").isEmpty());
        assertTrue(SemanticVersion.parse("01.0.0").isEmpty());
        assertTrue(SemanticVersion.parse("latest").isEmpty());
        assertTrue(SemanticVersion.parse(null).isEmpty());
    }

    @Test
    void whenParsing_givenComponentBeyondLongRange_shouldReturnEmpty() {
        assertTrue(SemanticVersion.parse("99999999999999999999.0.0")
                .isEmpty());
    }

}
