package co.fanki.servicecatalog.validation.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link JsonSchemaStructuralValidator}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class JsonSchemaStructuralValidatorTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonSchemaStructuralValidator validator;

    @BeforeEach
    void setUp() {
        validator = new JsonSchemaStructuralValidator();
    }

    private JsonNode json(final String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    void whenValidating_givenCompleteConfiguration_shouldFindNoViolation()
            throws Exception {
        final List<String> violations = validator.validate(json("""
                {
                  "name": "orders",
                  "version": "1.0.0",
                  "service_type": {"type": "rest"},
                  "endpoints": [
                    {"name": "create", "path": "/orders", "method": "POST"}
                  ],
                  "dependencies": [{"service": "db", "required": true}],
                  "metadata": {"team": "checkout"}
                }
                """));

        assertTrue(violations.isEmpty(), violations.toString());
    }

    @Test
    void whenValidating_givenMissingRequiredFields_shouldReportThem()
            throws Exception {
        final List<String> violations = validator.validate(json("""
                {"name": "orders"}
                """));

        assertFalse(violations.isEmpty());
        assertTrue(violations.stream().anyMatch(v -> v.contains("version")));
        assertTrue(violations.stream().anyMatch(v -> v.contains("endpoints")));
    }

    @Test
    void whenValidating_givenUnknownServiceType_shouldReportIt()
            throws Exception {
        final List<String> violations = validator.validate(json("""
                {"name": "x", "version": "1.0.0",
                 "service_type": {"type": "soap"}, "endpoints": []}
                """));

        assertFalse(violations.isEmpty());
    }

    @Test
    void whenValidating_givenNonBooleanRequiredFlag_shouldReportIt()
            throws Exception {
        final List<String> violations = validator.validate(json("""
                {"name": "x", "version": "1.0.0",
                 "service_type": {"type": "rest"}, "endpoints": [],
                 "dependencies": [{"service": "db", "required": "yes"}]}
                """));

        assertFalse(violations.isEmpty());
    }

    @Test
    void whenCreating_givenMissingSchemaResource_shouldThrowException() {
        assertThrows(IllegalStateException.class,
                () -> new JsonSchemaStructuralValidator("/schema/none.json"));
    }

}
