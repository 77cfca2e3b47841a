package co.fanki.servicecatalog.validation.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Checks that a service configuration payload has the expected shape.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface StructuralValidator {

    /**
     * Validates a payload.
     *
     * @param payload the configuration document
     * @return the structural violations, empty when the payload is valid
     */
    List<String> validate(JsonNode payload);

}
