package co.fanki.servicecatalog.validation.domain;

import co.fanki.servicecatalog.shared.Preconditions;
import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Validates payloads against the service JSON Schema (draft-07).
 *
 * <p>The schema is compiled once; {@link JsonSchema} is safe for
 * concurrent use.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class JsonSchemaStructuralValidator implements StructuralValidator {

    private static final Logger LOG = LoggerFactory.getLogger(
            JsonSchemaStructuralValidator.class);

    /** Classpath location of the bundled service schema. */
    public static final String SERVICE_SCHEMA = "/schema/service-schema.json";

    private final JsonSchema schema;

    /**
     * Creates a validator for the bundled service schema.
     */
    public JsonSchemaStructuralValidator() {
        this(SERVICE_SCHEMA);
    }

    /**
     * Creates a validator for a schema on the classpath.
     *
     * @param schemaResource the classpath resource of the schema
     * @throws IllegalStateException if the resource does not exist
     */
    public JsonSchemaStructuralValidator(final String schemaResource) {
        Preconditions.requireNonBlank(schemaResource,
                "Schema resource is required");
        final JsonSchemaFactory factory =
                JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
        try (InputStream in = JsonSchemaStructuralValidator.class
                .getResourceAsStream(schemaResource)) {
            if (in == null) {
                throw new IllegalStateException(
                        "Schema resource not found: " + schemaResource);
            }
            this.schema = factory.getSchema(in);
        } catch (final IOException e) {
            throw new UncheckedIOException(
                    "Failed to read schema " + schemaResource, e);
        }
        LOG.debug("Compiled service schema from {}", schemaResource);
    }

    @Override
    public List<String> validate(final JsonNode payload) {
        Preconditions.requireNonNull(payload, "Payload is required");
        final Set<ValidationMessage> messages = schema.validate(payload);
        final List<String> result = new ArrayList<>(messages.size());
        for (final ValidationMessage message : messages) {
            result.add(message.getMessage());
        }
        return result;
    }

}
