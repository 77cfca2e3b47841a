package co.fanki.servicecatalog.registry.domain;

import co.fanki.servicecatalog.dependency.domain.DependencySpec;
import co.fanki.servicecatalog.shared.DomainException;
import co.fanki.servicecatalog.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a service configuration text into a {@link ServiceDefinition}.
 *
 * <p>Text starting with <code>{</code> is read as JSON, anything else as
 * YAML. Only the fields the catalog core needs are extracted; the whole
 * document is kept as payload for structural validation.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class ServiceDefinitionParser {

    private static final String INVALID_CONFIG = "INVALID_SERVICE_CONFIG";

    private final ObjectMapper jsonMapper;

    private final ObjectMapper yamlMapper;

    /**
     * Creates a parser.
     *
     * @param theJsonMapper the mapper used for JSON documents
     */
    public ServiceDefinitionParser(final ObjectMapper theJsonMapper) {
        this.jsonMapper = Preconditions.requireNonNull(theJsonMapper,
                "Object mapper is required");
        this.yamlMapper = new YAMLMapper();
    }

    /**
     * Parses a configuration text.
     *
     * @param serviceName the name the service is registered under
     * @param text the configuration text
     * @return the definition
     * @throws DomainException with code {@code INVALID_SERVICE_CONFIG} if
     *         the text is not a JSON or YAML object or a dependency has no
     *         target
     */
    public ServiceDefinition parse(final String serviceName,
            final String text) {
        Preconditions.requireNonBlank(serviceName, "Service name is required");
        Preconditions.requireNonNull(text, "Configuration text is required");

        final JsonNode document = read(serviceName, text);
        if (document == null || !document.isObject()) {
            throw new DomainException("Configuration of service '"
                    + serviceName + "' is not an object", INVALID_CONFIG);
        }

        final JsonNode typeNode = document.path("service_type");
        final String tag = typeNode.isTextual()
                ? typeNode.asText()
                : textOrNull(typeNode.get("type"));
        final ServiceType type = ServiceType.fromTag(tag);
        final String customType = textOrNull(typeNode.get("custom_type"));

        return new ServiceDefinition(
                serviceName,
                textOrNull(document.get("version")),
                type,
                type == ServiceType.OTHER && customType != null
                        ? customType : tag,
                textOrNull(document.get("description")),
                dependencies(serviceName, document.get("dependencies")),
                document);
    }

    private JsonNode read(final String serviceName, final String text) {
        final boolean json = text.stripLeading().startsWith("{");
        try {
            return json ? jsonMapper.readTree(text) : yamlMapper.readTree(text);
        } catch (final JsonProcessingException e) {
            throw new DomainException("Invalid configuration for service '"
                    + serviceName + "': " + e.getOriginalMessage(),
                    INVALID_CONFIG, e);
        }
    }

    private static List<DependencySpec> dependencies(final String serviceName,
            final JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new DomainException("Dependencies of service '"
                    + serviceName + "' must be a list", INVALID_CONFIG);
        }
        final List<DependencySpec> result = new ArrayList<>();
        for (final JsonNode entry : node) {
            final String target = textOrNull(entry.get("service"));
            if (target == null || target.isBlank()) {
                throw new DomainException("Service '" + serviceName
                        + "' declares a dependency without target",
                        INVALID_CONFIG);
            }
            final JsonNode required = entry.get("required");
            result.add(new DependencySpec(target,
                    textOrNull(entry.get("version_constraint")),
                    required == null || required.isNull()
                            || required.asBoolean(true)));
        }
        return result;
    }

    private static String textOrNull(final JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.asText();
    }

}
