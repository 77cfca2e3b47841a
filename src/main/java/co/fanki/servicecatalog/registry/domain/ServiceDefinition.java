package co.fanki.servicecatalog.registry.domain;

import co.fanki.servicecatalog.dependency.domain.DependencySpec;
import co.fanki.servicecatalog.shared.Preconditions;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.List;

/**
 * The immutable, parsed configuration of a registered service.
 *
 * @param name the registered service name
 * @param version the declared version, or null when the payload has none
 * @param serviceType the resolved service type
 * @param serviceTypeTag the tag as written in the configuration (for
 *        {@link ServiceType#OTHER}, the custom type when one is given)
 * @param description the human description, or null
 * @param dependencies the declared dependencies, in declaration order
 * @param payload the full configuration document, used for structural
 *        validation and type heuristics
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ServiceDefinition(
        String name,
        String version,
        ServiceType serviceType,
        String serviceTypeTag,
        String description,
        List<DependencySpec> dependencies,
        JsonNode payload) {

    /**
     * Validates and freezes the definition.
     */
    public ServiceDefinition {
        Preconditions.requireNonBlank(name, "Service name is required");
        Preconditions.requireNonNull(serviceType, "Service type is required");
        dependencies = List.copyOf(Preconditions.requireNoNulls(dependencies,
                "Dependencies must not contain null"));
        payload = payload == null
                ? JsonNodeFactory.instance.objectNode()
                : payload.deepCopy();
        if (serviceTypeTag == null) {
            serviceTypeTag = serviceType.tag();
        }
    }

    /**
     * Creates a minimal definition, mostly useful to build graphs.
     *
     * @param name the service name
     * @param version the version, may be null
     * @param dependencies the dependencies
     * @return the definition
     */
    public static ServiceDefinition of(final String name,
            final String version, final List<DependencySpec> dependencies) {
        return new ServiceDefinition(name, version, ServiceType.OTHER, null,
                null, dependencies, null);
    }

    /**
     * Returns a copy of the configuration document; changes to it are not
     * seen by this definition.
     *
     * @return the payload copy
     */
    @Override
    public JsonNode payload() {
        return payload.deepCopy();
    }

}
