package co.fanki.servicecatalog.validation.domain;

import co.fanki.servicecatalog.registry.domain.ServiceDefinition;
import co.fanki.servicecatalog.shared.Preconditions;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Type-specific advice on service configurations.
 *
 * <p>Heuristics only ever produce warnings. They look at the payload
 * fields a well described service of each type is expected to carry.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ServiceTypeHeuristics {

    private ServiceTypeHeuristics() {
    }

    /**
     * Inspects a service definition.
     *
     * @param service the service
     * @return the warnings, empty when nothing is missing
     */
    public static List<String> inspect(final ServiceDefinition service) {
        Preconditions.requireNonNull(service, "Service is required");
        final JsonNode payload = service.payload();
        final JsonNode metadata = payload.path("metadata");
        final List<String> warnings = new ArrayList<>();

        final String declaredName = text(payload.get("name"));
        if (declaredName != null && !declaredName.equals(service.name())) {
            warnings.add("Configuration declares name '" + declaredName
                    + "' but the service is registered as '"
                    + service.name() + "'");
        }

        switch (service.serviceType()) {
            case REST -> inspectRest(payload.path("endpoints"), warnings);
            case GRAPHQL -> {
                if (isEmpty(metadata.get("schema"))) {
                    warnings.add("GraphQL service does not declare a schema"
                            + " reference");
                }
            }
            case GRPC -> {
                if (isEmpty(metadata.get("proto_files"))) {
                    warnings.add("gRPC service does not declare proto sources");
                }
            }
            case EVENT_DRIVEN -> {
                final JsonNode topics = metadata.get("topics");
                if (topics == null || !topics.isArray() || topics.isEmpty()) {
                    warnings.add("Event-driven service does not declare any"
                            + " topics");
                }
            }
            default -> {
                final String description = service.description();
                if (description == null || description.isBlank()) {
                    warnings.add("Service of type '" + service.serviceTypeTag()
                            + "' has no description");
                }
            }
        }
        return warnings;
    }

    private static void inspectRest(final JsonNode endpoints,
            final List<String> warnings) {
        if (!endpoints.isArray() || endpoints.isEmpty()) {
            warnings.add("REST service declares no endpoints");
            return;
        }
        for (final JsonNode endpoint : endpoints) {
            if (isEmpty(endpoint.get("method"))) {
                final String name = text(endpoint.get("name"));
                warnings.add("REST endpoint '"
                        + (name != null ? name : text(endpoint.get("path")))
                        + "' does not declare an HTTP method");
            }
        }
    }

    private static boolean isEmpty(final JsonNode node) {
        if (node == null || node.isNull()) {
            return true;
        }
        if (node.isTextual()) {
            return node.asText().isBlank();
        }
        return node.isContainerNode() && node.isEmpty();
    }

    private static String text(final JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

}
