package co.fanki.servicecatalog.dependency.domain;

import co.fanki.servicecatalog.shared.Preconditions;

import java.util.List;

/**
 * A service affected by a change to another service.
 *
 * @param service the affected service
 * @param required whether the edge through which the service was reached
 *        is a required dependency
 * @param transitivelyRequired whether every edge of {@code path} is a
 *        required dependency
 * @param path the services from the changed service to {@code service},
 *        both included
 * @param description human readable summary of the chain
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ImpactInfo(String service, boolean required,
        boolean transitivelyRequired, List<String> path,
        String description) {

    /**
     * Validates the path.
     */
    public ImpactInfo {
        Preconditions.requireNonBlank(service, "Service is required");
        Preconditions.requireNonNull(path, "Impact path is required");
        Preconditions.require(path.size() >= 2,
                "Impact path needs origin and service");
        path = List.copyOf(path);
    }

    /** Returns the changed service the path starts from. */
    public String origin() {
        return path.get(0);
    }

    /** Returns the number of dependency hops between origin and service. */
    public int distance() {
        return path.size() - 1;
    }

}
