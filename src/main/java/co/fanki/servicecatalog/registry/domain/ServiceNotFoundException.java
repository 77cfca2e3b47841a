package co.fanki.servicecatalog.registry.domain;

import co.fanki.servicecatalog.shared.DomainException;

/**
 * Raised when a requested service is not registered.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ServiceNotFoundException extends DomainException {

    private static final long serialVersionUID = 1L;

    private final String serviceName;

    /**
     * Creates the exception.
     *
     * @param theServiceName the missing service
     */
    public ServiceNotFoundException(final String theServiceName) {
        super("Service not found: " + theServiceName, "SERVICE_NOT_FOUND");
        this.serviceName = theServiceName;
    }

    /** Returns the missing service name. */
    public String serviceName() {
        return serviceName;
    }

}
