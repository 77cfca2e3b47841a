package co.fanki.servicecatalog.dependency.domain;

import co.fanki.servicecatalog.shared.DomainException;

import java.util.List;

/**
 * Raised when a service violates the dependency policy: a required
 * dependency is missing or drifts by a major version.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DependencyPolicyException extends DomainException {

    private static final long serialVersionUID = 1L;

    private final String service;

    private final List<String> violations;

    /**
     * Creates the exception.
     *
     * @param theService the offending service
     * @param theViolations the hard failures, at least one
     */
    public DependencyPolicyException(final String theService,
            final List<String> theViolations) {
        super(String.join("; ", theViolations),
                "DEPENDENCY_POLICY_VIOLATION");
        this.service = theService;
        this.violations = List.copyOf(theViolations);
    }

    /** Returns the offending service. */
    public String service() {
        return service;
    }

    /** Returns the hard failures. */
    public List<String> violations() {
        return violations;
    }

}
