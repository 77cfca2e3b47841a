package co.fanki.servicecatalog.validation.domain;

import co.fanki.servicecatalog.shared.DomainException;

import java.util.List;

/**
 * Raised when a service configuration does not match the service schema.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SchemaStructuralException extends DomainException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    /**
     * Creates the exception.
     *
     * @param theViolations the structural violations, at least one
     */
    public SchemaStructuralException(final List<String> theViolations) {
        super("Schema validation failed: " + String.join(", ", theViolations),
                "SCHEMA_STRUCTURAL_ERROR");
        this.violations = List.copyOf(theViolations);
    }

    /**
     * Creates the exception for a single violation.
     *
     * @param violation the violation
     */
    public SchemaStructuralException(final String violation) {
        this(List.of(violation));
    }

    /** Returns the structural violations. */
    public List<String> violations() {
        return violations;
    }

}
