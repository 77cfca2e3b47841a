package co.fanki.servicecatalog.dependency.domain;

import co.fanki.servicecatalog.shared.DomainException;

/**
 * Raised when an ordering is requested over services that form a cycle.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CycleException extends DomainException {

    private static final long serialVersionUID = 1L;

    private final transient CycleInfo cycle;

    /**
     * Creates the exception for a cycle.
     *
     * @param theCycle the offending cycle
     */
    public CycleException(final CycleInfo theCycle) {
        super("Circular dependency detected: " + theCycle.description(),
                "DEPENDENCY_CYCLE");
        this.cycle = theCycle;
    }

    /**
     * Returns the offending cycle.
     *
     * @return the cycle
     */
    public CycleInfo cycle() {
        return cycle;
    }

}
