package co.fanki.servicecatalog.dependency.domain;

import java.util.List;

/**
 * Outcome of checking the declared dependencies of one service.
 *
 * @param service the checked service
 * @param errors hard failures; any entry keeps the service out of the
 *        successful set
 * @param warnings advisory findings that never block success
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DependencyFindings(String service, List<String> errors,
        List<String> warnings) {

    /**
     * Freezes the lists.
     */
    public DependencyFindings {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    /** Checks whether a hard failure was found. */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Throws when a hard failure was found.
     *
     * @throws DependencyPolicyException naming every hard failure
     */
    public void requireNoErrors() {
        if (hasErrors()) {
            throw new DependencyPolicyException(service, errors);
        }
    }

}
