package co.fanki.servicecatalog.dependency.domain;

import co.fanki.servicecatalog.registry.domain.ServiceDefinition;
import co.fanki.servicecatalog.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Applies the dependency policy to the declared dependencies of a service.
 *
 * <p>Policy, per dependency:</p>
 * <pre>
 *   target absent, required          error
 *   target absent, optional          warning
 *   no constraint                    not checked
 *   target without version           warning
 *   minor drift                      warning
 *   major drift, required            error
 *   major drift, optional            warning
 * </pre>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DependencyValidator {

    private DependencyValidator() {
    }

    /**
     * Checks the dependencies of a service against the current catalog.
     *
     * @param service the service to check
     * @param catalog every registered service by name, the checked one
     *        included
     * @return the findings
     */
    public static DependencyFindings validate(final ServiceDefinition service,
            final Map<String, ServiceDefinition> catalog) {
        Preconditions.requireNonNull(service, "Service is required");
        Preconditions.requireNonNull(catalog, "Catalog is required");

        final List<String> errors = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();

        for (final DependencySpec dependency : service.dependencies()) {
            final String name = dependency.target();
            final ServiceDefinition target = catalog.get(name);

            if (target == null) {
                if (dependency.required()) {
                    errors.add("Required dependency '" + name + "' not found");
                } else {
                    warnings.add("Optional dependency '" + name
                            + "' not found");
                }
                continue;
            }
            if (!dependency.hasVersionConstraint()) {
                continue;
            }

            final String expected = dependency.versionConstraint();
            final String actual = target.version();
            if (actual == null) {
                warnings.add("Dependency '" + name
                        + "' has missing or invalid version");
                continue;
            }

            switch (VersionCompatibility.classify(actual, expected)) {
                case MINOR_INCOMPATIBLE -> warnings.add(
                        "Minor version incompatibility for dependency '"
                                + name + "': expected " + expected
                                + " but found " + actual);
                case MAJOR_INCOMPATIBLE -> {
                    final String message =
                            "Major version incompatibility for dependency '"
                                    + name + "': expected " + expected
                                    + " but found " + actual;
                    if (dependency.required()) {
                        errors.add(message);
                    } else {
                        warnings.add("Optional dependency '" + name
                                + "' has incompatible version: " + message);
                    }
                }
                default -> {
                    // compatible
                }
            }
        }
        return new DependencyFindings(service.name(), errors, warnings);
    }

}
