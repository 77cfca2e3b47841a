package co.fanki.servicecatalog.dependency.domain;

import co.fanki.servicecatalog.shared.Preconditions;

/**
 * A dependency a service declares on another service.
 *
 * @param target the name of the service depended upon
 * @param versionConstraint the version the dependent expects, or null when
 *        any version is accepted
 * @param required whether absence or a major version drift of the target
 *        is a hard failure
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DependencySpec(String target, String versionConstraint,
        boolean required) {

    /**
     * Validates the target name.
     */
    public DependencySpec {
        Preconditions.requireNonBlank(target, "Dependency target is required");
        if (versionConstraint != null && versionConstraint.isBlank()) {
            versionConstraint = null;
        }
    }

    /**
     * Creates a required dependency without version constraint.
     *
     * @param target the target service name
     * @return the dependency
     */
    public static DependencySpec required(final String target) {
        return new DependencySpec(target, null, true);
    }

    /**
     * Creates an optional dependency without version constraint.
     *
     * @param target the target service name
     * @return the dependency
     */
    public static DependencySpec optional(final String target) {
        return new DependencySpec(target, null, false);
    }

    /**
     * Returns a copy of this dependency constrained to the given version.
     *
     * @param constraint the expected version
     * @return the constrained dependency
     */
    public DependencySpec withConstraint(final String constraint) {
        return new DependencySpec(target, constraint, required);
    }

    /** Checks whether a version constraint was declared. */
    public boolean hasVersionConstraint() {
        return versionConstraint != null;
    }

}
