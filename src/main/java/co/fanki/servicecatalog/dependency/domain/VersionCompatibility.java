package co.fanki.servicecatalog.dependency.domain;

import java.util.Optional;

/**
 * How far a declared version drifts from the version a dependent expects.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum VersionCompatibility {

    /** Same major and minor version; patch differences are ignored. */
    COMPATIBLE,

    /** Same major version, different minor version. */
    MINOR_INCOMPATIBLE,

    /** Different major version, or a side that is not a valid version. */
    MAJOR_INCOMPATIBLE;

    /**
     * Classifies an actual version against a constraint.
     *
     * <p>Unparsable input on either side is classified as
     * {@link #MAJOR_INCOMPATIBLE} so that bad data fails loudly.</p>
     *
     * @param actual the version a service declares
     * @param constraint the version a dependent expects
     * @return the classification
     */
    public static VersionCompatibility classify(final String actual,
            final String constraint) {
        final Optional<SemanticVersion> left = SemanticVersion.parse(actual);
        final Optional<SemanticVersion> right =
                SemanticVersion.parse(constraint);
        if (left.isEmpty() || right.isEmpty()) {
            return MAJOR_INCOMPATIBLE;
        }
        if (left.get().major() != right.get().major()) {
            return MAJOR_INCOMPATIBLE;
        }
        if (left.get().minor() != right.get().minor()) {
            return MINOR_INCOMPATIBLE;
        }
        return COMPATIBLE;
    }

}
