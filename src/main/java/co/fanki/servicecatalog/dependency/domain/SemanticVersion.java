package co.fanki.servicecatalog.dependency.domain;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed {@code major.minor.patch} version.
 *
 * <p>Pre-release and build suffixes are accepted but ignored: only the
 * numeric core takes part in compatibility decisions.</p>
 *
 * @param major the major component
 * @param minor the minor component
 * @param patch the patch component
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SemanticVersion(long major, long minor, long patch) {

    private static final Pattern PATTERN = Pattern.compile(
            "^(0|[1-9]\\d*)\\.(0|[1-9]\\d*)\\.(0|[1-9]\\d*)"
                    + "(?:-[0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*)?"
                    + "(?:\\+[0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*)?$");

    /**
     * Parses a version string.
     *
     * @param text the text, may be null
     * @return the version, or empty when the text is not a valid version
     */
    public static Optional<SemanticVersion> parse(final String text) {
        if (text == null) {
            return Optional.empty();
        }
        final Matcher matcher = PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new SemanticVersion(
                    Long.parseLong(matcher.group(1)),
                    Long.parseLong(matcher.group(2)),
                    Long.parseLong(matcher.group(3))));
        } catch (final NumberFormatException e) {
            // component does not fit a long
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }

}
