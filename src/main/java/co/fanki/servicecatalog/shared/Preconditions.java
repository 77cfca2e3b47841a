package co.fanki.servicecatalog.shared;

import java.util.Collection;

/**
 * Argument checks shared by the catalog domain objects.
 *
 * <p>All checks raise {@link IllegalArgumentException}: a failed check is
 * a programming error in the caller, not a catalog rule violation.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Preconditions {

    private Preconditions() {
    }

    /**
     * Ensures that a reference is not null.
     *
     * @param reference the reference to check
     * @param message the exception message if null
     * @param <T> the type of the reference
     * @return the non-null reference
     * @throws IllegalArgumentException if reference is null
     */
    public static <T> T requireNonNull(final T reference, final String message) {
        if (reference == null) {
            throw new IllegalArgumentException(message);
        }
        return reference;
    }

    /**
     * Ensures that a string is neither null nor blank.
     *
     * @param value the string to check
     * @param message the exception message if null or blank
     * @return the string
     * @throws IllegalArgumentException if value is null or blank
     */
    public static String requireNonBlank(final String value,
            final String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a collection holds no null element.
     *
     * @param values the collection to check, must not be null
     * @param message the exception message on failure
     * @param <C> the collection type
     * @return the collection
     * @throws IllegalArgumentException if the collection or an element is
     *         null
     */
    public static <C extends Collection<?>> C requireNoNulls(final C values,
            final String message) {
        requireNonNull(values, message);
        for (final Object value : values) {
            if (value == null) {
                throw new IllegalArgumentException(message);
            }
        }
        return values;
    }

    /**
     * Ensures that a condition holds.
     *
     * @param condition the condition to check
     * @param message the exception message if false
     * @throws IllegalArgumentException if condition is false
     */
    public static void require(final boolean condition, final String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

}
