package co.fanki.servicecatalog.dependency.domain;

/**
 * Signals a broken internal invariant of the graph algorithms.
 *
 * <p>This is a bug in the catalog, never a user error.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class InternalInvariantException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message what was violated
     */
    public InternalInvariantException(final String message) {
        super(message);
    }

}
