package co.fanki.servicecatalog.registry.domain;

/**
 * Storage failure of a {@link ConfigurationStore}.
 *
 * <p>Reports infrastructure trouble, not a catalog rule violation, so
 * it does not extend the domain exception.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ConfigurationStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message what failed
     * @param cause the underlying failure, may be null
     */
    public ConfigurationStoreException(final String message,
            final Throwable cause) {
        super(message, cause);
    }

}
