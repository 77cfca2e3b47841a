package co.fanki.servicecatalog.shared;

/**
 * Base exception for catalog rule violations.
 *
 * <p>Every domain failure carries a stable error code so command-line and
 * programmatic callers can tell failures apart without parsing the
 * message. Infrastructure failures (disk, parsing libraries) are not
 * domain exceptions; they are wrapped at the application boundary.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Error code used when none is given. */
    public static final String DEFAULT_CODE = "DOMAIN_ERROR";

    private final String errorCode;

    /**
     * Creates a domain exception with the default error code.
     *
     * @param message the error message
     */
    public DomainException(final String message) {
        this(message, DEFAULT_CODE);
    }

    /**
     * Creates a domain exception with a specific error code.
     *
     * @param message the error message
     * @param theErrorCode the error code
     */
    public DomainException(final String message, final String theErrorCode) {
        super(message);
        this.errorCode = theErrorCode;
    }

    /**
     * Creates a domain exception with a specific error code and cause.
     *
     * @param message the error message
     * @param theErrorCode the error code
     * @param cause the underlying cause
     */
    public DomainException(final String message, final String theErrorCode,
            final Throwable cause) {
        super(message, cause);
        this.errorCode = theErrorCode;
    }

    /**
     * Returns the error code of this failure.
     *
     * @return the error code, never null
     */
    public String getErrorCode() {
        return errorCode;
    }

}
