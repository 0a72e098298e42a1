package co.fanki.threatscore.shared;

/**
 * Base exception for threat scoring rule violations.
 *
 * <p>Carries a machine readable error code so callers can tell a
 * non-finite score from a missing suspect without parsing messages.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private static final String DEFAULT_ERROR_CODE = "DOMAIN_ERROR";

    private final String errorCode;

    /**
     * Creates a new domain exception with the default error code.
     *
     * @param message the error message
     */
    public DomainException(final String message) {
        this(message, DEFAULT_ERROR_CODE);
    }

    /**
     * Creates a new domain exception with a message and error code.
     *
     * @param message the error message
     * @param theErrorCode the specific error code
     */
    public DomainException(final String message, final String theErrorCode) {
        super(message);
        this.errorCode = theErrorCode;
    }

    /**
     * Creates a new domain exception wrapping a cause.
     *
     * @param message the error message
     * @param theErrorCode the specific error code
     * @param cause the underlying cause
     */
    public DomainException(final String message, final String theErrorCode,
            final Throwable cause) {
        super(message, cause);
        this.errorCode = theErrorCode;
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code, never null
     */
    public String getErrorCode() {
        return errorCode;
    }

}
