package co.fanki.graphql.shared;

/**
 * Base exception for errors raised by the query engine.
 *
 * <p>Every exception carries an error code that ends up in the
 * {@code extensions.code} member of the reported error, so hosts can
 * tell a syntax error from a schema or variable problem without
 * parsing messages.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GraphQLException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String errorCode;

    /**
     * Creates a new exception with a message.
     *
     * @param message the error message
     */
    public GraphQLException(final String message) {
        super(message);
        this.errorCode = "GRAPHQL_ERROR";
    }

    /**
     * Creates a new exception with a message and error code.
     *
     * @param message the error message
     * @param errorCode the specific error code
     */
    public GraphQLException(final String message, final String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * Creates a new exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public GraphQLException(final String message, final Throwable cause) {
        super(message, cause);
        this.errorCode = "GRAPHQL_ERROR";
    }

    /**
     * Creates a new exception with message, error code, and cause.
     *
     * @param message the error message
     * @param errorCode the specific error code
     * @param cause the underlying cause
     */
    public GraphQLException(final String message, final String errorCode,
            final Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code
     */
    public String getErrorCode() {
        return errorCode;
    }

}
