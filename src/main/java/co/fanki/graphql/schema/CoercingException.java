package co.fanki.graphql.schema;

import co.fanki.graphql.shared.GraphQLException;

/**
 * Raised when a value cannot be converted to or from a leaf type.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CoercingException extends GraphQLException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new coercing exception.
     *
     * @param message the message
     */
    public CoercingException(final String message) {
        super(message, "COERCION_FAILED");
    }

    /**
     * Creates a new coercing exception with a cause.
     *
     * @param message the message
     * @param cause the cause
     */
    public CoercingException(final String message, final Throwable cause) {
        super(message, "COERCION_FAILED", cause);
    }
}
