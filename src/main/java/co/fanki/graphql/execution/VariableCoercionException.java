package co.fanki.graphql.execution;

import co.fanki.graphql.shared.GraphQLException;
import co.fanki.graphql.shared.SourceLocation;

/**
 * Thrown when the variables of a request do not match the variable
 * definitions of the operation. The request is not executed.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class VariableCoercionException extends GraphQLException {

    private static final long serialVersionUID = 1L;

    private final transient SourceLocation location;

    /**
     * Creates a new exception.
     *
     * @param message the message
     * @param theLocation the variable definition, may be null
     */
    public VariableCoercionException(final String message,
            final SourceLocation theLocation) {
        super(message, "BAD_USER_INPUT");
        this.location = theLocation;
    }

    /** Returns the location of the variable definition, or null. */
    public SourceLocation getLocation() {
        return location;
    }
}
