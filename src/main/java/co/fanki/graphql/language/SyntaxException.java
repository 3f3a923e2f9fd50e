package co.fanki.graphql.language;

import co.fanki.graphql.shared.GraphQLException;
import co.fanki.graphql.shared.SourceLocation;

/**
 * Base class for errors found while reading the request text.
 *
 * <p>Syntax errors are fatal to the whole request: nothing is
 * executed.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public abstract class SyntaxException extends GraphQLException {

    private static final long serialVersionUID = 1L;

    private final transient SourceLocation location;

    /**
     * Creates a new syntax exception.
     *
     * @param message the message, without the location
     * @param errorCode the error code
     * @param theLocation where the problem was found
     */
    protected SyntaxException(final String message, final String errorCode,
            final SourceLocation theLocation) {
        super("Syntax Error: " + message, errorCode);
        this.location = theLocation;
    }

    /** Returns where the problem was found. */
    public SourceLocation getLocation() {
        return location;
    }
}
