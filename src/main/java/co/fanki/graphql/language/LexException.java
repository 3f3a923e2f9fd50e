package co.fanki.graphql.language;

import co.fanki.graphql.shared.SourceLocation;

/**
 * Raised by the {@link Lexer} on malformed source text.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class LexException extends SyntaxException {

    private static final long serialVersionUID = 1L;

    private final String reason;

    /**
     * Creates a new lex exception.
     *
     * @param location the offending position
     * @param theReason what is wrong at that position
     */
    public LexException(final SourceLocation location,
            final String theReason) {
        super(theReason, "LEX_ERROR", location);
        this.reason = theReason;
    }

    /** Returns the reason, without the location or prefix. */
    public String getReason() {
        return reason;
    }
}
