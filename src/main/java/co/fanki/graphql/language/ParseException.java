package co.fanki.graphql.language;

import co.fanki.graphql.shared.SourceLocation;

/**
 * Raised by the {@link Parser} on a grammar violation.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ParseException extends SyntaxException {

    private static final long serialVersionUID = 1L;

    private final String expected;
    private final String found;

    /**
     * Creates a new parse exception.
     *
     * @param location where the unexpected token starts
     * @param theExpected a description of what the grammar expected
     * @param theFound a description of the token found instead
     */
    public ParseException(final SourceLocation location,
            final String theExpected, final String theFound) {
        super("Expected " + theExpected + ", found " + theFound + ".",
                "PARSE_ERROR", location);
        this.expected = theExpected;
        this.found = theFound;
    }

    /**
     * Creates a parse exception with a custom message.
     *
     * @param location where the problem starts
     * @param message the message
     * @param theExpected a description of what the grammar expected
     * @param theFound a description of the offending token
     */
    ParseException(final SourceLocation location, final String message,
            final String theExpected, final String theFound) {
        super(message, "PARSE_ERROR", location);
        this.expected = theExpected;
        this.found = theFound;
    }

    /** Returns what the grammar expected. */
    public String getExpected() {
        return expected;
    }

    /** Returns what was found instead. */
    public String getFound() {
        return found;
    }
}
