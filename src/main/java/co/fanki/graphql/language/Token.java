package co.fanki.graphql.language;

import co.fanki.graphql.shared.SourceLocation;

/**
 * A single token from the query lexer.
 *
 * @param kind the token kind
 * @param value the literal value: the punctuator, the name, the raw
 *              number text or the decoded string; null for EOF
 * @param location where the token starts
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Token(TokenKind kind, String value, SourceLocation location) {

    /**
     * Checks if this token is the given punctuator.
     *
     * @param punctuator the punctuator text, e.g. {@code "{"}
     * @return true on match
     */
    public boolean isPunctuator(final String punctuator) {
        return kind == TokenKind.PUNCTUATOR && punctuator.equals(value);
    }

    /**
     * Checks if this token is a name with the given text.
     *
     * @param keyword the keyword, e.g. {@code "on"}
     * @return true on match
     */
    public boolean isKeyword(final String keyword) {
        return kind == TokenKind.NAME && keyword.equals(value);
    }

    /** Returns a short description used in syntax error messages. */
    public String describe() {
        return switch (kind) {
            case EOF -> "<EOF>";
            case PUNCTUATOR -> "\"" + value + "\"";
            case NAME -> "Name \"" + value + "\"";
            case INT -> "Int \"" + value + "\"";
            case FLOAT -> "Float \"" + value + "\"";
            case STRING -> "String \"" + value + "\"";
            case BLOCK_STRING -> "BlockString \"\"\"" + value + "\"\"\"";
        };
    }

    @Override
    public String toString() {
        return describe() + "@" + location;
    }
}
