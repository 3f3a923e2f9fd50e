package co.fanki.graphql.language;

/**
 * Kinds of tokens produced by the {@link Lexer}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum TokenKind {
    /** A name, {@code /[_A-Za-z][_0-9A-Za-z]*}/. */
    NAME,
    /** An integer literal. */
    INT,
    /** A float literal. */
    FLOAT,
    /** A quoted string literal. */
    STRING,
    /** A triple quoted string literal. */
    BLOCK_STRING,
    /** One of {@code ! $ & ( ) ... : = @ [ ] { | }}. */
    PUNCTUATOR,
    /** End of the source text. */
    EOF
}
