package co.fanki.graphql.language;

import co.fanki.graphql.shared.Preconditions;
import co.fanki.graphql.shared.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts query text into a lazy sequence of {@link Token}s.
 *
 * <p>Each call to {@link #next()} skips the insignificant characters
 * (whitespace, line terminators, commas, a byte order mark and
 * {@code #} comments) and reads exactly one token. Once the end of the
 * source is reached every further call returns an {@code EOF} token.
 * A lexer cannot be rewound: create a new one to read the text
 * again.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Lexer {

    private final String source;

    /** Offset of the next unread character. */
    private int position;

    /** Current 1-based line. */
    private int line;

    /** Offset where the current line starts. */
    private int lineStart;

    /**
     * Creates a new lexer over the given source.
     *
     * @param theSource the query text
     */
    public Lexer(final String theSource) {
        this.source = Preconditions.requireNonNull(theSource,
                "Source is required");
        this.position = 0;
        this.line = 1;
        this.lineStart = 0;
    }

    /**
     * Reads the whole source into a token list, EOF included.
     *
     * @param source the query text
     * @return the tokens
     * @throws LexException on malformed text
     */
    public static List<Token> tokenize(final String source) {
        final Lexer lexer = new Lexer(source);
        final List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = lexer.next();
            tokens.add(token);
        } while (token.kind() != TokenKind.EOF);
        return tokens;
    }

    /**
     * Reads the next token.
     *
     * @return the next token, EOF at the end of the source
     * @throws LexException on malformed text
     */
    public Token next() {
        skipIgnored();

        final SourceLocation location = location(position);

        if (position >= source.length()) {
            return new Token(TokenKind.EOF, null, location);
        }

        final char c = source.charAt(position);

        switch (c) {
            case '!', '$', '&', '(', ')', ':', '=', '@', '[', ']',
                    '{', '|', '}' -> {
                position++;
                return new Token(TokenKind.PUNCTUATOR, String.valueOf(c),
                        location);
            }
            case '.' -> {
                if (charAt(position + 1) == '.'
                        && charAt(position + 2) == '.') {
                    position += 3;
                    return new Token(TokenKind.PUNCTUATOR, "...", location);
                }
                throw new LexException(location,
                        "Unexpected \".\", did you mean \"...\"?");
            }
            case '"' -> {
                if (charAt(position + 1) == '"'
                        && charAt(position + 2) == '"') {
                    return readBlockString(location);
                }
                return readString(location);
            }
            default -> {
                if (isNameStart(c)) {
                    return readName(location);
                }
                if (c == '-' || isDigit(c)) {
                    return readNumber(location);
                }
                throw new LexException(location,
                        "Unexpected character: " + describe(c) + ".");
            }
        }
    }

    // -- Ignored tokens ------------------------------------------------------

    private void skipIgnored() {
        while (position < source.length()) {
            final char c = source.charAt(position);
            switch (c) {
                case '\uFEFF', ' ', '\t', ',' -> position++;
                case '\n' -> {
                    position++;
                    newLine();
                }
                case '\r' -> {
                    position++;
                    if (charAt(position) == '\n') {
                        position++;
                    }
                    newLine();
                }
                case '#' -> {
                    while (position < source.length()
                            && source.charAt(position) != '\n'
                            && source.charAt(position) != '\r') {
                        position++;
                    }
                }
                default -> {
                    return;
                }
            }
        }
    }

    // -- Names ---------------------------------------------------------------

    private Token readName(final SourceLocation location) {
        final int start = position;
        position++;
        while (position < source.length()
                && isNameContinue(source.charAt(position))) {
            position++;
        }
        return new Token(TokenKind.NAME,
                source.substring(start, position), location);
    }

    // -- Numbers -------------------------------------------------------------

    private Token readNumber(final SourceLocation location) {
        final int start = position;
        boolean isFloat = false;

        if (charAt(position) == '-') {
            position++;
        }

        if (charAt(position) == '0') {
            position++;
            if (isDigit(charAt(position))) {
                throw new LexException(location(position),
                        "Invalid number, unexpected digit after 0: "
                                + describe(charAt(position)) + ".");
            }
        } else {
            readDigits();
        }

        if (charAt(position) == '.') {
            isFloat = true;
            position++;
            readDigits();
        }

        final char exponent = charAt(position);
        if (exponent == 'e' || exponent == 'E') {
            isFloat = true;
            position++;
            final char sign = charAt(position);
            if (sign == '+' || sign == '-') {
                position++;
            }
            readDigits();
        }

        final char after = charAt(position);
        if (after == '.' || isNameStart(after)) {
            throw new LexException(location(position),
                    "Invalid number, expected digit but got: "
                            + describe(after) + ".");
        }

        return new Token(isFloat ? TokenKind.FLOAT : TokenKind.INT,
                source.substring(start, position), location);
    }

    private void readDigits() {
        if (!isDigit(charAt(position))) {
            throw new LexException(location(position),
                    "Invalid number, expected digit but got: "
                            + describe(charAt(position)) + ".");
        }
        while (isDigit(charAt(position))) {
            position++;
        }
    }

    // -- Strings -------------------------------------------------------------

    private Token readString(final SourceLocation location) {
        position++;
        final StringBuilder value = new StringBuilder();

        while (position < source.length()) {
            final char c = source.charAt(position);

            if (c == '"') {
                position++;
                return new Token(TokenKind.STRING, value.toString(),
                        location);
            }
            if (c == '\n' || c == '\r') {
                break;
            }
            if (c == '\\') {
                value.append(readEscape());
                continue;
            }
            if (c < 0x20 && c != '\t') {
                throw new LexException(location(position),
                        "Invalid character within String: "
                                + describe(c) + ".");
            }
            value.append(c);
            position++;
        }

        throw new LexException(location(position), "Unterminated string.");
    }

    private char readEscape() {
        final SourceLocation escapeLocation = location(position);
        final char c = charAt(position + 1);
        position += 2;
        return switch (c) {
            case '"' -> '"';
            case '\\' -> '\\';
            case '/' -> '/';
            case 'b' -> '\b';
            case 'f' -> '\f';
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            case 'u' -> {
                if (position + 4 > source.length()) {
                    throw new LexException(escapeLocation,
                            "Invalid Unicode escape sequence.");
                }
                final String hex = source.substring(position, position + 4);
                int decoded = 0;
                for (int i = 0; i < hex.length(); i++) {
                    final char ch = hex.charAt(i);
                    final int digit = ch < 128 ? Character.digit(ch, 16) : -1;
                    if (digit < 0) {
                        throw new LexException(escapeLocation,
                                "Invalid Unicode escape sequence: \"\\u"
                                        + hex + "\".");
                    }
                    decoded = decoded * 16 + digit;
                }
                position += 4;
                yield (char) decoded;
            }
            default -> throw new LexException(escapeLocation,
                    "Invalid character escape sequence: \"\\"
                            + (c == 0 ? "" : String.valueOf(c)) + "\".");
        };
    }

    private Token readBlockString(final SourceLocation location) {
        position += 3;
        final StringBuilder raw = new StringBuilder();

        while (position < source.length()) {
            final char c = source.charAt(position);

            if (c == '"' && charAt(position + 1) == '"'
                    && charAt(position + 2) == '"') {
                position += 3;
                return new Token(TokenKind.BLOCK_STRING,
                        blockStringValue(raw.toString()), location);
            }

            if (c == '\\' && charAt(position + 1) == '"'
                    && charAt(position + 2) == '"'
                    && charAt(position + 3) == '"') {
                raw.append("\"\"\"");
                position += 4;
                continue;
            }

            if (c < 0x20 && c != '\t' && c != '\n' && c != '\r') {
                throw new LexException(location(position),
                        "Invalid character within String: "
                                + describe(c) + ".");
            }

            raw.append(c);
            position++;

            if (c == '\n') {
                newLine();
            } else if (c == '\r') {
                if (charAt(position) == '\n') {
                    raw.append('\n');
                    position++;
                }
                newLine();
            }
        }

        throw new LexException(location(position), "Unterminated string.");
    }

    /**
     * Applies the common indentation removal to a raw block string.
     *
     * @param raw the text between the triple quotes
     * @return the block string value
     */
    static String blockStringValue(final String raw) {
        final String[] lines = raw.split("\r\n|[\n\r]", -1);

        Integer commonIndent = null;
        for (int i = 1; i < lines.length; i++) {
            final String current = lines[i];
            final int indent = leadingWhitespace(current);
            if (indent < current.length()
                    && (commonIndent == null || indent < commonIndent)) {
                commonIndent = indent;
            }
        }

        if (commonIndent != null && commonIndent > 0) {
            for (int i = 1; i < lines.length; i++) {
                final String current = lines[i];
                lines[i] = current.length() < commonIndent
                        ? ""
                        : current.substring(commonIndent);
            }
        }

        int first = 0;
        while (first < lines.length && isBlank(lines[first])) {
            first++;
        }
        int last = lines.length - 1;
        while (last >= first && isBlank(lines[last])) {
            last--;
        }

        final StringBuilder value = new StringBuilder();
        for (int i = first; i <= last; i++) {
            if (i > first) {
                value.append('\n');
            }
            value.append(lines[i]);
        }
        return value.toString();
    }

    private static int leadingWhitespace(final String text) {
        int i = 0;
        while (i < text.length()
                && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    private static boolean isBlank(final String text) {
        return leadingWhitespace(text) == text.length();
    }

    // -- Helpers -------------------------------------------------------------

    private void newLine() {
        line++;
        lineStart = position;
    }

    private SourceLocation location(final int offset) {
        return new SourceLocation(line, offset - lineStart + 1);
    }

    /** Returns the char at the offset, or 0 past the end. */
    private char charAt(final int offset) {
        return offset < source.length() ? source.charAt(offset) : 0;
    }

    private static boolean isNameStart(final char c) {
        return c == '_' || (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    private static boolean isNameContinue(final char c) {
        return isNameStart(c) || isDigit(c);
    }

    private static boolean isDigit(final char c) {
        return c >= '0' && c <= '9';
    }

    private static String describe(final char c) {
        if (c == 0) {
            return "<EOF>";
        }
        if (c < 0x20 || c >= 0x7F) {
            return String.format("U+%04X", (int) c);
        }
        return "\"" + c + "\"";
    }
}
