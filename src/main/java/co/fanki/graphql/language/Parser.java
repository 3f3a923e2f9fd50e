package co.fanki.graphql.language;

import co.fanki.graphql.shared.SourceLocation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive descent parser for executable documents.
 *
 * <p>There is one method per grammar production. The parser reads
 * tokens lazily from a {@link Lexer} and decides with a single token of
 * lookahead; {@code ...} followed by the {@code on} keyword, a
 * {@code {} or a {@code @} starts an inline fragment, while {@code ...}
 * followed by any other name is a fragment spread.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Parser {

    private final Lexer lexer;

    /** The lookahead token. */
    private Token token;

    private Parser(final String source) {
        this.lexer = new Lexer(source);
        this.token = lexer.next();
    }

    /**
     * Parses an executable document.
     *
     * @param source the query text
     * @return the document
     * @throws LexException on malformed text
     * @throws ParseException on a grammar violation
     */
    public static Document parse(final String source) {
        return new Parser(source).parseDocument();
    }

    /**
     * Parses a standalone value literal, variables allowed.
     *
     * @param source the value text, e.g. {@code {a: [1, 2]}}
     * @return the value
     */
    public static Value parseValue(final String source) {
        final Parser parser = new Parser(source);
        final Value value = parser.parseValueLiteral(false);
        parser.expectEof();
        return value;
    }

    /**
     * Parses a standalone type reference.
     *
     * @param source the type text, e.g. {@code [Int!]!}
     * @return the type reference
     */
    public static TypeRef parseType(final String source) {
        final Parser parser = new Parser(source);
        final TypeRef type = parser.parseTypeReference();
        parser.expectEof();
        return type;
    }

    // -- Document ------------------------------------------------------------

    private Document parseDocument() {
        final List<Definition> definitions = new ArrayList<>();
        do {
            definitions.add(parseDefinition());
        } while (token.kind() != TokenKind.EOF);
        return new Document(definitions);
    }

    private Definition parseDefinition() {
        if (token.isPunctuator("{")) {
            return parseOperationDefinition();
        }
        if (token.kind() == TokenKind.NAME) {
            if (OperationType.fromKeyword(token.value()) != null) {
                return parseOperationDefinition();
            }
            if (token.isKeyword("fragment")) {
                return parseFragmentDefinition();
            }
        }
        throw unexpected("an operation or fragment definition");
    }

    // -- Operations ----------------------------------------------------------

    private OperationDefinition parseOperationDefinition() {
        final SourceLocation location = token.location();

        if (token.isPunctuator("{")) {
            return new OperationDefinition(OperationType.QUERY, null,
                    List.of(), List.of(), parseSelectionSet(), location);
        }

        final OperationType operation = parseOperationType();
        String name = null;
        if (token.kind() == TokenKind.NAME) {
            name = parseName();
        }

        return new OperationDefinition(operation, name,
                parseVariableDefinitions(), parseDirectives(false),
                parseSelectionSet(), location);
    }

    private OperationType parseOperationType() {
        final Token current = expect(TokenKind.NAME, "an operation type");
        final OperationType operation =
                OperationType.fromKeyword(current.value());
        if (operation == null) {
            throw new ParseException(current.location(),
                    "query, mutation or subscription", current.describe());
        }
        return operation;
    }

    private List<VariableDefinition> parseVariableDefinitions() {
        final List<VariableDefinition> definitions = new ArrayList<>();
        if (skipPunctuator("(")) {
            do {
                definitions.add(parseVariableDefinition());
            } while (!skipPunctuator(")"));
        }
        return definitions;
    }

    private VariableDefinition parseVariableDefinition() {
        final SourceLocation location = token.location();
        final String name = parseVariable().name();
        expectPunctuator(":");
        final TypeRef type = parseTypeReference();

        Value defaultValue = null;
        if (skipPunctuator("=")) {
            defaultValue = parseValueLiteral(true);
        }

        return new VariableDefinition(name, type, defaultValue,
                parseDirectives(true), location);
    }

    private Value.Variable parseVariable() {
        expectPunctuator("$");
        return new Value.Variable(parseName());
    }

    // -- Selections ----------------------------------------------------------

    private SelectionSet parseSelectionSet() {
        expectPunctuator("{");
        final List<Selection> selections = new ArrayList<>();
        do {
            selections.add(parseSelection());
        } while (!skipPunctuator("}"));
        return new SelectionSet(selections);
    }

    private Selection parseSelection() {
        if (token.isPunctuator("...")) {
            return parseFragment();
        }
        return parseField();
    }

    private Field parseField() {
        final SourceLocation location = token.location();
        final String nameOrAlias = parseName();

        String alias = null;
        String name = nameOrAlias;
        if (skipPunctuator(":")) {
            alias = nameOrAlias;
            name = parseName();
        }

        final List<Argument> arguments = parseArguments(false);
        final List<Directive> directives = parseDirectives(false);
        final SelectionSet selectionSet = token.isPunctuator("{")
                ? parseSelectionSet()
                : null;

        return new Field(alias, name, arguments, directives, selectionSet,
                location);
    }

    private List<Argument> parseArguments(final boolean isConst) {
        final List<Argument> arguments = new ArrayList<>();
        if (skipPunctuator("(")) {
            do {
                arguments.add(parseArgument(isConst));
            } while (!skipPunctuator(")"));
        }
        return arguments;
    }

    private Argument parseArgument(final boolean isConst) {
        final SourceLocation location = token.location();
        final String name = parseName();
        expectPunctuator(":");
        return new Argument(name, parseValueLiteral(isConst), location);
    }

    // -- Fragments -----------------------------------------------------------

    private Selection parseFragment() {
        final SourceLocation location = token.location();
        expectPunctuator("...");

        final boolean hasTypeCondition = token.isKeyword("on");
        if (!hasTypeCondition && token.kind() == TokenKind.NAME) {
            return new FragmentSpread(parseFragmentName(),
                    parseDirectives(false), location);
        }

        String typeCondition = null;
        if (hasTypeCondition) {
            advance();
            typeCondition = parseName();
        }

        return new InlineFragment(typeCondition, parseDirectives(false),
                parseSelectionSet(), location);
    }

    private FragmentDefinition parseFragmentDefinition() {
        final SourceLocation location = token.location();
        expectKeyword("fragment");
        final String name = parseFragmentName();
        expectKeyword("on");
        final String typeCondition = parseName();

        return new FragmentDefinition(name, typeCondition,
                parseDirectives(false), parseSelectionSet(), location);
    }

    private String parseFragmentName() {
        if (token.isKeyword("on")) {
            throw unexpected("a fragment name");
        }
        return parseName();
    }

    // -- Values --------------------------------------------------------------

    private Value parseValueLiteral(final boolean isConst) {
        final Token current = token;

        switch (current.kind()) {
            case INT -> {
                advance();
                return new Value.IntValue(new BigInteger(current.value()));
            }
            case FLOAT -> {
                advance();
                return new Value.FloatValue(new BigDecimal(current.value()));
            }
            case STRING, BLOCK_STRING -> {
                advance();
                return new Value.StringValue(current.value());
            }
            case NAME -> {
                advance();
                return switch (current.value()) {
                    case "true" -> new Value.BooleanValue(true);
                    case "false" -> new Value.BooleanValue(false);
                    case "null" -> Value.NULL;
                    default -> new Value.EnumValue(current.value());
                };
            }
            case PUNCTUATOR -> {
                if (current.isPunctuator("[")) {
                    return parseList(isConst);
                }
                if (current.isPunctuator("{")) {
                    return parseObject(isConst);
                }
                if (current.isPunctuator("$")) {
                    if (isConst) {
                        throw unexpected("a constant value");
                    }
                    return parseVariable();
                }
                throw unexpected("a value");
            }
            default -> throw unexpected("a value");
        }
    }

    private Value parseList(final boolean isConst) {
        expectPunctuator("[");
        final List<Value> values = new ArrayList<>();
        while (!skipPunctuator("]")) {
            values.add(parseValueLiteral(isConst));
        }
        return new Value.ListValue(values);
    }

    private Value parseObject(final boolean isConst) {
        expectPunctuator("{");
        final Map<String, Value> fields = new LinkedHashMap<>();
        while (!skipPunctuator("}")) {
            final Token nameToken = token;
            final String name = parseName();
            expectPunctuator(":");
            final Value value = parseValueLiteral(isConst);
            if (fields.containsKey(name)) {
                throw new ParseException(nameToken.location(),
                        "There can be only one input field named \""
                                + name + "\".",
                        "a unique input field name", nameToken.describe());
            }
            fields.put(name, value);
        }
        return new Value.ObjectValue(fields);
    }

    // -- Directives ----------------------------------------------------------

    private List<Directive> parseDirectives(final boolean isConst) {
        final List<Directive> directives = new ArrayList<>();
        while (token.isPunctuator("@")) {
            directives.add(parseDirective(isConst));
        }
        return directives;
    }

    private Directive parseDirective(final boolean isConst) {
        final SourceLocation location = token.location();
        expectPunctuator("@");
        final String name = parseName();
        return new Directive(name, parseArguments(isConst), location);
    }

    // -- Types ---------------------------------------------------------------

    private TypeRef parseTypeReference() {
        final TypeRef type;
        if (skipPunctuator("[")) {
            final TypeRef inner = parseTypeReference();
            expectPunctuator("]");
            type = new TypeRef.ListOf(inner);
        } else {
            type = new TypeRef.Named(parseName());
        }

        if (skipPunctuator("!")) {
            return new TypeRef.NonNull(type);
        }
        return type;
    }

    // -- Token helpers -------------------------------------------------------

    private String parseName() {
        return expect(TokenKind.NAME, "Name").value();
    }

    private void advance() {
        token = lexer.next();
    }

    private Token expect(final TokenKind kind, final String description) {
        final Token current = token;
        if (current.kind() != kind) {
            throw unexpected(description);
        }
        advance();
        return current;
    }

    private void expectPunctuator(final String punctuator) {
        if (!token.isPunctuator(punctuator)) {
            throw unexpected("\"" + punctuator + "\"");
        }
        advance();
    }

    private void expectKeyword(final String keyword) {
        if (!token.isKeyword(keyword)) {
            throw unexpected("\"" + keyword + "\"");
        }
        advance();
    }

    private boolean skipPunctuator(final String punctuator) {
        if (token.isPunctuator(punctuator)) {
            advance();
            return true;
        }
        return false;
    }

    private void expectEof() {
        if (token.kind() != TokenKind.EOF) {
            throw unexpected("<EOF>");
        }
    }

    private ParseException unexpected(final String expected) {
        return new ParseException(token.location(), expected,
                token.describe());
    }
}
