package co.fanki.graphql.language;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Pretty-prints documents and values back into query text.
 *
 * <p>The output is parseable again and yields a structurally equal
 * document. Selection sets are indented by two spaces per level.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Printer {

    private static final String INDENT = "  ";

    private Printer() {
    }

    /**
     * Prints a document.
     *
     * @param document the document
     * @return the query text
     */
    public static String print(final Document document) {
        final StringJoiner joiner = new StringJoiner("\n\n");
        for (final Definition definition : document.definitions()) {
            final StringBuilder out = new StringBuilder();
            if (definition instanceof OperationDefinition operation) {
                printOperation(operation, out);
            } else {
                printFragment((FragmentDefinition) definition, out);
            }
            joiner.add(out);
        }
        return joiner.toString();
    }

    /**
     * Prints a value literal.
     *
     * @param value the value
     * @return the literal text
     */
    public static String print(final Value value) {
        final StringBuilder out = new StringBuilder();
        printValue(value, out);
        return out.toString();
    }

    // -- Definitions ---------------------------------------------------------

    private static void printOperation(final OperationDefinition operation,
            final StringBuilder out) {
        final boolean shorthand = operation.operation() == OperationType.QUERY
                && operation.isAnonymous()
                && operation.variableDefinitions().isEmpty()
                && operation.directives().isEmpty();

        if (!shorthand) {
            out.append(operation.operation().keyword());
            if (operation.name() != null) {
                out.append(' ').append(operation.name());
            }
            printVariableDefinitions(operation.variableDefinitions(), out);
            printDirectives(operation.directives(), out);
            out.append(' ');
        }
        printSelectionSet(operation.selectionSet(), 0, out);
    }

    private static void printVariableDefinitions(
            final List<VariableDefinition> definitions,
            final StringBuilder out) {
        if (definitions.isEmpty()) {
            return;
        }
        final StringJoiner joiner = new StringJoiner(", ", "(", ")");
        for (final VariableDefinition definition : definitions) {
            final StringBuilder item = new StringBuilder();
            item.append('$').append(definition.name()).append(": ")
                    .append(definition.type());
            if (definition.defaultValue() != null) {
                item.append(" = ");
                printValue(definition.defaultValue(), item);
            }
            printDirectives(definition.directives(), item);
            joiner.add(item);
        }
        out.append(joiner);
    }

    private static void printFragment(final FragmentDefinition fragment,
            final StringBuilder out) {
        out.append("fragment ").append(fragment.name())
                .append(" on ").append(fragment.typeCondition());
        printDirectives(fragment.directives(), out);
        out.append(' ');
        printSelectionSet(fragment.selectionSet(), 0, out);
    }

    // -- Selections ----------------------------------------------------------

    private static void printSelectionSet(final SelectionSet selectionSet,
            final int depth, final StringBuilder out) {
        out.append("{\n");
        for (final Selection selection : selectionSet.selections()) {
            out.append(INDENT.repeat(depth + 1));
            printSelection(selection, depth + 1, out);
            out.append('\n');
        }
        out.append(INDENT.repeat(depth)).append('}');
    }

    private static void printSelection(final Selection selection,
            final int depth, final StringBuilder out) {
        if (selection instanceof Field field) {
            if (field.alias() != null) {
                out.append(field.alias()).append(": ");
            }
            out.append(field.name());
            printArguments(field.arguments(), out);
            printDirectives(field.directives(), out);
            if (field.hasSelectionSet()) {
                out.append(' ');
                printSelectionSet(field.selectionSet(), depth, out);
            }
        } else if (selection instanceof FragmentSpread spread) {
            out.append("...").append(spread.name());
            printDirectives(spread.directives(), out);
        } else {
            final InlineFragment inline = (InlineFragment) selection;
            out.append("...");
            if (inline.typeCondition() != null) {
                out.append(" on ").append(inline.typeCondition());
            }
            printDirectives(inline.directives(), out);
            out.append(' ');
            printSelectionSet(inline.selectionSet(), depth, out);
        }
    }

    private static void printArguments(final List<Argument> arguments,
            final StringBuilder out) {
        if (arguments.isEmpty()) {
            return;
        }
        final StringJoiner joiner = new StringJoiner(", ", "(", ")");
        for (final Argument argument : arguments) {
            final StringBuilder item = new StringBuilder();
            item.append(argument.name()).append(": ");
            printValue(argument.value(), item);
            joiner.add(item);
        }
        out.append(joiner);
    }

    private static void printDirectives(final List<Directive> directives,
            final StringBuilder out) {
        for (final Directive directive : directives) {
            out.append(" @").append(directive.name());
            printArguments(directive.arguments(), out);
        }
    }

    // -- Values --------------------------------------------------------------

    private static void printValue(final Value value,
            final StringBuilder out) {
        if (value instanceof Value.Variable variable) {
            out.append('$').append(variable.name());
        } else if (value instanceof Value.IntValue intValue) {
            out.append(intValue.value());
        } else if (value instanceof Value.FloatValue floatValue) {
            out.append(floatText(floatValue.value()));
        } else if (value instanceof Value.StringValue string) {
            printString(string.value(), out);
        } else if (value instanceof Value.BooleanValue bool) {
            out.append(bool.value());
        } else if (value instanceof Value.NullValue) {
            out.append("null");
        } else if (value instanceof Value.EnumValue enumValue) {
            out.append(enumValue.name());
        } else if (value instanceof Value.ListValue list) {
            final StringJoiner joiner = new StringJoiner(", ", "[", "]");
            for (final Value item : list.values()) {
                joiner.add(print(item));
            }
            out.append(joiner);
        } else {
            final Value.ObjectValue object = (Value.ObjectValue) value;
            final StringJoiner joiner = new StringJoiner(", ", "{", "}");
            for (final Map.Entry<String, Value> entry
                    : object.fields().entrySet()) {
                joiner.add(entry.getKey() + ": " + print(entry.getValue()));
            }
            out.append(joiner);
        }
    }

    /** Keeps a float literal a float when it has no fraction. */
    private static String floatText(final BigDecimal value) {
        final String text = value.toString();
        if (text.indexOf('.') < 0 && text.indexOf('E') < 0
                && text.indexOf('e') < 0) {
            return text + ".0";
        }
        return text;
    }

    private static void printString(final String value,
            final StringBuilder out) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                default -> {
                    if (c < 0x20) {
                        out.append(String.format("\\u%04X", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        out.append('"');
    }
}
