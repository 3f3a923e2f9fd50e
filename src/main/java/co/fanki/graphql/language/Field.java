package co.fanki.graphql.language;

import co.fanki.graphql.shared.Preconditions;
import co.fanki.graphql.shared.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A field selection.
 *
 * <p>Equality ignores the source location.</p>
 *
 * @param alias the alias, or null
 * @param name the field name
 * @param arguments the arguments
 * @param directives the directives
 * @param selectionSet the sub-selection, or null for leaf fields
 * @param location where the field starts
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Field(
        String alias,
        String name,
        List<Argument> arguments,
        List<Directive> directives,
        SelectionSet selectionSet,
        SourceLocation location) implements Selection {

    /** Validates the field. */
    public Field {
        Preconditions.requireName(name, "Field");
        if (alias != null) {
            Preconditions.requireName(alias, "Alias");
        }
        arguments = List.copyOf(arguments);
        directives = List.copyOf(directives);
    }

    /**
     * Creates a plain field without alias, arguments or directives.
     *
     * @param name the field name
     * @param selectionSet the sub-selection, or null
     * @return the field
     */
    public static Field of(final String name,
            final SelectionSet selectionSet) {
        return new Field(null, name, List.of(), List.of(), selectionSet,
                null);
    }

    /** Returns the key under which this field appears in the response. */
    public String responseKey() {
        return alias != null ? alias : name;
    }

    /** Returns true if this field has a sub-selection. */
    public boolean hasSelectionSet() {
        return selectionSet != null;
    }

    /**
     * Finds an argument by name.
     *
     * @param argumentName the argument name
     * @return the argument, or null if absent
     */
    public Argument argument(final String argumentName) {
        for (final Argument argument : arguments) {
            if (argument.name().equals(argumentName)) {
                return argument;
            }
        }
        return null;
    }

    @Override
    public boolean equals(final Object other) {
        return other instanceof Field that
                && Objects.equals(alias, that.alias)
                && name.equals(that.name)
                && arguments.equals(that.arguments)
                && directives.equals(that.directives)
                && Objects.equals(selectionSet, that.selectionSet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alias, name, arguments, directives, selectionSet);
    }
}
