package co.fanki.graphql.language;

import co.fanki.graphql.shared.Preconditions;
import co.fanki.graphql.shared.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A named fragment, {@code fragment Name on Type { ... }}.
 *
 * @param name the fragment name
 * @param typeCondition the type the fragment applies to
 * @param directives the directives
 * @param selectionSet the selections
 * @param location where the fragment starts
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FragmentDefinition(
        String name,
        String typeCondition,
        List<Directive> directives,
        SelectionSet selectionSet,
        SourceLocation location) implements Definition {

    /** Validates the fragment. */
    public FragmentDefinition {
        Preconditions.requireName(name, "Fragment");
        Preconditions.requireName(typeCondition, "Type condition");
        directives = List.copyOf(directives);
        Preconditions.requireNonNull(selectionSet,
                "Fragment selection set is required");
    }

    @Override
    public boolean equals(final Object other) {
        return other instanceof FragmentDefinition that
                && name.equals(that.name)
                && typeCondition.equals(that.typeCondition)
                && directives.equals(that.directives)
                && selectionSet.equals(that.selectionSet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, typeCondition, directives, selectionSet);
    }
}
