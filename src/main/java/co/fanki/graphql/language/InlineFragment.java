package co.fanki.graphql.language;

import co.fanki.graphql.shared.Preconditions;
import co.fanki.graphql.shared.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * An inline fragment, {@code ... on Type { ... }}, with an optional
 * type condition.
 *
 * @param typeCondition the type condition, or null
 * @param directives the directives
 * @param selectionSet the selections
 * @param location where the fragment starts
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record InlineFragment(
        String typeCondition,
        List<Directive> directives,
        SelectionSet selectionSet,
        SourceLocation location) implements Selection {

    /** Validates the fragment. */
    public InlineFragment {
        directives = List.copyOf(directives);
        Preconditions.requireNonNull(selectionSet,
                "Inline fragment selection set is required");
    }

    @Override
    public boolean equals(final Object other) {
        return other instanceof InlineFragment that
                && Objects.equals(typeCondition, that.typeCondition)
                && directives.equals(that.directives)
                && selectionSet.equals(that.selectionSet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeCondition, directives, selectionSet);
    }
}
