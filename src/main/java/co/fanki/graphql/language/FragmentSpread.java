package co.fanki.graphql.language;

import co.fanki.graphql.shared.Preconditions;
import co.fanki.graphql.shared.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A named fragment spread, {@code ...Name}.
 *
 * @param name the fragment name
 * @param directives the directives
 * @param location where the spread starts
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FragmentSpread(String name, List<Directive> directives,
        SourceLocation location) implements Selection {

    /** Validates the spread. */
    public FragmentSpread {
        Preconditions.requireName(name, "Fragment");
        directives = List.copyOf(directives);
    }

    @Override
    public boolean equals(final Object other) {
        return other instanceof FragmentSpread that
                && name.equals(that.name)
                && directives.equals(that.directives);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, directives);
    }
}
