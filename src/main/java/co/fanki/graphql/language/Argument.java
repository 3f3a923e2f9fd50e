package co.fanki.graphql.language;

import co.fanki.graphql.shared.Preconditions;
import co.fanki.graphql.shared.SourceLocation;

import java.util.Objects;

/**
 * A named argument of a field or directive.
 *
 * <p>Equality ignores the source location.</p>
 *
 * @param name the argument name
 * @param value the argument value
 * @param location where the argument starts
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Argument(String name, Value value, SourceLocation location) {

    /** Validates the argument. */
    public Argument {
        Preconditions.requireName(name, "Argument");
        Preconditions.requireNonNull(value, "Argument value is required");
    }

    @Override
    public boolean equals(final Object other) {
        return other instanceof Argument that
                && name.equals(that.name)
                && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value);
    }
}
