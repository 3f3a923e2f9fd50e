package co.fanki.graphql.language;

import co.fanki.graphql.shared.Preconditions;
import co.fanki.graphql.shared.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A variable declared by an operation, {@code $id: Int = 1}.
 *
 * @param name the variable name, without {@code $}
 * @param type the declared type
 * @param defaultValue the default value, or null
 * @param directives the directives
 * @param location where the definition starts
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record VariableDefinition(
        String name,
        TypeRef type,
        Value defaultValue,
        List<Directive> directives,
        SourceLocation location) {

    /** Validates the definition. */
    public VariableDefinition {
        Preconditions.requireName(name, "Variable");
        Preconditions.requireNonNull(type, "Variable type is required");
        directives = List.copyOf(directives);
    }

    @Override
    public boolean equals(final Object other) {
        return other instanceof VariableDefinition that
                && name.equals(that.name)
                && type.equals(that.type)
                && Objects.equals(defaultValue, that.defaultValue)
                && directives.equals(that.directives);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, defaultValue, directives);
    }
}
