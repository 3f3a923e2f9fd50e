package co.fanki.graphql.language;

import co.fanki.graphql.shared.Preconditions;
import co.fanki.graphql.shared.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A directive applied in the document, such as {@code @skip(if: $x)}.
 *
 * <p>Equality ignores the source location.</p>
 *
 * @param name the directive name, without {@code @}
 * @param arguments the arguments
 * @param location where the directive starts
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Directive(String name, List<Argument> arguments,
        SourceLocation location) {

    /** Validates the directive. */
    public Directive {
        Preconditions.requireName(name, "Directive");
        arguments = List.copyOf(arguments);
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
        return other instanceof Directive that
                && name.equals(that.name)
                && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments);
    }
}
