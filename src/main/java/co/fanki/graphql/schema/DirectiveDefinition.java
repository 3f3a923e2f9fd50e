package co.fanki.graphql.schema;

import co.fanki.graphql.language.Parser;
import co.fanki.graphql.language.TypeRef;
import co.fanki.graphql.shared.Preconditions;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A directive the schema accepts.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DirectiveDefinition {

    /** Default reason of {@code @deprecated}. */
    public static final String DEFAULT_DEPRECATION_REASON =
            "No longer supported";

    /** {@code @skip(if: Boolean!)}. */
    public static final DirectiveDefinition SKIP = new DirectiveDefinition(
            "skip",
            "Directs the executor to skip this field or fragment when the"
                    + " `if` argument is true.",
            EnumSet.of(DirectiveLocation.FIELD,
                    DirectiveLocation.FRAGMENT_SPREAD,
                    DirectiveLocation.INLINE_FRAGMENT),
            List.of(new ArgumentDefinition("if", "Skipped when true.",
                    TypeRef.parse("Boolean!"), null, null)),
            false);

    /** {@code @include(if: Boolean!)}. */
    public static final DirectiveDefinition INCLUDE = new DirectiveDefinition(
            "include",
            "Directs the executor to include this field or fragment only"
                    + " when the `if` argument is true.",
            EnumSet.of(DirectiveLocation.FIELD,
                    DirectiveLocation.FRAGMENT_SPREAD,
                    DirectiveLocation.INLINE_FRAGMENT),
            List.of(new ArgumentDefinition("if", "Included when true.",
                    TypeRef.parse("Boolean!"), null, null)),
            false);

    /** {@code @deprecated(reason: String = "No longer supported")}. */
    public static final DirectiveDefinition DEPRECATED =
            new DirectiveDefinition(
                    "deprecated",
                    "Marks an element of a GraphQL schema as no longer"
                            + " supported.",
                    EnumSet.of(DirectiveLocation.FIELD_DEFINITION,
                            DirectiveLocation.ARGUMENT_DEFINITION,
                            DirectiveLocation.INPUT_FIELD_DEFINITION,
                            DirectiveLocation.ENUM_VALUE),
                    List.of(new ArgumentDefinition("reason", null,
                            TypeRef.parse("String"),
                            Parser.parseValue(
                                    "\"" + DEFAULT_DEPRECATION_REASON + "\""),
                            null)),
                    false);

    /** {@code @specifiedBy(url: String!)}. */
    public static final DirectiveDefinition SPECIFIED_BY =
            new DirectiveDefinition(
                    "specifiedBy",
                    "Exposes a URL that specifies the behavior of this"
                            + " scalar.",
                    EnumSet.of(DirectiveLocation.SCALAR),
                    List.of(new ArgumentDefinition("url", null,
                            TypeRef.parse("String!"), null, null)),
                    false);

    private final String name;
    private final String description;
    private final Set<DirectiveLocation> locations;
    private final Map<String, ArgumentDefinition> arguments;
    private final boolean repeatable;

    /**
     * Creates a new directive definition.
     *
     * @param theName the directive name, without {@code @}
     * @param theDescription the description, may be null
     * @param theLocations where the directive may appear, not empty
     * @param theArguments the arguments
     * @param isRepeatable whether it may appear more than once per
     *                     location
     */
    public DirectiveDefinition(final String theName,
            final String theDescription,
            final Set<DirectiveLocation> theLocations,
            final List<ArgumentDefinition> theArguments,
            final boolean isRepeatable) {
        this.name = Preconditions.requireName(theName, "Directive");
        this.description = theDescription;
        Preconditions.require(theLocations != null && !theLocations.isEmpty(),
                "Directive @" + theName + " needs at least one location");
        this.locations = Collections.unmodifiableSet(
                EnumSet.copyOf(theLocations));
        final Map<String, ArgumentDefinition> byName = new LinkedHashMap<>();
        for (final ArgumentDefinition argument : theArguments) {
            Preconditions.require(byName.put(argument.name(), argument) == null,
                    "Duplicate argument " + argument.name()
                            + " on directive @" + theName);
        }
        this.arguments = Collections.unmodifiableMap(byName);
        this.repeatable = isRepeatable;
    }

    /** Returns the directives every schema declares. */
    public static List<DirectiveDefinition> builtIns() {
        return List.of(INCLUDE, SKIP, DEPRECATED, SPECIFIED_BY);
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    /** Returns the locations, in declaration order of the enum. */
    public Set<DirectiveLocation> locations() {
        return locations;
    }

    public Map<String, ArgumentDefinition> arguments() {
        return arguments;
    }

    /**
     * Finds an argument.
     *
     * @param argumentName the argument name
     * @return the argument, or null if not declared
     */
    public ArgumentDefinition argument(final String argumentName) {
        return arguments.get(argumentName);
    }

    public boolean isRepeatable() {
        return repeatable;
    }

    @Override
    public String toString() {
        return "@" + name;
    }
}
