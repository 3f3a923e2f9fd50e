package co.fanki.graphql.schema;

import co.fanki.graphql.language.Parser;
import co.fanki.graphql.language.TypeRef;
import co.fanki.graphql.language.Value;
import co.fanki.graphql.shared.Preconditions;

/**
 * An argument of a field or directive, or a field of an input object.
 *
 * @param name the argument name
 * @param description the description, may be null
 * @param type the declared input type
 * @param defaultValue the default literal, or null when there is none
 * @param deprecationReason the deprecation reason, or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ArgumentDefinition(
        String name,
        String description,
        TypeRef type,
        Value defaultValue,
        String deprecationReason) {

    /** Validates the definition. */
    public ArgumentDefinition {
        Preconditions.requireName(name, "Argument");
        Preconditions.requireNonNull(type, "Type is required for " + name);
        Preconditions.require(defaultValue == null || !defaultValue.hasVariables(),
                "Default value of " + name + " cannot reference variables");
    }

    /**
     * Creates an argument without default.
     *
     * @param name the argument name
     * @param type the type in SDL form, e.g. {@code Int!}
     * @return the argument
     */
    public static ArgumentDefinition of(final String name, final String type) {
        return new ArgumentDefinition(name, null, TypeRef.parse(type), null,
                null);
    }

    /**
     * Creates an argument with a default value.
     *
     * @param name the argument name
     * @param type the type in SDL form
     * @param defaultValue the default in literal form, e.g. {@code 10}
     * @return the argument
     */
    public static ArgumentDefinition of(final String name, final String type,
            final String defaultValue) {
        return new ArgumentDefinition(name, null, TypeRef.parse(type),
                Parser.parseValue(defaultValue), null);
    }

    /** Returns a copy with the given description. */
    public ArgumentDefinition withDescription(final String theDescription) {
        return new ArgumentDefinition(name, theDescription, type,
                defaultValue, deprecationReason);
    }

    /** Returns a copy marked as deprecated. */
    public ArgumentDefinition deprecate(final String reason) {
        return new ArgumentDefinition(name, description, type, defaultValue,
                reason);
    }

    /** Returns true if a default value is declared. */
    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    /** Returns true if the caller has to supply this argument. */
    public boolean isRequired() {
        return type.isNonNull() && defaultValue == null;
    }

    /** Returns true if a deprecation reason is set. */
    public boolean isDeprecated() {
        return deprecationReason != null;
    }
}
