package co.fanki.graphql.schema;

import co.fanki.graphql.shared.Preconditions;

/**
 * A member of an {@link EnumType}.
 *
 * @param name the value name
 * @param description the description, may be null
 * @param deprecationReason the deprecation reason, or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record EnumValueDefinition(
        String name,
        String description,
        String deprecationReason) {

    /** Validates the name. */
    public EnumValueDefinition {
        Preconditions.requireName(name, "Enum value");
        Preconditions.require(!"true".equals(name) && !"false".equals(name)
                && !"null".equals(name), "Enum value cannot be " + name);
    }

    /**
     * Creates a plain value.
     *
     * @param name the value name
     * @return the value definition
     */
    public static EnumValueDefinition of(final String name) {
        return new EnumValueDefinition(name, null, null);
    }

    /** Returns true if a deprecation reason is set. */
    public boolean isDeprecated() {
        return deprecationReason != null;
    }
}
