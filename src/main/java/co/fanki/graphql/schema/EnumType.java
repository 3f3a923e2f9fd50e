package co.fanki.graphql.schema;

import co.fanki.graphql.shared.Preconditions;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A leaf type whose values are a closed set of names.
 *
 * <p>Input values coerce to the value name. On output a resolver may
 * return the name or any Java enum constant whose {@code name()}
 * matches.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class EnumType implements TypeDefinition {

    private final String name;
    private final String description;
    private final Map<String, EnumValueDefinition> values;

    /**
     * Creates a new enum.
     *
     * @param theName the type name
     * @param theDescription the description, may be null
     * @param theValues the values, in declaration order, not empty
     */
    public EnumType(final String theName, final String theDescription,
            final List<EnumValueDefinition> theValues) {
        this.name = Preconditions.requireName(theName, "Enum");
        this.description = theDescription;
        Preconditions.requireSchema(theValues != null && !theValues.isEmpty(),
                "Enum type " + theName + " must define one or more values.");
        final Map<String, EnumValueDefinition> byName = new LinkedHashMap<>();
        for (final EnumValueDefinition value : theValues) {
            Preconditions.requireSchema(
                    byName.put(value.name(), value) == null,
                    "Enum value " + theName + "." + value.name()
                            + " can only be defined once.");
        }
        this.values = Collections.unmodifiableMap(byName);
    }

    /**
     * Creates an enum from plain value names.
     *
     * @param name the type name
     * @param valueNames the value names
     * @return the enum
     */
    public static EnumType of(final String name, final String... valueNames) {
        return new EnumType(name, null, Arrays.stream(valueNames)
                .map(EnumValueDefinition::of)
                .toList());
    }

    /**
     * Creates an enum mirroring a Java enum.
     *
     * @param name the type name
     * @param type the Java enum
     * @return the enum
     */
    public static EnumType of(final String name,
            final Class<? extends Enum<?>> type) {
        return new EnumType(name, null,
                Arrays.stream(type.getEnumConstants())
                        .map(constant -> EnumValueDefinition.of(
                                constant.name()))
                        .toList());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public TypeKind kind() {
        return TypeKind.ENUM;
    }

    /** Returns the values by name, in declaration order. */
    public Map<String, EnumValueDefinition> values() {
        return values;
    }

    /**
     * Finds a value.
     *
     * @param valueName the value name
     * @return the value, or null if not a member
     */
    public EnumValueDefinition value(final String valueName) {
        return values.get(valueName);
    }

    /**
     * Serializes a resolver result.
     *
     * @param result a value name or a Java enum constant
     * @return the value name
     * @throws CoercingException if the result is not a member
     */
    public String serialize(final Object result) {
        final String valueName = result instanceof Enum<?> constant
                ? constant.name()
                : String.valueOf(result);
        if (!values.containsKey(valueName)) {
            throw new CoercingException("Enum \"" + name
                    + "\" cannot represent value: " + result);
        }
        return valueName;
    }

    @Override
    public String toString() {
        return name;
    }
}
