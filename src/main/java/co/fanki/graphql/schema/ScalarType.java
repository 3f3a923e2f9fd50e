package co.fanki.graphql.schema;

import co.fanki.graphql.shared.Preconditions;

/**
 * A leaf type whose values are converted by a {@link Coercing}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ScalarType implements TypeDefinition {

    private final String name;
    private final String description;
    private final String specifiedByUrl;
    private final Coercing coercing;

    /**
     * Creates a new scalar type.
     *
     * @param theName the type name
     * @param theDescription the description, may be null
     * @param theSpecifiedByUrl the specification URL, may be null
     * @param theCoercing the value conversions
     */
    public ScalarType(final String theName, final String theDescription,
            final String theSpecifiedByUrl, final Coercing theCoercing) {
        this.name = Preconditions.requireName(theName, "Scalar");
        this.description = theDescription;
        this.specifiedByUrl = theSpecifiedByUrl;
        this.coercing = Preconditions.requireNonNull(theCoercing,
                "Coercing is required for scalar " + theName);
    }

    /**
     * Creates a scalar type without a specification URL.
     *
     * @param name the type name
     * @param description the description, may be null
     * @param coercing the value conversions
     * @return the scalar type
     */
    public static ScalarType of(final String name, final String description,
            final Coercing coercing) {
        return new ScalarType(name, description, null, coercing);
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
        return TypeKind.SCALAR;
    }

    /** Returns the URL of the scalar's specification, or null. */
    public String specifiedByUrl() {
        return specifiedByUrl;
    }

    /** Returns the value conversions. */
    public Coercing coercing() {
        return coercing;
    }

    @Override
    public String toString() {
        return name;
    }
}
