package co.fanki.graphql.schema;

import co.fanki.graphql.shared.Preconditions;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An abstract type whose values are one of a set of object types.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class UnionType implements TypeDefinition {

    private final String name;
    private final String description;
    private final List<String> members;
    private final TypeResolver typeResolver;

    /**
     * Creates a new union.
     *
     * @param theName the type name
     * @param theDescription the description, may be null
     * @param theMembers the member object type names, not empty
     * @param theTypeResolver the type resolver, may be null
     */
    public UnionType(final String theName, final String theDescription,
            final List<String> theMembers, final TypeResolver theTypeResolver) {
        this.name = Preconditions.requireName(theName, "Union");
        this.description = theDescription;
        Preconditions.requireSchema(theMembers != null && !theMembers.isEmpty(),
                "Union type " + theName
                        + " must define one or more member types.");
        final Set<String> unique = new LinkedHashSet<>(theMembers);
        Preconditions.requireSchema(unique.size() == theMembers.size(),
                "Union type " + theName
                        + " can only include each member once.");
        this.members = List.copyOf(theMembers);
        this.typeResolver = theTypeResolver;
    }

    /**
     * Creates a union without type resolver.
     *
     * @param name the type name
     * @param members the member object type names
     * @return the union
     */
    public static UnionType of(final String name, final String... members) {
        return new UnionType(name, null, List.of(members), null);
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
        return TypeKind.UNION;
    }

    /** Returns the member object type names. */
    public List<String> members() {
        return members;
    }

    /** Returns the type resolver, or null. */
    public TypeResolver typeResolver() {
        return typeResolver;
    }

    /** Returns a copy using the given type resolver. */
    public UnionType withTypeResolver(final TypeResolver resolver) {
        return new UnionType(name, description, members, resolver);
    }

    @Override
    public String toString() {
        return name;
    }
}
