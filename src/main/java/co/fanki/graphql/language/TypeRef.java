package co.fanki.graphql.language;

import co.fanki.graphql.shared.Preconditions;

/**
 * A reference to a type, possibly wrapped in list and non-null
 * modifiers.
 *
 * <p>Types are referenced by name only; the schema resolves the name
 * when needed. This keeps self-referencing types, such as a
 * {@code User} with a {@code friends: [User]} field, free of cyclic
 * object graphs.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface TypeRef {

    /**
     * A reference to a named type.
     *
     * @param name the type name
     */
    record Named(String name) implements TypeRef {

        /** Validates the name. */
        public Named {
            Preconditions.requireName(name, "Type");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A list of the wrapped type.
     *
     * @param ofType the element type
     */
    record ListOf(TypeRef ofType) implements TypeRef {

        /** Validates the element type. */
        public ListOf {
            Preconditions.requireNonNull(ofType, "List element type is required");
        }

        @Override
        public String toString() {
            return "[" + ofType + "]";
        }
    }

    /**
     * A non-null version of the wrapped type.
     *
     * @param ofType the nullable type being wrapped
     */
    record NonNull(TypeRef ofType) implements TypeRef {

        /** Rejects a non-null of a non-null. */
        public NonNull {
            Preconditions.requireNonNull(ofType, "Wrapped type is required");
            Preconditions.require(!(ofType instanceof NonNull),
                    "NonNull cannot wrap another NonNull: " + ofType);
        }

        @Override
        public String toString() {
            return ofType + "!";
        }
    }

    /**
     * Creates a named reference.
     *
     * @param name the type name
     * @return the reference
     */
    static TypeRef named(final String name) {
        return new Named(name);
    }

    /**
     * Creates a list reference.
     *
     * @param ofType the element type
     * @return the reference
     */
    static TypeRef listOf(final TypeRef ofType) {
        return new ListOf(ofType);
    }

    /**
     * Creates a non-null reference.
     *
     * @param ofType the nullable type
     * @return the reference
     */
    static TypeRef nonNull(final TypeRef ofType) {
        return new NonNull(ofType);
    }

    /**
     * Parses a type reference written in the query language, such as
     * {@code [String!]!}.
     *
     * @param text the type text
     * @return the reference
     * @throws SyntaxException if the text is not a type reference
     */
    static TypeRef parse(final String text) {
        return Parser.parseType(text);
    }

    /** Returns the innermost type name. */
    default String namedType() {
        TypeRef current = this;
        while (!(current instanceof Named)) {
            current = current instanceof ListOf list
                    ? list.ofType()
                    : ((NonNull) current).ofType();
        }
        return ((Named) current).name();
    }

    /** Returns true if this is a non-null reference. */
    default boolean isNonNull() {
        return this instanceof NonNull;
    }

    /** Returns true if this is a list, ignoring a non-null wrapper. */
    default boolean isList() {
        return nullable() instanceof ListOf;
    }

    /** Returns this type without its outer non-null wrapper. */
    default TypeRef nullable() {
        return this instanceof NonNull nonNull ? nonNull.ofType() : this;
    }
}
