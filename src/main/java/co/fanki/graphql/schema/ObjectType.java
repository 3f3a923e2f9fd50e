package co.fanki.graphql.schema;

import co.fanki.graphql.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * An object type: a named set of fields, possibly implementing
 * interfaces.
 *
 * <p>Other types are referenced by name, so an object may refer to
 * itself or take part in reference cycles.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ObjectType implements FieldsContainer {

    private final String name;
    private final String description;
    private final Map<String, FieldDefinition> fields;
    private final List<String> interfaces;
    private final Predicate<Object> isTypeOf;
    private final CacheControl cacheControl;

    private ObjectType(final Builder builder) {
        this.name = Preconditions.requireName(builder.name, "Object type");
        Preconditions.requireSchema(!builder.fields.isEmpty(),
                "Object type " + builder.name
                        + " must define one or more fields.");
        this.description = builder.description;
        this.fields = Collections.unmodifiableMap(
                new LinkedHashMap<>(builder.fields));
        this.interfaces = List.copyOf(builder.interfaces);
        this.isTypeOf = builder.isTypeOf;
        this.cacheControl = builder.cacheControl;
    }

    /**
     * Starts an object type.
     *
     * @param name the type name
     * @return the builder
     */
    public static Builder newObject(final String name) {
        return new Builder(name);
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
        return TypeKind.OBJECT;
    }

    @Override
    public Map<String, FieldDefinition> fields() {
        return fields;
    }

    @Override
    public List<String> interfaces() {
        return interfaces;
    }

    /**
     * Tells whether a value belongs to this type.
     *
     * @param value the value
     * @return true on a match, false if it does not match or no
     *         predicate was given
     */
    public boolean isTypeOf(final Object value) {
        return isTypeOf != null && isTypeOf.test(value);
    }

    /** Returns true if an {@code isTypeOf} predicate was given. */
    public boolean hasTypeOfPredicate() {
        return isTypeOf != null;
    }

    /** Returns the cache hint, or null. */
    public CacheControl cacheControl() {
        return cacheControl;
    }

    @Override
    public String toString() {
        return name;
    }

    /** Builds {@link ObjectType}s. */
    public static final class Builder {

        private final String name;
        private final Map<String, FieldDefinition> fields =
                new LinkedHashMap<>();
        private final List<String> interfaces = new ArrayList<>();
        private String description;
        private Predicate<Object> isTypeOf;
        private CacheControl cacheControl;

        private Builder(final String theName) {
            this.name = theName;
        }

        public Builder description(final String theDescription) {
            description = theDescription;
            return this;
        }

        /**
         * Adds a field.
         *
         * @param field the field
         * @return this builder
         */
        public Builder field(final FieldDefinition field) {
            Preconditions.requireSchema(!fields.containsKey(field.name()),
                    "Field " + name + "." + field.name()
                            + " can only be defined once.");
            fields.put(field.name(), field);
            return this;
        }

        /**
         * Adds a field built from a builder.
         *
         * @param field the field builder
         * @return this builder
         */
        public Builder field(final FieldDefinition.Builder field) {
            return field(field.build());
        }

        /**
         * Adds a field read from the parent by the property resolver.
         *
         * @param fieldName the field name
         * @param type the type in SDL form
         * @return this builder
         */
        public Builder field(final String fieldName, final String type) {
            return field(FieldDefinition.newField(fieldName, type).build());
        }

        /**
         * Adds a field with a resolver.
         *
         * @param fieldName the field name
         * @param type the type in SDL form
         * @param resolver the resolver
         * @return this builder
         */
        public Builder field(final String fieldName, final String type,
                final Resolver resolver) {
            return field(FieldDefinition.newField(fieldName, type)
                    .resolver(resolver).build());
        }

        /**
         * Declares implemented interfaces.
         *
         * @param interfaceNames the interface names
         * @return this builder
         */
        public Builder implementing(final String... interfaceNames) {
            for (final String interfaceName : interfaceNames) {
                Preconditions.requireSchema(
                        !interfaces.contains(interfaceName),
                        "Type " + name + " can only implement "
                                + interfaceName + " once.");
                interfaces.add(interfaceName);
            }
            return this;
        }

        public Builder isTypeOf(final Predicate<Object> predicate) {
            isTypeOf = predicate;
            return this;
        }

        public Builder cacheControl(final CacheControl theCacheControl) {
            cacheControl = theCacheControl;
            return this;
        }

        public ObjectType build() {
            return new ObjectType(this);
        }
    }
}
