package co.fanki.graphql.schema;

import co.fanki.graphql.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An abstract type declaring the fields its implementations share.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class InterfaceType implements FieldsContainer {

    private final String name;
    private final String description;
    private final Map<String, FieldDefinition> fields;
    private final List<String> interfaces;
    private final TypeResolver typeResolver;

    private InterfaceType(final Builder builder) {
        this.name = Preconditions.requireName(builder.name, "Interface");
        Preconditions.requireSchema(!builder.fields.isEmpty(),
                "Interface " + builder.name
                        + " must define one or more fields.");
        this.description = builder.description;
        this.fields = Collections.unmodifiableMap(
                new LinkedHashMap<>(builder.fields));
        this.interfaces = List.copyOf(builder.interfaces);
        this.typeResolver = builder.typeResolver;
    }

    /**
     * Starts an interface type.
     *
     * @param name the type name
     * @return the builder
     */
    public static Builder newInterface(final String name) {
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
        return TypeKind.INTERFACE;
    }

    @Override
    public Map<String, FieldDefinition> fields() {
        return fields;
    }

    @Override
    public List<String> interfaces() {
        return interfaces;
    }

    /** Returns the type resolver, or null. */
    public TypeResolver typeResolver() {
        return typeResolver;
    }

    @Override
    public String toString() {
        return name;
    }

    /** Builds {@link InterfaceType}s. */
    public static final class Builder {

        private final String name;
        private final Map<String, FieldDefinition> fields =
                new LinkedHashMap<>();
        private final List<String> interfaces = new ArrayList<>();
        private String description;
        private TypeResolver typeResolver;

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
         * Adds a field by name and type.
         *
         * @param fieldName the field name
         * @param type the type in SDL form
         * @return this builder
         */
        public Builder field(final String fieldName, final String type) {
            return field(FieldDefinition.newField(fieldName, type).build());
        }

        public Builder implementing(final String... interfaceNames) {
            interfaces.addAll(List.of(interfaceNames));
            return this;
        }

        public Builder typeResolver(final TypeResolver theTypeResolver) {
            typeResolver = theTypeResolver;
            return this;
        }

        public InterfaceType build() {
            return new InterfaceType(this);
        }
    }
}
