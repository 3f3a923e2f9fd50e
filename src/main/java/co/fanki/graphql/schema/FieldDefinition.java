package co.fanki.graphql.schema;

import co.fanki.graphql.language.TypeRef;
import co.fanki.graphql.shared.Preconditions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A field of an object or interface type.
 *
 * <p>Built with {@link #newField(String, String)}:</p>
 * <pre>
 * FieldDefinition.newField("user", "User")
 *     .argument("id", "Int!")
 *     .resolver((parent, args, ctx) -&gt; users.find(args.get("id")))
 *     .build();
 * </pre>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FieldDefinition {

    private final String name;
    private final String description;
    private final TypeRef type;
    private final Map<String, ArgumentDefinition> arguments;
    private final Resolver resolver;
    private final String deprecationReason;
    private final CacheControl cacheControl;

    private FieldDefinition(final Builder builder) {
        this.name = Preconditions.requireName(builder.name, "Field");
        this.description = builder.description;
        this.type = Preconditions.requireNonNull(builder.type,
                "Type is required for field " + builder.name);
        this.arguments = Collections.unmodifiableMap(
                new LinkedHashMap<>(builder.arguments));
        this.resolver = builder.resolver == null
                ? PropertyResolver.INSTANCE
                : builder.resolver;
        this.deprecationReason = builder.deprecationReason;
        this.cacheControl = builder.cacheControl;
    }

    /**
     * Starts a field definition.
     *
     * @param name the field name
     * @param type the return type in SDL form, e.g. {@code [User!]!}
     * @return the builder
     */
    public static Builder newField(final String name, final String type) {
        return new Builder(name, TypeRef.parse(type));
    }

    /**
     * Starts a field definition.
     *
     * @param name the field name
     * @param type the return type
     * @return the builder
     */
    public static Builder newField(final String name, final TypeRef type) {
        return new Builder(name, type);
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public TypeRef type() {
        return type;
    }

    /** Returns the arguments by name, in declaration order. */
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

    /** Returns the resolver, the {@link PropertyResolver} by default. */
    public Resolver resolver() {
        return resolver;
    }

    public String deprecationReason() {
        return deprecationReason;
    }

    public boolean isDeprecated() {
        return deprecationReason != null;
    }

    /** Returns the cache hint, or null. */
    public CacheControl cacheControl() {
        return cacheControl;
    }

    @Override
    public String toString() {
        return name + ": " + type;
    }

    /** Builds {@link FieldDefinition}s. */
    public static final class Builder {

        private final String name;
        private final TypeRef type;
        private final Map<String, ArgumentDefinition> arguments =
                new LinkedHashMap<>();
        private String description;
        private Resolver resolver;
        private String deprecationReason;
        private CacheControl cacheControl;

        private Builder(final String theName, final TypeRef theType) {
            this.name = theName;
            this.type = theType;
        }

        public Builder description(final String theDescription) {
            description = theDescription;
            return this;
        }

        /**
         * Adds an argument.
         *
         * @param argument the argument
         * @return this builder
         */
        public Builder argument(final ArgumentDefinition argument) {
            Preconditions.requireNonNull(argument, "Argument is required");
            Preconditions.require(!arguments.containsKey(argument.name()),
                    "Duplicate argument " + argument.name() + " on field "
                            + name);
            arguments.put(argument.name(), argument);
            return this;
        }

        /**
         * Adds an argument without default.
         *
         * @param argumentName the argument name
         * @param argumentType the type in SDL form
         * @return this builder
         */
        public Builder argument(final String argumentName,
                final String argumentType) {
            return argument(ArgumentDefinition.of(argumentName, argumentType));
        }

        public Builder resolver(final Resolver theResolver) {
            resolver = theResolver;
            return this;
        }

        /**
         * Sets a resolver that always returns the same value.
         *
         * @param value the value
         * @return this builder
         */
        public Builder staticValue(final Object value) {
            resolver = (parent, args, ctx) -> value;
            return this;
        }

        public Builder deprecate(final String reason) {
            deprecationReason = reason;
            return this;
        }

        public Builder cacheControl(final CacheControl theCacheControl) {
            cacheControl = theCacheControl;
            return this;
        }

        public FieldDefinition build() {
            return new FieldDefinition(this);
        }
    }
}
