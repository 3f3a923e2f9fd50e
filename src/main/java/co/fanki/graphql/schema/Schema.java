package co.fanki.graphql.schema;

import co.fanki.graphql.introspection.Introspection;
import co.fanki.graphql.language.OperationType;
import co.fanki.graphql.language.TypeRef;
import co.fanki.graphql.shared.GraphQLException;
import co.fanki.graphql.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The immutable type system requests are executed against.
 *
 * <p>A schema holds every named type by name, the root operation types
 * and the directives. Built-in scalars, built-in directives and the
 * introspection types are registered by the {@link Builder}, which also
 * rejects inconsistent type systems with a {@link GraphQLException}
 * whose code is {@code INVALID_SCHEMA}.</p>
 *
 * <p>Once built, a schema is never mutated and can be shared by any
 * number of concurrent requests.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Schema {

    private final String description;
    private final Map<String, TypeDefinition> types;
    private final ObjectType queryType;
    private final ObjectType mutationType;
    private final ObjectType subscriptionType;
    private final Map<String, DirectiveDefinition> directives;

    /** Abstract type name to its possible object types. */
    private final Map<String, List<ObjectType>> possibleTypes;

    /** Interface name to the interfaces implementing it. */
    private final Map<String, List<String>> interfaceImplementations;

    private Schema(final Builder builder, final Map<String, TypeDefinition> theTypes,
            final Map<String, DirectiveDefinition> theDirectives) {
        this.description = builder.description;
        this.types = Collections.unmodifiableMap(theTypes);
        this.queryType = builder.queryType;
        this.mutationType = builder.mutationType;
        this.subscriptionType = builder.subscriptionType;
        this.directives = Collections.unmodifiableMap(theDirectives);
        this.possibleTypes = new LinkedHashMap<>();
        this.interfaceImplementations = new LinkedHashMap<>();
        indexAbstractTypes();
    }

    /**
     * Starts a schema.
     *
     * @return the builder
     */
    public static Builder newSchema() {
        return new Builder();
    }

    // -- Lookups -------------------------------------------------------------

    /** Returns the schema description, or null. */
    public String description() {
        return description;
    }

    /**
     * Finds a named type.
     *
     * @param name the type name
     * @return the type, or null if there is no such type
     */
    public TypeDefinition type(final String name) {
        return types.get(name);
    }

    /**
     * Finds the named type underneath a type reference.
     *
     * @param type the type reference
     * @return the named type, or null if there is no such type
     */
    public TypeDefinition type(final TypeRef type) {
        return types.get(type.namedType());
    }

    /** Returns every type, user types first. */
    public Collection<TypeDefinition> types() {
        return types.values();
    }

    public ObjectType queryType() {
        return queryType;
    }

    /** Returns the mutation root, or null. */
    public ObjectType mutationType() {
        return mutationType;
    }

    /** Returns the subscription root, or null. */
    public ObjectType subscriptionType() {
        return subscriptionType;
    }

    /**
     * Returns the root type of an operation kind.
     *
     * @param operation the operation kind
     * @return the root type, or null if the schema does not support it
     */
    public ObjectType rootType(final OperationType operation) {
        return switch (operation) {
            case QUERY -> queryType;
            case MUTATION -> mutationType;
            case SUBSCRIPTION -> subscriptionType;
        };
    }

    /**
     * Finds a directive.
     *
     * @param name the directive name, without {@code @}
     * @return the directive, or null if unknown
     */
    public DirectiveDefinition directive(final String name) {
        return directives.get(name);
    }

    public Collection<DirectiveDefinition> directives() {
        return directives.values();
    }

    /**
     * Finds the definition of a field selected on a type, meta-fields
     * included.
     *
     * <p>{@code __typename} exists on every composite type;
     * {@code __schema} and {@code __type} only on the query root. A
     * union has no other fields.</p>
     *
     * @param parentType the type the field is selected on
     * @param fieldName the field name
     * @return the field, or null if the type has no such field
     */
    public FieldDefinition fieldDefinition(final TypeDefinition parentType,
            final String fieldName) {
        if (parentType == null || !parentType.isComposite()) {
            return null;
        }
        if (Introspection.TYPENAME_FIELD.name().equals(fieldName)) {
            return Introspection.TYPENAME_FIELD;
        }
        if (parentType == queryType) {
            if (Introspection.SCHEMA_FIELD.name().equals(fieldName)) {
                return Introspection.SCHEMA_FIELD;
            }
            if (Introspection.TYPE_FIELD.name().equals(fieldName)) {
                return Introspection.TYPE_FIELD;
            }
        }
        if (parentType instanceof FieldsContainer container) {
            return container.field(fieldName);
        }
        return null;
    }

    // -- Abstract types ------------------------------------------------------

    /**
     * Returns the object types a value of an abstract type can be.
     *
     * @param abstractType an interface or union
     * @return the possible types, empty for other kinds
     */
    public List<ObjectType> possibleTypes(final TypeDefinition abstractType) {
        if (abstractType instanceof ObjectType objectType) {
            return List.of(objectType);
        }
        return possibleTypes.getOrDefault(abstractType.name(), List.of());
    }

    /**
     * Tells whether an object type is a possible type of an abstract
     * type.
     *
     * @param abstractType an interface or union
     * @param objectType the object type
     * @return true if values of the object type can appear where the
     *         abstract type is expected
     */
    public boolean isPossibleType(final TypeDefinition abstractType,
            final ObjectType objectType) {
        return possibleTypes(abstractType).contains(objectType);
    }

    /**
     * Tells whether two composite types can have a value in common.
     *
     * @param a a composite type
     * @param b another composite type
     * @return true if some object type belongs to both
     */
    public boolean typesOverlap(final TypeDefinition a,
            final TypeDefinition b) {
        if (a == b) {
            return true;
        }
        for (final ObjectType candidate : possibleTypes(a)) {
            if (possibleTypes(b).contains(candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Finds the concrete object type of a value of an abstract type.
     *
     * <p>Tries the abstract type's {@link TypeResolver}, then the
     * {@code isTypeOf} predicates of the possible types, then a
     * {@code __typename} entry when the value is a map.</p>
     *
     * @param abstractType the declared interface or union
     * @param value the value, never null
     * @param context the context of the field being completed
     * @return the object type
     * @throws GraphQLException when no possible type matches
     */
    public ObjectType resolveObjectType(final TypeDefinition abstractType,
            final Object value, final ResolverContext context) {
        if (abstractType instanceof ObjectType objectType) {
            return objectType;
        }

        final TypeResolver resolver = abstractType instanceof InterfaceType
                ? ((InterfaceType) abstractType).typeResolver()
                : ((UnionType) abstractType).typeResolver();

        String typeName = resolver == null
                ? null
                : resolver.resolveType(value, context);

        if (typeName == null) {
            for (final ObjectType candidate : possibleTypes(abstractType)) {
                if (candidate.isTypeOf(value)) {
                    typeName = candidate.name();
                    break;
                }
            }
        }

        if (typeName == null && value instanceof Map<?, ?> map
                && map.get(Introspection.TYPENAME_FIELD.name())
                        instanceof String name) {
            typeName = name;
        }

        if (typeName == null) {
            throw new GraphQLException("Abstract type \"" + abstractType.name()
                    + "\" must resolve to an Object type at runtime for"
                    + " field \"" + context.parentType().name() + "."
                    + context.fieldName() + "\".",
                    "TYPE_RESOLUTION_FAILED");
        }

        final TypeDefinition runtimeType = types.get(typeName);
        if (!(runtimeType instanceof ObjectType objectType)
                || !isPossibleType(abstractType, objectType)) {
            throw new GraphQLException("Runtime Object type \"" + typeName
                    + "\" is not a possible type for \""
                    + abstractType.name() + "\".",
                    "TYPE_RESOLUTION_FAILED");
        }
        return objectType;
    }

    // -- Type references -----------------------------------------------------

    /**
     * Tells whether a value of one type can be used where another type
     * is expected.
     *
     * @param maybeSubType the provided type
     * @param superType the expected type
     * @return true if the provided type is equal to, or more specific
     *         than, the expected type
     */
    public boolean isSubType(final TypeRef maybeSubType,
            final TypeRef superType) {
        if (maybeSubType.equals(superType)) {
            return true;
        }
        if (superType instanceof TypeRef.NonNull superNonNull) {
            return maybeSubType instanceof TypeRef.NonNull subNonNull
                    && isSubType(subNonNull.ofType(), superNonNull.ofType());
        }
        if (maybeSubType instanceof TypeRef.NonNull subNonNull) {
            return isSubType(subNonNull.ofType(), superType);
        }
        if (superType instanceof TypeRef.ListOf superList) {
            return maybeSubType instanceof TypeRef.ListOf subList
                    && isSubType(subList.ofType(), superList.ofType());
        }
        if (maybeSubType instanceof TypeRef.ListOf) {
            return false;
        }
        final TypeDefinition sub = type(maybeSubType);
        final TypeDefinition sup = type(superType);
        if (sub == null || sup == null || !sup.isAbstract()) {
            return false;
        }
        if (sub instanceof ObjectType objectType) {
            return isPossibleType(sup, objectType);
        }
        return sub instanceof InterfaceType
                && interfaceImplementations.getOrDefault(sup.name(), List.of())
                        .contains(sub.name());
    }

    /** Returns true if the named type is a scalar, enum or input object. */
    public boolean isInputType(final TypeRef type) {
        final TypeDefinition definition = type(type);
        return definition != null && definition.isInput();
    }

    /** Returns true if the named type is anything but an input object. */
    public boolean isOutputType(final TypeRef type) {
        final TypeDefinition definition = type(type);
        return definition != null && definition.isOutput();
    }

    /** Returns true if the named type is a scalar or enum. */
    public boolean isLeafType(final TypeRef type) {
        final TypeDefinition definition = type(type);
        return definition != null && definition.isLeaf();
    }

    /** Returns true if the named type is an object, interface or union. */
    public boolean isCompositeType(final TypeRef type) {
        final TypeDefinition definition = type(type);
        return definition != null && definition.isComposite();
    }

    private void indexAbstractTypes() {
        for (final TypeDefinition type : types.values()) {
            if (type instanceof UnionType union) {
                final List<ObjectType> members = new ArrayList<>();
                for (final String member : union.members()) {
                    members.add((ObjectType) types.get(member));
                }
                possibleTypes.put(union.name(), List.copyOf(members));
            }
        }
        for (final TypeDefinition type : types.values()) {
            if (type instanceof FieldsContainer container) {
                for (final String implemented : container.interfaces()) {
                    if (container instanceof ObjectType objectType) {
                        possibleTypes.computeIfAbsent(implemented,
                                key -> new ArrayList<>()).add(objectType);
                    } else {
                        interfaceImplementations.computeIfAbsent(implemented,
                                key -> new ArrayList<>())
                                .add(container.name());
                    }
                }
            }
        }
        possibleTypes.replaceAll((name, list) -> List.copyOf(list));
    }

    // -- Builder -------------------------------------------------------------

    /** Builds and checks {@link Schema}s. */
    public static final class Builder {

        private final List<TypeDefinition> additionalTypes = new ArrayList<>();
        private final List<DirectiveDefinition> additionalDirectives =
                new ArrayList<>();
        private String description;
        private ObjectType queryType;
        private ObjectType mutationType;
        private ObjectType subscriptionType;

        private Builder() {
        }

        public Builder description(final String theDescription) {
            description = theDescription;
            return this;
        }

        public Builder query(final ObjectType theQueryType) {
            queryType = theQueryType;
            return this;
        }

        public Builder mutation(final ObjectType theMutationType) {
            mutationType = theMutationType;
            return this;
        }

        public Builder subscription(final ObjectType theSubscriptionType) {
            subscriptionType = theSubscriptionType;
            return this;
        }

        /**
         * Registers a type that is not a root type.
         *
         * @param type the type
         * @return this builder
         */
        public Builder type(final TypeDefinition type) {
            additionalTypes.add(Preconditions.requireNonNull(type,
                    "Type is required"));
            return this;
        }

        /**
         * Registers several types.
         *
         * @param types the types
         * @return this builder
         */
        public Builder types(final TypeDefinition... types) {
            for (final TypeDefinition type : types) {
                type(type);
            }
            return this;
        }

        /**
         * Registers a custom directive.
         *
         * @param directive the directive
         * @return this builder
         */
        public Builder directive(final DirectiveDefinition directive) {
            additionalDirectives.add(Preconditions.requireNonNull(directive,
                    "Directive is required"));
            return this;
        }

        /**
         * Builds the schema.
         *
         * @return the schema
         * @throws GraphQLException with code {@code INVALID_SCHEMA} if the
         *         type system is inconsistent
         */
        public Schema build() {
            Preconditions.requireSchema(queryType != null,
                    "Query root type must be provided.");

            final Map<String, TypeDefinition> types = new LinkedHashMap<>();
            register(types, queryType, false);
            if (mutationType != null) {
                register(types, mutationType, false);
            }
            if (subscriptionType != null) {
                register(types, subscriptionType, false);
            }
            for (final TypeDefinition type : additionalTypes) {
                register(types, type, false);
            }
            for (final ScalarType scalar : Scalars.builtIns()) {
                if (!types.containsKey(scalar.name())) {
                    types.put(scalar.name(), scalar);
                }
            }
            for (final TypeDefinition type : Introspection.types()) {
                register(types, type, true);
            }

            final Map<String, DirectiveDefinition> directives =
                    new LinkedHashMap<>();
            for (final DirectiveDefinition directive
                    : DirectiveDefinition.builtIns()) {
                directives.put(directive.name(), directive);
            }
            for (final DirectiveDefinition directive : additionalDirectives) {
                Preconditions.requireSchema(
                        !directives.containsKey(directive.name()),
                        "There can be only one directive named \"@"
                                + directive.name() + "\".");
                directives.put(directive.name(), directive);
            }

            final SchemaChecker checker = new SchemaChecker(types);
            for (final TypeDefinition type : types.values()) {
                checker.check(type);
            }
            for (final DirectiveDefinition directive : directives.values()) {
                checker.checkArguments("@" + directive.name(),
                        directive.arguments().values());
            }

            return new Schema(this, types, directives);
        }

        private static void register(final Map<String, TypeDefinition> types,
                final TypeDefinition type, final boolean builtIn) {
            Preconditions.requireSchema(builtIn || !type.name().startsWith("__"),
                    "Name \"" + type.name() + "\" must not begin with \"__\","
                            + " which is reserved by GraphQL introspection.");
            final TypeDefinition existing = types.get(type.name());
            if (existing == type) {
                return;
            }
            Preconditions.requireSchema(existing == null,
                    "There can be only one type named \"" + type.name()
                            + "\".");
            types.put(type.name(), type);
        }
    }

    // -- Consistency checks --------------------------------------------------

    /** Checks the references between the registered types. */
    private static final class SchemaChecker {

        private final Map<String, TypeDefinition> types;

        private SchemaChecker(final Map<String, TypeDefinition> theTypes) {
            this.types = theTypes;
        }

        private void check(final TypeDefinition type) {
            if (type instanceof FieldsContainer container) {
                checkFields(container);
                checkInterfaces(container);
            } else if (type instanceof UnionType union) {
                for (final String member : union.members()) {
                    Preconditions.requireSchema(
                            types.get(member) instanceof ObjectType,
                            "Union type " + union.name()
                                    + " can only include Object types,"
                                    + " it cannot include " + member + ".");
                }
            } else if (type instanceof InputObjectType input) {
                checkArguments(input.name(), input.fields().values());
            }
        }

        private void checkFields(final FieldsContainer container) {
            for (final FieldDefinition field : container.fields().values()) {
                final String coordinate = container.name() + "." + field.name();
                final TypeDefinition fieldType = resolve(field.type(),
                        coordinate);
                Preconditions.requireSchema(fieldType.isOutput(),
                        "The type of " + coordinate
                                + " must be Output Type but got: "
                                + field.type() + ".");
                checkArguments(coordinate, field.arguments().values());
            }
        }

        private void checkArguments(final String owner,
                final Collection<ArgumentDefinition> arguments) {
            for (final ArgumentDefinition argument : arguments) {
                final String coordinate = owner + "(" + argument.name() + ":)";
                final TypeDefinition argumentType = resolve(argument.type(),
                        coordinate);
                Preconditions.requireSchema(argumentType.isInput(),
                        "The type of " + coordinate
                                + " must be Input Type but got: "
                                + argument.type() + ".");
            }
        }

        private void checkInterfaces(final FieldsContainer container) {
            for (final String interfaceName : container.interfaces()) {
                final TypeDefinition candidate = types.get(interfaceName);
                Preconditions.requireSchema(candidate instanceof InterfaceType,
                        "Type " + container.name()
                                + " must only implement Interface types,"
                                + " it cannot implement " + interfaceName
                                + ".");
                Preconditions.requireSchema(candidate != container,
                        "Type " + container.name()
                                + " cannot implement itself.");
                final InterfaceType implemented = (InterfaceType) candidate;

                for (final String transitive : implemented.interfaces()) {
                    Preconditions.requireSchema(
                            container.interfaces().contains(transitive),
                            "Type " + container.name() + " must implement "
                                    + transitive + " because it is"
                                    + " implemented by " + interfaceName
                                    + ".");
                }
                checkImplementation(container, implemented);
            }
        }

        private void checkImplementation(final FieldsContainer container,
                final InterfaceType implemented) {
            for (final FieldDefinition expected
                    : implemented.fields().values()) {
                final String coordinate = implemented.name() + "."
                        + expected.name();
                final FieldDefinition actual = container.field(
                        expected.name());
                Preconditions.requireSchema(actual != null,
                        "Interface field " + coordinate + " expected but "
                                + container.name() + " does not provide it.");
                Preconditions.requireSchema(
                        isCovariant(actual.type(), expected.type()),
                        "Interface field " + coordinate + " expects type "
                                + expected.type() + " but "
                                + container.name() + "." + actual.name()
                                + " is type " + actual.type() + ".");

                for (final ArgumentDefinition argument
                        : expected.arguments().values()) {
                    final ArgumentDefinition provided = actual.argument(
                            argument.name());
                    Preconditions.requireSchema(provided != null
                                    && provided.type().equals(argument.type()),
                            "Interface field argument " + coordinate + "("
                                    + argument.name() + ":) expected with"
                                    + " type " + argument.type() + " on "
                                    + container.name() + "."
                                    + actual.name() + ".");
                }
                for (final ArgumentDefinition argument
                        : actual.arguments().values()) {
                    Preconditions.requireSchema(
                            expected.argument(argument.name()) != null
                                    || !argument.isRequired(),
                            "Object field " + container.name() + "."
                                    + actual.name() + " includes required"
                                    + " argument " + argument.name()
                                    + " that is missing from the Interface"
                                    + " field " + coordinate + ".");
                }
            }
        }

        /** Types are not yet indexed, so subtyping is checked by hand. */
        private boolean isCovariant(final TypeRef actual,
                final TypeRef expected) {
            if (actual.equals(expected)) {
                return true;
            }
            if (expected instanceof TypeRef.NonNull expectedNonNull) {
                return actual instanceof TypeRef.NonNull actualNonNull
                        && isCovariant(actualNonNull.ofType(),
                                expectedNonNull.ofType());
            }
            if (actual instanceof TypeRef.NonNull actualNonNull) {
                return isCovariant(actualNonNull.ofType(), expected);
            }
            if (expected instanceof TypeRef.ListOf expectedList) {
                return actual instanceof TypeRef.ListOf actualList
                        && isCovariant(actualList.ofType(),
                                expectedList.ofType());
            }
            if (actual instanceof TypeRef.ListOf) {
                return false;
            }
            final TypeDefinition actualType = types.get(actual.namedType());
            final String expectedName = expected.namedType();
            if (actualType instanceof FieldsContainer container) {
                return container.interfaces().contains(expectedName);
            }
            if (types.get(expectedName) instanceof UnionType union) {
                return union.members().contains(actual.namedType());
            }
            return false;
        }

        private TypeDefinition resolve(final TypeRef type,
                final String coordinate) {
            final TypeDefinition definition = types.get(type.namedType());
            Preconditions.requireSchema(definition != null,
                    "Unknown type \"" + type.namedType() + "\" referenced by "
                            + coordinate + ".");
            return definition;
        }
    }
}
