package co.fanki.graphql.introspection;

import co.fanki.graphql.language.Printer;
import co.fanki.graphql.language.TypeRef;
import co.fanki.graphql.schema.ArgumentDefinition;
import co.fanki.graphql.schema.DirectiveDefinition;
import co.fanki.graphql.schema.DirectiveLocation;
import co.fanki.graphql.schema.EnumType;
import co.fanki.graphql.schema.EnumValueDefinition;
import co.fanki.graphql.schema.FieldDefinition;
import co.fanki.graphql.schema.FieldsContainer;
import co.fanki.graphql.schema.InputObjectType;
import co.fanki.graphql.schema.ObjectType;
import co.fanki.graphql.schema.Resolver;
import co.fanki.graphql.schema.ResolverContext;
import co.fanki.graphql.schema.ScalarType;
import co.fanki.graphql.schema.Schema;
import co.fanki.graphql.schema.TypeDefinition;
import co.fanki.graphql.schema.TypeKind;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * The introspection system: meta-types describing a schema and the
 * meta-fields exposing them.
 *
 * <p>The meta-types are ordinary object and enum types with resolvers,
 * registered in every schema, so introspection queries are validated
 * and executed like any other query. The value of a {@code __Type} is
 * a {@link TypeRef}: named types are looked up in the schema while
 * list and non-null wrappers report {@code LIST} and {@code NON_NULL}
 * and expose their {@code ofType}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Introspection {

    /** {@code __typename: String!}, on every composite type. */
    public static final FieldDefinition TYPENAME_FIELD = FieldDefinition
            .newField("__typename", "String!")
            .description("The name of the current Object type at runtime.")
            .resolver((parent, args, ctx) -> ctx.parentType().name())
            .build();

    /** {@code __schema: __Schema!}, on the query root. */
    public static final FieldDefinition SCHEMA_FIELD = FieldDefinition
            .newField("__schema", "__Schema!")
            .description("Access the current type schema of this server.")
            .resolver((parent, args, ctx) -> ctx.schema())
            .build();

    /** {@code __type(name: String!): __Type}, on the query root. */
    public static final FieldDefinition TYPE_FIELD = FieldDefinition
            .newField("__type", "__Type")
            .description("Request the type information of a single type.")
            .argument("name", "String!")
            .resolver((parent, args, ctx) -> {
                final String name = (String) args.get("name");
                return ctx.schema().type(name) == null
                        ? null
                        : TypeRef.named(name);
            })
            .build();

    private static final List<TypeDefinition> TYPES = List.of(
            schemaType(), typeType(), fieldType(), inputValueType(),
            enumValueType(), directiveType(),
            enumOf("__TypeKind", "An enum describing what kind of type a"
                    + " given `__Type` is.", TypeKind.values()),
            enumOf("__DirectiveLocation", "A Directive can be adjacent to"
                    + " many parts of the GraphQL language, a"
                    + " __DirectiveLocation describes one such possible"
                    + " adjacencies.", DirectiveLocation.values()));

    private Introspection() {
    }

    /** Returns the meta-types, registered in every schema. */
    public static List<TypeDefinition> types() {
        return TYPES;
    }

    /**
     * Tells whether a type is one of the meta-types.
     *
     * @param type the type
     * @return true for the introspection types
     */
    public static boolean isIntrospectionType(final TypeDefinition type) {
        return TYPES.contains(type);
    }

    // -- __Schema ------------------------------------------------------------

    private static ObjectType schemaType() {
        return ObjectType.newObject("__Schema")
                .description("A GraphQL Schema defines the capabilities of a"
                        + " GraphQL server.")
                .field("description", "String")
                .field("types", "[__Type!]!", (parent, args, ctx) ->
                        ((Schema) parent).types().stream()
                                .map(type -> TypeRef.named(type.name()))
                                .toList())
                .field("queryType", "__Type!", (parent, args, ctx) ->
                        TypeRef.named(((Schema) parent).queryType().name()))
                .field("mutationType", "__Type", (parent, args, ctx) ->
                        nameOf(((Schema) parent).mutationType()))
                .field("subscriptionType", "__Type", (parent, args, ctx) ->
                        nameOf(((Schema) parent).subscriptionType()))
                .field("directives", "[__Directive!]!", (parent, args, ctx) ->
                        List.copyOf(((Schema) parent).directives()))
                .build();
    }

    private static TypeRef nameOf(final ObjectType type) {
        return type == null ? null : TypeRef.named(type.name());
    }

    // -- __Type --------------------------------------------------------------

    private static ObjectType typeType() {
        return ObjectType.newObject("__Type")
                .description("The fundamental unit of any GraphQL Schema is"
                        + " the type.")
                .field("kind", "__TypeKind!", Introspection::kind)
                .field("name", "String", namedOnly((type, args) ->
                        type.name()))
                .field("description", "String", namedOnly((type, args) ->
                        type.description()))
                .field("specifiedByURL", "String", namedOnly((type, args) ->
                        type instanceof ScalarType scalar
                                ? scalar.specifiedByUrl()
                                : null))
                .field(FieldDefinition.newField("fields", "[__Field!]")
                        .argument(ArgumentDefinition.of("includeDeprecated",
                                "Boolean", "false"))
                        .resolver(namedOnly((type, args) ->
                                type instanceof FieldsContainer container
                                        ? filter(container.fields().values()
                                                .stream()
                                                .filter(field -> !field.name()
                                                        .startsWith("__"))
                                                .toList(),
                                                FieldDefinition::isDeprecated,
                                                args)
                                        : null)))
                .field("interfaces", "[__Type!]", namedOnly((type, args) ->
                        type instanceof FieldsContainer container
                                ? container.interfaces().stream()
                                        .map(TypeRef::named)
                                        .toList()
                                : null))
                .field("possibleTypes", "[__Type!]", (parent, args, ctx) -> {
                    final TypeDefinition type = definition(parent, ctx);
                    if (type == null || !type.isAbstract()) {
                        return null;
                    }
                    return ctx.schema().possibleTypes(type).stream()
                            .map(objectType -> TypeRef.named(
                                    objectType.name()))
                            .toList();
                })
                .field(FieldDefinition.newField("enumValues", "[__EnumValue!]")
                        .argument(ArgumentDefinition.of("includeDeprecated",
                                "Boolean", "false"))
                        .resolver(namedOnly((type, args) ->
                                type instanceof EnumType enumType
                                        ? filter(enumType.values().values(),
                                                EnumValueDefinition::isDeprecated,
                                                args)
                                        : null)))
                .field(FieldDefinition.newField("inputFields",
                                "[__InputValue!]")
                        .argument(ArgumentDefinition.of("includeDeprecated",
                                "Boolean", "false"))
                        .resolver(namedOnly((type, args) ->
                                type instanceof InputObjectType input
                                        ? filter(input.fields().values(),
                                                ArgumentDefinition::isDeprecated,
                                                args)
                                        : null)))
                .field("ofType", "__Type", (parent, args, ctx) -> {
                    if (parent instanceof TypeRef.NonNull nonNull) {
                        return nonNull.ofType();
                    }
                    if (parent instanceof TypeRef.ListOf list) {
                        return list.ofType();
                    }
                    return null;
                })
                .build();
    }

    private static Object kind(final Object parent,
            final Map<String, Object> args, final ResolverContext ctx) {
        if (parent instanceof TypeRef.NonNull) {
            return TypeKind.NON_NULL;
        }
        if (parent instanceof TypeRef.ListOf) {
            return TypeKind.LIST;
        }
        return definition(parent, ctx).kind();
    }

    private static TypeDefinition definition(final Object parent,
            final ResolverContext ctx) {
        if (parent instanceof TypeRef.Named named) {
            return ctx.schema().type(named.name());
        }
        return null;
    }

    /** Resolves a {@code __Type} field that is null on wrapper types. */
    private static Resolver namedOnly(final NamedTypeResolver resolver) {
        return (parent, args, ctx) -> {
            final TypeDefinition type = definition(parent, ctx);
            return type == null ? null : resolver.resolve(type, args);
        };
    }

    @FunctionalInterface
    private interface NamedTypeResolver {
        Object resolve(TypeDefinition type, Map<String, Object> args);
    }

    private static <T> List<T> filter(final Collection<T> values,
            final Predicate<T> isDeprecated,
            final Map<String, Object> args) {
        if (Boolean.TRUE.equals(args.get("includeDeprecated"))) {
            return List.copyOf(values);
        }
        return values.stream().filter(isDeprecated.negate()).toList();
    }

    // -- __Field, __InputValue, __EnumValue ----------------------------------

    private static ObjectType fieldType() {
        return ObjectType.newObject("__Field")
                .description("Object and Interface types are described by a"
                        + " list of Fields, each of which has a name,"
                        + " potentially a list of arguments, and a return"
                        + " type.")
                .field("name", "String!")
                .field("description", "String")
                .field(FieldDefinition.newField("args", "[__InputValue!]!")
                        .argument(ArgumentDefinition.of("includeDeprecated",
                                "Boolean", "false"))
                        .resolver((parent, args, ctx) -> filter(
                                ((FieldDefinition) parent).arguments().values(),
                                ArgumentDefinition::isDeprecated, args)))
                .field("type", "__Type!", (parent, args, ctx) ->
                        ((FieldDefinition) parent).type())
                .field("isDeprecated", "Boolean!")
                .field("deprecationReason", "String")
                .build();
    }

    private static ObjectType inputValueType() {
        return ObjectType.newObject("__InputValue")
                .description("Arguments provided to Fields or Directives and"
                        + " the input fields of an InputObject are"
                        + " represented as Input Values which describe their"
                        + " type and optionally a default value.")
                .field("name", "String!")
                .field("description", "String")
                .field("type", "__Type!", (parent, args, ctx) ->
                        ((ArgumentDefinition) parent).type())
                .field("defaultValue", "String", (parent, args, ctx) -> {
                    final ArgumentDefinition argument =
                            (ArgumentDefinition) parent;
                    return argument.hasDefaultValue()
                            ? Printer.print(argument.defaultValue())
                            : null;
                })
                .field("isDeprecated", "Boolean!")
                .field("deprecationReason", "String")
                .build();
    }

    private static ObjectType enumValueType() {
        return ObjectType.newObject("__EnumValue")
                .description("One possible value for a given Enum.")
                .field("name", "String!")
                .field("description", "String")
                .field("isDeprecated", "Boolean!")
                .field("deprecationReason", "String")
                .build();
    }

    // -- __Directive ---------------------------------------------------------

    private static ObjectType directiveType() {
        return ObjectType.newObject("__Directive")
                .description("A Directive provides a way to describe"
                        + " alternate runtime execution and type validation"
                        + " behavior in a GraphQL document.")
                .field("name", "String!")
                .field("description", "String")
                .field("isRepeatable", "Boolean!")
                .field("locations", "[__DirectiveLocation!]!",
                        (parent, args, ctx) -> List.copyOf(
                                ((DirectiveDefinition) parent).locations()))
                .field(FieldDefinition.newField("args", "[__InputValue!]!")
                        .argument(ArgumentDefinition.of("includeDeprecated",
                                "Boolean", "false"))
                        .resolver((parent, args, ctx) -> filter(
                                ((DirectiveDefinition) parent).arguments()
                                        .values(),
                                ArgumentDefinition::isDeprecated, args)))
                .build();
    }

    private static EnumType enumOf(final String name,
            final String description, final Enum<?>[] constants) {
        return new EnumType(name, description, Arrays.stream(constants)
                .map(constant -> EnumValueDefinition.of(constant.name()))
                .toList());
    }
}
