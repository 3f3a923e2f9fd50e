package co.fanki.graphql.schema;

import co.fanki.graphql.TestSchema;
import co.fanki.graphql.language.OperationType;
import co.fanki.graphql.language.TypeRef;
import co.fanki.graphql.shared.GraphQLException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link Schema}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SchemaTest {

    private final Schema schema = new TestSchema().schema();

    @Test
    void whenBuilding_givenValidTypes_shouldRegisterBuiltIns() {
        assertSame(Scalars.INT, schema.type("Int"));
        assertSame(Scalars.DECIMAL, schema.type("Decimal"));
        assertNotNull(schema.type("__Schema"));
        assertNotNull(schema.directive("skip"));
        assertNotNull(schema.directive("include"));
        assertNotNull(schema.directive("deprecated"));
        assertEquals("Mutation",
                schema.rootType(OperationType.MUTATION).name());
        assertNull(schema.rootType(OperationType.SUBSCRIPTION));
    }

    @Test
    void whenFindingField_givenMetaFields_shouldOnlyExposeSchemaOnQuery() {
        final TypeDefinition user = schema.type("User");

        assertNotNull(schema.fieldDefinition(user, "__typename"));
        assertNull(schema.fieldDefinition(user, "__schema"));
        assertNotNull(schema.fieldDefinition(schema.queryType(), "__schema"));
        assertNotNull(schema.fieldDefinition(schema.queryType(), "__type"));
        assertNull(schema.fieldDefinition(schema.type("SearchResult"),
                "id"));
        assertNull(schema.fieldDefinition(schema.type("Int"), "id"));
    }

    @Test
    void whenCheckingTypes_givenAbstractTypes_shouldKnowPossibleTypes() {
        final TypeDefinition node = schema.type("Node");
        final ObjectType user = (ObjectType) schema.type("User");
        final ObjectType post = (ObjectType) schema.type("Post");

        assertEquals(List.of(user, post), schema.possibleTypes(node));
        assertTrue(schema.isPossibleType(schema.type("SearchResult"), post));
        assertTrue(schema.typesOverlap(node, schema.type("SearchResult")));
        assertFalse(schema.typesOverlap(user, post));
    }

    @Test
    void whenCheckingSubType_givenWrappedTypes_shouldFollowCovariance() {
        assertTrue(schema.isSubType(TypeRef.parse("User!"),
                TypeRef.parse("Node")));
        assertTrue(schema.isSubType(TypeRef.parse("[User!]"),
                TypeRef.parse("[Node]")));
        assertFalse(schema.isSubType(TypeRef.parse("User"),
                TypeRef.parse("User!")));
        assertFalse(schema.isSubType(TypeRef.parse("[User]"),
                TypeRef.parse("User")));
    }

    @Test
    void whenClassifying_givenTypeRefs_shouldTellInputFromOutput() {
        assertTrue(schema.isInputType(TypeRef.parse("[PostInput!]")));
        assertFalse(schema.isOutputType(TypeRef.parse("PostInput")));
        assertTrue(schema.isLeafType(TypeRef.parse("Role!")));
        assertTrue(schema.isCompositeType(TypeRef.parse("SearchResult")));
        assertFalse(schema.isInputType(TypeRef.parse("User")));
    }

    @Test
    void whenResolvingObjectType_givenIsTypeOf_shouldPickMatchingType() {
        final ResolverContext context = mock(ResolverContext.class);

        final ObjectType resolved = schema.resolveObjectType(
                schema.type("Node"),
                new TestSchema.Post(1, "t", 1), context);

        assertEquals("Post", resolved.name());
    }

    @Test
    void whenResolvingObjectType_givenUnknownValue_shouldFail() {
        final ResolverContext context = mock(ResolverContext.class);
        when(context.parentType()).thenReturn(schema.queryType());
        when(context.fieldName()).thenReturn("node");

        final GraphQLException e = assertThrows(GraphQLException.class,
                () -> schema.resolveObjectType(schema.type("Node"), "text",
                        context));

        assertEquals("TYPE_RESOLUTION_FAILED", e.getErrorCode());
        assertEquals("Abstract type \"Node\" must resolve to an Object type"
                + " at runtime for field \"Query.node\".", e.getMessage());
    }

    @Test
    void whenBuilding_givenNoQueryType_shouldFail() {
        final GraphQLException e = assertThrows(GraphQLException.class,
                () -> Schema.newSchema().build());

        assertEquals("INVALID_SCHEMA", e.getErrorCode());
    }

    @Test
    void whenBuilding_givenUnknownFieldType_shouldFail() {
        final ObjectType query = ObjectType.newObject("Query")
                .field("thing", "Thing")
                .build();

        final GraphQLException e = assertThrows(GraphQLException.class,
                () -> Schema.newSchema().query(query).build());

        assertEquals("Unknown type \"Thing\" referenced by Query.thing.",
                e.getMessage());
    }

    @Test
    void whenBuilding_givenDuplicateTypeNames_shouldFail() {
        final ObjectType query = ObjectType.newObject("Query")
                .field("a", "String")
                .build();

        assertThrows(GraphQLException.class, () -> Schema.newSchema()
                .query(query)
                .types(EnumType.of("Color", "RED"),
                        EnumType.of("Color", "BLUE"))
                .build());
    }

    @Test
    void whenBuilding_givenInputTypeAsFieldType_shouldFail() {
        final ObjectType query = ObjectType.newObject("Query")
                .field("a", "Filter")
                .build();

        final GraphQLException e = assertThrows(GraphQLException.class,
                () -> Schema.newSchema().query(query)
                        .type(InputObjectType.of("Filter",
                                ArgumentDefinition.of("q", "String")))
                        .build());

        assertEquals("The type of Query.a must be Output Type but got:"
                + " Filter.", e.getMessage());
    }

    @Test
    void whenBuilding_givenIncompleteInterfaceImplementation_shouldFail() {
        final InterfaceType named = InterfaceType.newInterface("Named")
                .field("name", "String!")
                .build();
        final ObjectType pet = ObjectType.newObject("Pet")
                .implementing("Named")
                .field("name", "String")
                .build();
        final ObjectType query = ObjectType.newObject("Query")
                .field("pet", "Pet")
                .build();

        final GraphQLException e = assertThrows(GraphQLException.class,
                () -> Schema.newSchema().query(query).types(named, pet)
                        .build());

        assertEquals("Interface field Named.name expects type String! but"
                + " Pet.name is type String.", e.getMessage());
    }

    @Test
    void whenBuilding_givenUnionOfScalar_shouldFail() {
        final ObjectType query = ObjectType.newObject("Query")
                .field("u", "Mixed")
                .build();

        assertThrows(GraphQLException.class, () -> Schema.newSchema()
                .query(query)
                .type(UnionType.of("Mixed", "String"))
                .build());
    }

    @Test
    void whenBuilding_givenReservedName_shouldFail() {
        final ObjectType query = ObjectType.newObject("Query")
                .field("a", "String")
                .build();

        assertThrows(GraphQLException.class, () -> Schema.newSchema()
                .query(query)
                .type(EnumType.of("__Secret", "A"))
                .build());
    }

    @Test
    void whenBuildingObject_givenNoFields_shouldFail() {
        assertThrows(GraphQLException.class,
                () -> ObjectType.newObject("Empty").build());
    }
}
