package co.fanki.graphql.introspection;

import co.fanki.graphql.TestSchema;
import co.fanki.graphql.engine.EngineSettings;
import co.fanki.graphql.engine.ExecutionRequest;
import co.fanki.graphql.engine.ExecutionResult;
import co.fanki.graphql.engine.QueryEngine;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link Introspection}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class IntrospectionTest {

    private final QueryEngine engine = new QueryEngine(
            new TestSchema().schema(), Runnable::run,
            EngineSettings.defaults());

    @Test
    void whenQueryingSchema_givenRootTypes_shouldNameThem() {
        final Map<String, Object> data = query("""
                { __schema { queryType { name } mutationType { name }
                  subscriptionType { name } } }
                """);

        final Map<String, Object> schema = map(data.get("__schema"));
        assertEquals(Map.of("name", "Query"), schema.get("queryType"));
        assertEquals(Map.of("name", "Mutation"), schema.get("mutationType"));
        assertNull(schema.get("subscriptionType"));
    }

    @Test
    void whenQueryingSchema_givenTypes_shouldListUserAndMetaTypes() {
        final List<Object> types = list(map(query(
                "{ __schema { types { name } } }").get("__schema"))
                .get("types"));

        assertTrue(types.contains(Map.of("name", "User")));
        assertTrue(types.contains(Map.of("name", "Decimal")));
        assertTrue(types.contains(Map.of("name", "__Schema")));
        assertTrue(types.contains(Map.of("name", "Boolean")));
    }

    @Test
    void whenQueryingType_givenObjectType_shouldDescribeWrappedFieldTypes() {
        final Map<String, Object> user = map(query("""
                { __type(name: "User") { kind name interfaces { name }
                  fields { name type { kind name ofType { kind name } } } } }
                """).get("__type"));

        assertEquals("OBJECT", user.get("kind"));
        assertEquals(List.of(Map.of("name", "Node")), user.get("interfaces"));

        final List<Object> fields = list(user.get("fields"));
        assertEquals(6, fields.size());
        final Map<String, Object> id = map(fields.get(0));
        assertEquals("id", id.get("name"));
        final Map<String, Object> idType = map(id.get("type"));
        assertEquals("NON_NULL", idType.get("kind"));
        assertNull(idType.get("name"));
        assertEquals(Map.of("kind", "SCALAR", "name", "Int"),
                idType.get("ofType"));
    }

    @Test
    void whenQueryingType_givenIncludeDeprecated_shouldShowDeprecatedFields() {
        final List<Object> fields = list(map(query("""
                { __type(name: "User") { fields(includeDeprecated: true) {
                  name isDeprecated deprecationReason } } }
                """).get("__type")).get("fields"));

        assertEquals(7, fields.size());
        assertEquals(Map.of("name", "email", "isDeprecated", true,
                "deprecationReason", "Not exposed anymore"), fields.get(6));
    }

    @Test
    void whenQueryingType_givenAbstractType_shouldListPossibleTypes() {
        final Map<String, Object> node = map(query(
                "{ __type(name: \"Node\") { kind possibleTypes { name } } }")
                .get("__type"));

        assertEquals("INTERFACE", node.get("kind"));
        assertEquals(List.of(Map.of("name", "User"), Map.of("name", "Post")),
                node.get("possibleTypes"));
    }

    @Test
    void whenQueryingType_givenEnumAndInput_shouldListValues() {
        final Map<String, Object> data = query("""
                { role: __type(name: "Role") { enumValues { name } }
                  input: __type(name: "PostInput") {
                    inputFields { name defaultValue } } }
                """);

        assertEquals(List.of(Map.of("name", "ADMIN"),
                Map.of("name", "MEMBER")),
                map(data.get("role")).get("enumValues"));

        final List<Object> inputFields = list(map(data.get("input"))
                .get("inputFields"));
        assertNull(map(inputFields.get(0)).get("defaultValue"));
        assertEquals("false", map(inputFields.get(1)).get("defaultValue"));
    }

    @Test
    void whenQueryingType_givenUnknownName_shouldReturnNull() {
        final Map<String, Object> data = query(
                "{ __type(name: \"Nope\") { name } }");

        assertTrue(data.containsKey("__type"));
        assertNull(data.get("__type"));
    }

    @Test
    void whenQueryingDirectives_givenBuiltIns_shouldDescribeSkip() {
        final List<Object> directives = list(map(query("""
                { __schema { directives { name locations args { name } } } }
                """).get("__schema")).get("directives"));

        final Object skip = directives.stream()
                .filter(directive -> "skip".equals(map(directive).get("name")))
                .findFirst()
                .orElseThrow();

        assertEquals(Map.of("name", "skip",
                "locations", List.of("FIELD", "FRAGMENT_SPREAD",
                        "INLINE_FRAGMENT"),
                "args", List.of(Map.of("name", "if"))), skip);
        assertEquals(4, directives.size());
    }

    @Test
    void whenQueryingTypename_givenMetaField_shouldNotBeIntrospectionType() {
        assertFalse(Introspection.isIntrospectionType(
                new TestSchema().schema().type("User")));
        assertTrue(Introspection.isIntrospectionType(
                new TestSchema().schema().type("__Type")));
    }

    private Map<String, Object> query(final String query) {
        final ExecutionResult result = engine.execute(
                ExecutionRequest.of(query));
        assertFalse(result.hasErrors(), result.errors().toString());
        return result.data();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(final Object value) {
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> list(final Object value) {
        return (List<Object>) value;
    }
}
