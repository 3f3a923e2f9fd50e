package co.fanki.graphql.execution;

import co.fanki.graphql.TestSchema;
import co.fanki.graphql.language.Document;
import co.fanki.graphql.language.OperationDefinition;
import co.fanki.graphql.language.Parser;
import co.fanki.graphql.schema.FieldDefinition;
import co.fanki.graphql.schema.ObjectType;
import co.fanki.graphql.schema.Schema;
import co.fanki.graphql.shared.GraphQLError;
import co.fanki.graphql.shared.GraphQLException;
import co.fanki.graphql.shared.SourceLocation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link QueryExecutor}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class QueryExecutorTest {

    private TestSchema fixture;
    private Schema schema;
    private ExecutorService pool;
    private QueryExecutor executor;

    @BeforeEach
    void setUp() {
        fixture = new TestSchema();
        schema = fixture.schema();
        pool = Executors.newFixedThreadPool(4);
        executor = new QueryExecutor(new ValuesCoercer(schema));
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void whenExecuting_givenSimpleQuery_shouldResolveFields() {
        final ExecutionContext context = context(
                "{ user(id: 1) { id name } }", Map.of());

        final Map<String, Object> data = run(context);

        assertEquals(Map.of("user", Map.of("id", 1, "name", "Ann")), data);
        assertTrue(context.errors().isEmpty());
    }

    @Test
    void whenExecuting_givenAliasesAndFragments_shouldKeepSelectionOrder() {
        final Map<String, Object> data = run(context("""
                { b: hello a: user(id: 2) { ...F name } }
                fragment F on User { role name }
                """, Map.of()));

        assertEquals(List.of("b", "a"), List.copyOf(data.keySet()));
        @SuppressWarnings("unchecked")
        final Map<String, Object> user = (Map<String, Object>) data.get("a");
        assertEquals(List.of("role", "name"), List.copyOf(user.keySet()));
        assertEquals("MEMBER", user.get("role"));
    }

    @Test
    void whenExecuting_givenMissingObject_shouldReturnNullWithoutError() {
        final ExecutionContext context = context(
                "{ user(id: 99) { id } }", Map.of());

        assertEquals(nullEntry("user"), run(context));
        assertTrue(context.errors().isEmpty());
    }

    @Test
    void whenExecuting_givenNullForNonNullField_shouldNullTheParent() {
        final ExecutionContext context = context(
                "{ user(id: 3) { id name } }", Map.of());

        assertEquals(nullEntry("user"), run(context));

        final List<GraphQLError> errors = context.errors().errors();
        assertEquals(1, errors.size());
        assertEquals("Cannot return null for non-nullable field User.id.",
                errors.get(0).message());
        assertEquals(List.of("user", "id"), errors.get(0).path());
        assertEquals(List.of(new SourceLocation(1, 17)),
                errors.get(0).locations());
    }

    @Test
    void whenExecuting_givenNonNullObjectResolvingNull_shouldBubbleUp() {
        final ExecutionContext context = context(
                "{ user(id: 1) { name bestFriend { name } } hello }",
                Map.of());

        final Map<String, Object> data = run(context);

        assertNull(data.get("user"));
        assertEquals("world", data.get("hello"));
        assertEquals(List.of("user", "bestFriend"),
                context.errors().errors().get(0).path());
    }

    @Test
    void whenExecuting_givenNonNullChainToRoot_shouldNullTheData() {
        final ExecutionContext context = context(
                "{ users { bestFriend { id } } }", Map.of());

        assertNull(run(context));

        final List<GraphQLError> errors = context.errors().errors();
        assertEquals(2, errors.size());
        assertEquals(List.of("users", 0, "bestFriend"), errors.get(0).path());
        assertEquals(List.of("users", 1, "bestFriend"), errors.get(1).path());
    }

    @Test
    void whenExecuting_givenFailingListItem_shouldNullOnlyThatItem() {
        final ExecutionContext context = context(
                "{ search { ... on User { bestFriend { id } } } }", Map.of());

        final Map<String, Object> data = run(context);

        assertEquals(Arrays.asList(null, Map.of()), data.get("search"));
        assertEquals(List.of("search", 0, "bestFriend"),
                context.errors().errors().get(0).path());
    }

    @Test
    void whenExecuting_givenFailingResolver_shouldKeepSiblings() {
        final ExecutionContext context = context(
                "{ fail failAsync hello }", Map.of());

        final Map<String, Object> data = run(context);

        assertNull(data.get("fail"));
        assertNull(data.get("failAsync"));
        assertEquals("world", data.get("hello"));

        final List<GraphQLError> errors = context.errors().errors();
        assertEquals(2, errors.size());
        assertEquals("boom", errors.get(0).message());
        assertEquals(List.of("fail"), errors.get(0).path());
        assertEquals("async boom", errors.get(1).message());
    }

    @Test
    void whenExecuting_givenAbstractTypes_shouldResolveRuntimeType() {
        final Map<String, Object> data = run(context("""
                { node(id: 10) { __typename id ... on Post { title } }
                  search { __typename } }
                """, Map.of()));

        assertEquals(Map.of("__typename", "Post", "id", 10, "title", "Hello"),
                data.get("node"));
        assertEquals(List.of(Map.of("__typename", "User"),
                Map.of("__typename", "Post")), data.get("search"));
    }

    @Test
    void whenExecuting_givenVariablesAndDirectives_shouldApplyThem() {
        final Map<String, Object> data = run(context("""
                query ($id: Int!, $hide: Boolean!) {
                  user(id: $id) { name tags @skip(if: $hide) }
                  price @include(if: $hide)
                }
                """, Map.of("id", 1, "hide", false)));

        assertEquals(Map.of("user", Map.of("name", "Ann", "tags",
                List.of("staff"))), data);
    }

    @Test
    void whenExecuting_givenInputObjectArgument_shouldApplyDefaults() {
        final Map<String, Object> data = run(context(
                "{ echo(input: {title: \"t\"}, times: 2) price }", Map.of()));

        assertEquals("{title=t, draft=false}{title=t, draft=false}",
                data.get("echo"));
        assertEquals("10.50", data.get("price"));
    }

    @Test
    void whenExecuting_givenMutation_shouldRunRootFieldsInOrder() {
        final ExecutionContext context = context("""
                mutation {
                  a: slowAppend(value: "1")
                  b: append(value: "2")
                  c: increment(by: 2)
                }
                """, Map.of());

        final Map<String, Object> data = run(context);

        assertEquals(List.of("slowAppend:1", "append:2", "increment"),
                fixture.mutationLog());
        assertEquals(List.of("a", "b", "c"), List.copyOf(data.keySet()));
        assertEquals(2, data.get("c"));
    }

    @Test
    void whenExecuting_givenSubscription_shouldRejectIt() {
        final GraphQLException e = assertThrows(GraphQLException.class,
                () -> executor.execute(context("subscription { hello }",
                        Map.of())));

        assertEquals("SUBSCRIPTION_NOT_SUPPORTED", e.getErrorCode());
    }

    @Test
    void whenExecuting_givenCancelledRequest_shouldAbortPendingFields()
            throws Exception {
        final ExecutionContext context = context("{ slow }", Map.of());

        final CompletableFuture<Map<String, Object>> data =
                executor.execute(context);
        assertTrue(fixture.awaitSlowStarted());
        context.cancel();

        assertEquals(nullEntry("slow"), data.get(1, TimeUnit.SECONDS));
        final GraphQLError error = context.errors().errors().get(0);
        assertEquals(QueryExecutor.ABORTED_MESSAGE, error.message());
        assertEquals("EXECUTION_ABORTED", error.extensions().get("code"));
        assertTrue(context.isCancelled());
    }

    @Test
    void whenExecuting_givenAlreadyCancelledRequest_shouldNotResolve() {
        final ExecutionContext context = context("{ hello }", Map.of());
        context.cancel();

        assertNull(run(context));
        assertEquals(List.of("hello"),
                context.errors().errors().get(0).path());
    }

    @Test
    void whenExecuting_givenNonListForListField_shouldReportIt() {
        final Schema listSchema = Schema.newSchema()
                .query(ObjectType.newObject("Query")
                        .field(FieldDefinition.newField("items", "[Int]")
                                .staticValue(5))
                        .build())
                .build();
        final Document document = Parser.parse("{ items }");
        final ExecutionContext context = ExecutionContext.newContext()
                .schema(listSchema)
                .document(document)
                .operation(document.operations().get(0))
                .executor(pool)
                .build();

        final Map<String, Object> data = new QueryExecutor(
                new ValuesCoercer(listSchema)).execute(context).join();

        assertEquals(nullEntry("items"), data);
        assertEquals("Expected Iterable, but did not find one for field"
                + " Query.items.", context.errors().errors().get(0).message());
    }

    @Test
    void whenExecuting_givenNullSkipConditionInSubselection_shouldNullField() {
        final Map<String, Object> variables = new HashMap<>();
        variables.put("v", null);
        final ExecutionContext context = context(
                "query ($v: Boolean = true) { user(id: 1) { name"
                        + " @skip(if: $v) } hello }", variables);

        final Map<String, Object> data = run(context);

        final Map<String, Object> expected = nullEntry("user");
        expected.put("hello", "world");
        assertEquals(expected, data);

        final List<GraphQLError> errors = context.errors().errors();
        assertEquals(1, errors.size());
        assertEquals("Argument \"if\" of non-null type \"Boolean!\" must not"
                + " be null.", errors.get(0).message());
        assertEquals(List.of("user"), errors.get(0).path());
        assertEquals(List.of(new SourceLocation(1, 30)),
                errors.get(0).locations());
    }

    @Test
    void whenExecuting_givenNullSkipConditionAtRoot_shouldNullData() {
        final Map<String, Object> variables = new HashMap<>();
        variables.put("v", null);
        final ExecutionContext context = context(
                "query ($v: Boolean = true) { hello @skip(if: $v) }",
                variables);

        assertNull(run(context));

        final List<GraphQLError> errors = context.errors().errors();
        assertEquals(1, errors.size());
        assertEquals("Argument \"if\" of non-null type \"Boolean!\" must not"
                + " be null.", errors.get(0).message());
        assertTrue(errors.get(0).path().isEmpty());
        assertEquals(List.of(new SourceLocation(1, 1)),
                errors.get(0).locations());
    }

    private ExecutionContext context(final String query,
            final Map<String, Object> variables) {
        final Document document = Parser.parse(query);
        final OperationDefinition operation = document.operations().get(0);
        return ExecutionContext.newContext()
                .schema(schema)
                .document(document)
                .operation(operation)
                .variables(new ValuesCoercer(schema).coerceVariableValues(
                        operation, variables))
                .executor(pool)
                .build();
    }

    private Map<String, Object> run(final ExecutionContext context) {
        return executor.execute(context).join();
    }

    private static Map<String, Object> nullEntry(final String key) {
        final Map<String, Object> map = new LinkedHashMap<>();
        map.put(key, null);
        return map;
    }
}
