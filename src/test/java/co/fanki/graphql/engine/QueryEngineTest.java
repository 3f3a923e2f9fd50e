package co.fanki.graphql.engine;

import co.fanki.graphql.TestSchema;
import co.fanki.graphql.execution.QueryExecutor;
import co.fanki.graphql.language.Parser;
import co.fanki.graphql.schema.CacheControl;
import co.fanki.graphql.shared.GraphQLError;
import co.fanki.graphql.shared.GraphQLException;
import co.fanki.graphql.shared.SourceLocation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.getCurrentArguments;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link QueryEngine}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class QueryEngineTest {

    private TestSchema fixture;
    private ExecutorService pool;
    private QueryEngine engine;

    @BeforeEach
    void setUp() {
        fixture = new TestSchema();
        pool = Executors.newFixedThreadPool(4);
        engine = new QueryEngine(fixture.schema(), pool,
                EngineSettings.defaults());
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void whenExecuting_givenValidQuery_shouldReturnData() {
        final ExecutionResult result = engine.execute(ExecutionRequest.of(
                "{ hello user(id: 2) { name } }"));

        assertTrue(result.dataPresent());
        assertFalse(result.hasErrors());
        assertEquals(Map.of("hello", "world", "user", Map.of("name", "Bob")),
                result.data());
    }

    @Test
    void whenExecutingAsync_givenValidQuery_shouldCompleteWithData()
            throws Exception {
        final CompletableFuture<ExecutionResult> future = engine.executeAsync(
                ExecutionRequest.of("{ user(id: 1) { id name } }"));

        final ExecutionResult result = future.get(5, TimeUnit.SECONDS);

        assertFalse(result.hasErrors());
        assertEquals(Map.of("user", Map.of("id", 1, "name", "Ann")),
                result.data());
    }

    @Test
    void whenExecutingAsync_givenSyntaxError_shouldCompleteRejected() {
        final ExecutionResult result = engine.executeAsync(
                ExecutionRequest.of("{ hello")).join();

        assertFalse(result.dataPresent());
        assertEquals(1, result.errors().size());
    }

    @Test
    void whenExecuting_givenSyntaxError_shouldRejectWithoutData() {
        final ExecutionResult result = engine.execute(
                ExecutionRequest.of("{ hello"));

        assertFalse(result.dataPresent());
        final GraphQLError error = result.errors().get(0);
        assertEquals("Syntax Error: Expected Name, found <EOF>.",
                error.message());
        assertEquals(List.of(new SourceLocation(1, 8)), error.locations());
        assertEquals("PARSE_ERROR", error.extensions().get("code"));
    }

    @Test
    void whenExecuting_givenInvalidDocument_shouldReturnAllValidationErrors() {
        final ExecutionResult result = engine.execute(ExecutionRequest.of(
                "{ nope user { id } }"));

        assertFalse(result.dataPresent());
        assertEquals(2, result.errors().size());
        assertEquals("GRAPHQL_VALIDATION_FAILED",
                result.errors().get(0).extensions().get("code"));
        assertEquals("Cannot query field \"nope\" on type \"Query\".",
                result.errors().get(0).message());
    }

    @Test
    void whenExecuting_givenSeveralOperations_shouldRequireAName() {
        final ExecutionRequest request = ExecutionRequest.of(
                "query A { hello } query B { price }");

        final ExecutionResult unnamed = engine.execute(request);
        assertEquals("Must provide operation name if query contains multiple"
                + " operations.", unnamed.errors().get(0).message());
        assertEquals("OPERATION_RESOLUTION_FAILURE",
                unnamed.errors().get(0).extensions().get("code"));

        assertEquals(Map.of("price", "10.50"),
                engine.execute(request.withOperationName("B")).data());

        assertEquals("Unknown operation named \"C\".", engine.execute(
                request.withOperationName("C")).errors().get(0).message());
    }

    @Test
    void whenExecuting_givenNaNForIntVariable_shouldRejectWithoutData() {
        final ExecutionResult result = engine.executeAsync(ExecutionRequest.of(
                "query ($v: Int!) { user(id: $v) { name } }")
                .withVariables(Map.of("v", Double.NaN))).join();

        assertFalse(result.dataPresent());
        final GraphQLError error = result.errors().get(0);
        assertTrue(error.message().startsWith("Variable \"$v\" got invalid"
                + " value"), error.message());
        assertTrue(error.message().endsWith("Int cannot represent"
                + " non-integer value: NaN"), error.message());
        assertEquals("BAD_USER_INPUT", error.extensions().get("code"));
    }

    @Test
    void whenExecuting_givenNullDirectiveConditionAtRoot_shouldReturnNullData() {
        final Map<String, Object> variables = new HashMap<>();
        variables.put("v", null);

        final ExecutionResult result = engine.execute(ExecutionRequest.of(
                "query ($v: Boolean = true) { hello @skip(if: $v) }")
                .withVariables(variables));

        assertTrue(result.dataPresent());
        assertNull(result.data());
        assertEquals(1, result.errors().size());
        assertEquals(List.of(new SourceLocation(1, 1)),
                result.errors().get(0).locations());
    }

    @Test
    void whenExecuting_givenNullDirectiveConditionInSubselection_shouldKeepSiblings() {
        final Map<String, Object> variables = new HashMap<>();
        variables.put("v", null);

        final ExecutionResult result = engine.execute(ExecutionRequest.of(
                "query ($v: Boolean = true) { user(id: 1) { name"
                        + " @skip(if: $v) } hello }")
                .withVariables(variables));

        assertTrue(result.dataPresent());
        assertNull(result.data().get("user"));
        assertEquals("world", result.data().get("hello"));
        assertEquals(List.of("user"), result.errors().get(0).path());
    }

    @Test
    void whenExecuting_givenMissingVariable_shouldRejectWithLocation() {
        final ExecutionResult result = engine.execute(ExecutionRequest.of(
                "query ($id: Int!) { user(id: $id) { name } }"));

        assertFalse(result.dataPresent());
        final GraphQLError error = result.errors().get(0);
        assertEquals("Variable \"$id\" of required type \"Int!\" was not"
                + " provided.", error.message());
        assertEquals(List.of(new SourceLocation(1, 8)), error.locations());
        assertEquals("BAD_USER_INPUT", error.extensions().get("code"));
    }

    @Test
    void whenExecuting_givenVariables_shouldCoerceThem() {
        final ExecutionResult result = engine.execute(ExecutionRequest.of(
                "query ($id: Int!) { user(id: $id) { name } }")
                .withVariables(Map.of("id", 1)));

        assertEquals(Map.of("user", Map.of("name", "Ann")), result.data());
    }

    @Test
    void whenExecuting_givenFieldError_shouldReturnPartialData() {
        final ExecutionResult result = engine.execute(ExecutionRequest.of(
                "{ fail hello }"));

        assertTrue(result.dataPresent());
        assertNull(result.data().get("fail"));
        assertEquals("world", result.data().get("hello"));
        assertEquals(List.of("fail"), result.errors().get(0).path());
    }

    @Test
    void whenExecuting_givenCacheHints_shouldReportMergedPolicy() {
        final ExecutionResult result = engine.execute(ExecutionRequest.of(
                "{ posts { title } }"));

        assertEquals(CacheControl.privateFor(30), result.cacheControl());
        assertEquals(CacheControl.DEFAULT, engine.execute(
                ExecutionRequest.of("{ hello }")).cacheControl());
    }

    @Test
    void whenExecuting_givenTimeout_shouldAbortSlowFields() {
        final ExecutionResult result = engine.execute(ExecutionRequest.of(
                "{ slow }").withTimeout(Duration.ofMillis(50)));

        assertTrue(result.dataPresent());
        assertNull(result.data().get("slow"));
        assertEquals(QueryExecutor.ABORTED_MESSAGE,
                result.errors().get(0).message());
    }

    @Test
    void whenExecuting_givenEngineTimeout_shouldApplyItByDefault() {
        final QueryEngine bounded = new QueryEngine(fixture.schema(), pool,
                new EngineSettings(0, Duration.ofMillis(50)));

        final ExecutionResult result = bounded.execute(
                ExecutionRequest.of("{ slow }"));

        assertEquals("EXECUTION_ABORTED",
                result.errors().get(0).extensions().get("code"));
    }

    @Test
    void whenExecuting_givenDepthLimit_shouldRejectDeepQueries() {
        final QueryEngine bounded = new QueryEngine(fixture.schema(), pool,
                new EngineSettings(2, Duration.ZERO));

        final ExecutionResult result = bounded.execute(ExecutionRequest.of(
                "{ user(id: 1) { friends { name } } }"));

        assertFalse(result.dataPresent());
        assertEquals("Query depth 3 exceeds the maximum allowed depth of 2.",
                result.errors().get(0).message());
    }

    @Test
    void whenExecuting_givenSubscription_shouldRejectIt() {
        final ExecutionResult result = engine.execute(ExecutionRequest.of(
                "subscription { hello }"));

        assertFalse(result.dataPresent());
        assertEquals("SUBSCRIPTION_NOT_SUPPORTED",
                result.errors().get(0).extensions().get("code"));
    }

    @Test
    void whenExecuting_givenMutation_shouldRunSerially() {
        final ExecutionResult result = engine.execute(ExecutionRequest.of(
                "mutation { first: increment second: increment(by: 5) }"));

        assertEquals(Map.of("first", 1, "second", 6), result.data());
    }

    @Test
    void whenExecuting_givenCustomResolvers_shouldUseTheEngineExecutor() {
        final Executor executor = createMock(Executor.class);
        executor.execute(anyObject(Runnable.class));
        expectLastCall().andAnswer(() -> {
            ((Runnable) getCurrentArguments()[0]).run();
            return null;
        }).times(2);
        replay(executor);

        final ExecutionResult result = new QueryEngine(fixture.schema(),
                executor, EngineSettings.defaults()).execute(
                        ExecutionRequest.of("{ hello price }"));

        assertEquals(Map.of("hello", "world", "price", "10.50"),
                result.data());
        verify(executor);
    }

    @Test
    void whenCreating_givenNoSchema_shouldFail() {
        assertThrows(IllegalArgumentException.class,
                () -> new QueryEngine(null, pool, EngineSettings.defaults()));
    }

    @Test
    void whenSelectingOperation_givenEmptyName_shouldUseTheOnlyOne() {
        assertEquals("A", QueryEngine.selectOperation(
                Parser.parse("query A { hello }"),
                " ").name());
        assertThrows(GraphQLException.class, () -> QueryEngine
                .selectOperation(Parser.parse(
                        "query A { hello } query B { hello }"), null));
    }
}
