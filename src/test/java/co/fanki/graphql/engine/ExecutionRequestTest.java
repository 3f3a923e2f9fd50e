package co.fanki.graphql.engine;

import co.fanki.graphql.shared.GraphQLException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link ExecutionRequest}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ExecutionRequestTest {

    @Test
    void whenReadingJson_givenFullBody_shouldMapEveryMember() {
        final ExecutionRequest request = ExecutionRequest.fromJson("""
                {"query": "query Q($ids: [Int]) { hello }",
                 "operationName": "Q",
                 "variables": {"ids": [1, 2], "filter": {"q": "x"}}}
                """);

        assertEquals("query Q($ids: [Int]) { hello }", request.query());
        assertEquals("Q", request.operationName());
        assertEquals(List.of(1, 2), request.variables().get("ids"));
        assertEquals(Map.of("q", "x"), request.variables().get("filter"));
    }

    @Test
    void whenReadingJson_givenNullMembers_shouldUseDefaults() {
        final ExecutionRequest request = ExecutionRequest.fromJson(
                "{\"query\": \"{ hello }\", \"operationName\": null,"
                        + " \"variables\": null}");

        assertNull(request.operationName());
        assertEquals(Map.of(), request.variables());
    }

    @Test
    void whenReadingJson_givenMalformedBody_shouldFailAsBadRequest() {
        final GraphQLException e = assertThrows(GraphQLException.class,
                () -> ExecutionRequest.fromJson("{\"query\": "));

        assertEquals("BAD_REQUEST", e.getErrorCode());
    }

    @Test
    void whenReadingJson_givenMissingQuery_shouldFail() {
        final GraphQLException e = assertThrows(GraphQLException.class,
                () -> ExecutionRequest.fromJson("{\"variables\": {}}"));

        assertEquals("Request must contain a \"query\" string.",
                e.getMessage());
    }

    @Test
    void whenReadingJson_givenNonObjectVariables_shouldFail() {
        final GraphQLException e = assertThrows(GraphQLException.class,
                () -> ExecutionRequest.fromJson(
                        "{\"query\": \"{ a }\", \"variables\": [1]}"));

        assertEquals("Request variables must be a JSON object.",
                e.getMessage());
    }

    @Test
    void whenCopying_givenWithers_shouldKeepOtherMembers() {
        final ExecutionRequest request = ExecutionRequest.of("{ hello }")
                .withOperationName("Q")
                .withVariables(Map.of("a", 1))
                .withContext("ctx")
                .withTimeout(Duration.ofSeconds(1));

        assertEquals("Q", request.operationName());
        assertEquals(Map.of("a", 1), request.variables());
        assertEquals("ctx", request.context());
        assertEquals(Duration.ofSeconds(1), request.timeout());
        assertEquals("{ hello }", request.query());
    }
}
