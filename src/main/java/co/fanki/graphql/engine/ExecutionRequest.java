package co.fanki.graphql.engine;

import co.fanki.graphql.shared.GraphQLException;
import co.fanki.graphql.shared.Preconditions;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.Map;

/**
 * A request to execute a document.
 *
 * @param query the document text
 * @param operationName the operation to run, null when the document
 *                      holds a single operation
 * @param variables the JSON-like variable inputs, never null
 * @param rootValue the value the root fields resolve against, may be null
 * @param context the host context handed to resolvers, may be null
 * @param timeout the deadline of this request, null to use the engine's
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ExecutionRequest(
        String query,
        String operationName,
        Map<String, Object> variables,
        Object rootValue,
        Object context,
        Duration timeout) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final TypeReference<Map<String, Object>> VARIABLES =
            new TypeReference<>() { };

    /** Validates the request. */
    public ExecutionRequest {
        Preconditions.requireNonNull(query, "Query is required");
        variables = variables == null ? Map.of() : variables;
    }

    /**
     * Creates a request with just a document.
     *
     * @param query the document text
     * @return the request
     */
    public static ExecutionRequest of(final String query) {
        return new ExecutionRequest(query, null, null, null, null, null);
    }

    /**
     * Reads a {@code {"query", "operationName", "variables"}} body.
     *
     * @param body the JSON text, cannot be null
     * @return the request
     * @throws GraphQLException if the body is not a valid request
     */
    public static ExecutionRequest fromJson(final String body) {
        Preconditions.requireNonNull(body, "Body is required");
        try {
            final JsonNode root = MAPPER.readTree(body);
            if (root == null || !root.isObject()) {
                throw new GraphQLException("Request body must be a JSON"
                        + " object.", "BAD_REQUEST");
            }
            final JsonNode query = root.get("query");
            if (query == null || !query.isTextual()) {
                throw new GraphQLException("Request must contain a \"query\""
                        + " string.", "BAD_REQUEST");
            }
            final JsonNode operationName = root.get("operationName");
            final JsonNode variables = root.get("variables");
            return new ExecutionRequest(query.asText(),
                    operationName == null || operationName.isNull()
                            ? null
                            : operationName.asText(),
                    variables == null || variables.isNull()
                            ? null
                            : MAPPER.convertValue(variables, VARIABLES),
                    null, null, null);
        } catch (final JsonProcessingException e) {
            throw new GraphQLException("Request body is not valid JSON: "
                    + e.getOriginalMessage(), "BAD_REQUEST", e);
        } catch (final IllegalArgumentException e) {
            throw new GraphQLException("Request variables must be a JSON"
                    + " object.", "BAD_REQUEST", e);
        }
    }

    /** Returns a copy with the given operation name. */
    public ExecutionRequest withOperationName(final String name) {
        return new ExecutionRequest(query, name, variables, rootValue,
                context, timeout);
    }

    /** Returns a copy with the given variables. */
    public ExecutionRequest withVariables(
            final Map<String, Object> theVariables) {
        return new ExecutionRequest(query, operationName, theVariables,
                rootValue, context, timeout);
    }

    /** Returns a copy with the given root value. */
    public ExecutionRequest withRootValue(final Object theRootValue) {
        return new ExecutionRequest(query, operationName, variables,
                theRootValue, context, timeout);
    }

    /** Returns a copy with the given host context. */
    public ExecutionRequest withContext(final Object theContext) {
        return new ExecutionRequest(query, operationName, variables,
                rootValue, theContext, timeout);
    }

    /** Returns a copy with the given deadline. */
    public ExecutionRequest withTimeout(final Duration theTimeout) {
        return new ExecutionRequest(query, operationName, variables,
                rootValue, context, theTimeout);
    }
}
