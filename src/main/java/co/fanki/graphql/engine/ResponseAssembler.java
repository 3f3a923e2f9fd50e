package co.fanki.graphql.engine;

import co.fanki.graphql.shared.GraphQLError;
import co.fanki.graphql.shared.GraphQLException;
import co.fanki.graphql.shared.Preconditions;
import co.fanki.graphql.shared.SourceLocation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders results in the standard response shape:
 * {@code {"errors": [...], "data": {...}}}.
 *
 * <p>{@code errors} is left out when there are none, {@code data} when
 * execution never started. The order of the data fields is kept.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ResponseAssembler {

    private final ObjectMapper objectMapper;

    /** Creates an assembler with a default object mapper. */
    public ResponseAssembler() {
        this(new ObjectMapper());
    }

    /**
     * Creates an assembler.
     *
     * @param theObjectMapper the mapper used by {@link #toJson}
     */
    public ResponseAssembler(final ObjectMapper theObjectMapper) {
        this.objectMapper = Preconditions.requireNonNull(theObjectMapper,
                "Object mapper is required");
    }

    /**
     * Builds the response map of a result.
     *
     * @param result the result, cannot be null
     * @return an ordered map ready to be serialized
     */
    public Map<String, Object> toSpecification(final ExecutionResult result) {
        Preconditions.requireNonNull(result, "Result is required");
        final Map<String, Object> response = new LinkedHashMap<>();
        if (result.hasErrors()) {
            final List<Map<String, Object>> errors = new ArrayList<>();
            for (final GraphQLError error : result.errors()) {
                errors.add(toSpecification(error));
            }
            response.put("errors", errors);
        }
        if (result.dataPresent()) {
            response.put("data", result.data());
        }
        return response;
    }

    /**
     * Serializes a result.
     *
     * @param result the result, cannot be null
     * @return the JSON text
     * @throws GraphQLException if the data holds values Jackson cannot
     *         write
     */
    public String toJson(final ExecutionResult result) {
        try {
            return objectMapper.writeValueAsString(toSpecification(result));
        } catch (final JsonProcessingException e) {
            throw new GraphQLException("Cannot serialize response: "
                    + e.getOriginalMessage(), "SERIALIZATION_FAILED", e);
        }
    }

    private static Map<String, Object> toSpecification(
            final GraphQLError error) {
        final Map<String, Object> map = new LinkedHashMap<>();
        map.put("message", error.message());
        if (!error.locations().isEmpty()) {
            final List<Map<String, Object>> locations = new ArrayList<>();
            for (final SourceLocation location : error.locations()) {
                final Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("line", location.line());
                entry.put("column", location.column());
                locations.add(entry);
            }
            map.put("locations", locations);
        }
        if (error.hasPath()) {
            map.put("path", error.path());
        }
        if (!error.extensions().isEmpty()) {
            map.put("extensions", error.extensions());
        }
        return map;
    }
}
