package co.fanki.graphql.engine;

import co.fanki.graphql.schema.CacheControl;
import co.fanki.graphql.shared.GraphQLError;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The outcome of a request.
 *
 * @param data the response data; null when execution did not start or
 *             an error reached the root
 * @param dataPresent whether execution started, so {@code data} belongs
 *                    in the response even when null
 * @param errors the errors, in deterministic order
 * @param cacheControl the cache policy of the response
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ExecutionResult(
        Map<String, Object> data,
        boolean dataPresent,
        List<GraphQLError> errors,
        CacheControl cacheControl) {

    /** Copies the errors and defaults the cache policy. */
    public ExecutionResult {
        data = data == null
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        errors = errors == null ? List.of() : List.copyOf(errors);
        cacheControl = cacheControl == null
                ? CacheControl.DEFAULT
                : cacheControl;
    }

    /**
     * Creates the result of an executed operation.
     *
     * @param data the data, null after an error reached the root
     * @param errors the field errors
     * @param cacheControl the cache policy
     * @return the result
     */
    public static ExecutionResult executed(final Map<String, Object> data,
            final List<GraphQLError> errors, final CacheControl cacheControl) {
        return new ExecutionResult(data, true, errors, cacheControl);
    }

    /**
     * Creates the result of a request rejected before execution.
     *
     * @param errors the reasons
     * @return the result, without data
     */
    public static ExecutionResult rejected(final List<GraphQLError> errors) {
        return new ExecutionResult(null, false, errors, CacheControl.DEFAULT);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
