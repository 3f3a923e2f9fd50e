package co.fanki.graphql.shared;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An error descriptor as reported in the {@code errors} member of a
 * response.
 *
 * @param message the human readable message
 * @param locations the document locations the error refers to
 * @param path the response path (keys and list indexes), empty for
 *             request level errors
 * @param extensions additional members, such as {@code code}
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphQLError(
        String message,
        List<SourceLocation> locations,
        List<Object> path,
        Map<String, Object> extensions) {

    /** Copies the collections so the error stays immutable. */
    public GraphQLError {
        Preconditions.requireNonNull(message, "Message is required");
        locations = locations == null ? List.of() : List.copyOf(locations);
        path = path == null ? List.of() : List.copyOf(path);
        extensions = extensions == null
                ? Map.of()
                : Collections.unmodifiableMap(
                        new LinkedHashMap<>(extensions));
    }

    /**
     * Creates a request level error, with no path.
     *
     * @param message the message
     * @param code the error code placed under {@code extensions.code}
     * @param locations the locations, may be empty
     * @return the error
     */
    public static GraphQLError requestError(final String message,
            final String code, final List<SourceLocation> locations) {
        return new GraphQLError(message, locations, List.of(),
                Map.of("code", code));
    }

    /**
     * Creates a request level error from an engine exception.
     *
     * @param e the exception
     * @param locations the locations, may be empty
     * @return the error
     */
    public static GraphQLError fromException(final GraphQLException e,
            final List<SourceLocation> locations) {
        return requestError(e.getMessage(), e.getErrorCode(), locations);
    }

    /** Returns true if this error is bound to a response path. */
    public boolean hasPath() {
        return !path.isEmpty();
    }
}
