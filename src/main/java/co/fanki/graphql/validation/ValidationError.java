package co.fanki.graphql.validation;

import co.fanki.graphql.shared.GraphQLError;
import co.fanki.graphql.shared.Preconditions;
import co.fanki.graphql.shared.SourceLocation;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * A document violating a validation rule.
 *
 * @param rule the name of the violated rule, e.g. {@code ScalarLeafs}
 * @param message the human readable message
 * @param locations the offending nodes
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ValidationError(
        String rule,
        String message,
        List<SourceLocation> locations) {

    /** Orders errors by position, then rule, then message. Total. */
    public static final Comparator<ValidationError> ORDER =
            Comparator.comparingInt(ValidationError::line)
                    .thenComparingInt(ValidationError::column)
                    .thenComparing(ValidationError::rule)
                    .thenComparing(ValidationError::message)
                    .thenComparing(error -> error.locations().toString());

    /** Validates and copies the fields. */
    public ValidationError {
        Preconditions.requireNonBlank(rule, "Rule is required");
        Preconditions.requireNonNull(message, "Message is required");
        locations = locations == null ? List.of() : List.copyOf(locations);
    }

    /**
     * Converts this error into a response error.
     *
     * @return the error, with {@code extensions.code} set to
     *         {@code GRAPHQL_VALIDATION_FAILED}
     */
    public GraphQLError toGraphQLError() {
        return new GraphQLError(message, locations, List.of(),
                Map.of("code", "GRAPHQL_VALIDATION_FAILED", "rule", rule));
    }

    private int line() {
        return locations.isEmpty() ? 0 : locations.get(0).line();
    }

    private int column() {
        return locations.isEmpty() ? 0 : locations.get(0).column();
    }
}
