package co.fanki.graphql.execution;

import co.fanki.graphql.shared.GraphQLError;
import co.fanki.graphql.shared.Preconditions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collects the errors of one request. Resolvers running on several
 * threads report here concurrently.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ErrorCollector {

    /** Request errors first, then by path, then by message. */
    static final Comparator<GraphQLError> ORDER =
            Comparator.<GraphQLError, List<Object>>comparing(
                    GraphQLError::path, ErrorCollector::comparePaths)
                    .thenComparing(GraphQLError::message);

    private final List<GraphQLError> errors = new ArrayList<>();

    /**
     * Records an error.
     *
     * @param error the error, cannot be null
     */
    public synchronized void add(final GraphQLError error) {
        Preconditions.requireNonNull(error, "Error is required");
        errors.add(error);
    }

    public synchronized boolean isEmpty() {
        return errors.isEmpty();
    }

    /** Returns a sorted copy of the errors recorded so far. */
    public synchronized List<GraphQLError> errors() {
        final List<GraphQLError> sorted = new ArrayList<>(errors);
        sorted.sort(ORDER);
        return sorted;
    }

    private static int comparePaths(final List<Object> a,
            final List<Object> b) {
        final int common = Math.min(a.size(), b.size());
        for (int i = 0; i < common; i++) {
            final int result = compareSegments(a.get(i), b.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    private static int compareSegments(final Object a, final Object b) {
        if (a instanceof Integer indexA && b instanceof Integer indexB) {
            return Integer.compare(indexA, indexB);
        }
        if (a instanceof Integer) {
            return -1;
        }
        if (b instanceof Integer) {
            return 1;
        }
        return a.toString().compareTo(b.toString());
    }
}
