package co.fanki.graphql.engine;

import co.fanki.graphql.shared.Preconditions;

import java.time.Duration;

/**
 * Limits applied to every request a {@link QueryEngine} runs.
 *
 * @param maxDepth the deepest field nesting allowed, 0 for no limit
 * @param timeout how long a request may run before it is cancelled,
 *                {@link Duration#ZERO} for no limit
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record EngineSettings(int maxDepth, Duration timeout) {

    /** Validates the limits. */
    public EngineSettings {
        Preconditions.requireNonNegative(maxDepth,
                "Max depth cannot be negative");
        Preconditions.requireNonNull(timeout, "Timeout is required");
        Preconditions.require(!timeout.isNegative(),
                "Timeout cannot be negative");
    }

    /** Returns settings with no depth limit and no timeout. */
    public static EngineSettings defaults() {
        return new EngineSettings(0, Duration.ZERO);
    }

    public boolean hasTimeout() {
        return !timeout.isZero();
    }
}
