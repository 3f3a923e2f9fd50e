package co.fanki.graphql.schema;

/**
 * Cache hints attached to object types and fields.
 *
 * <p>The hints of every field selected by an operation are merged into
 * the cache policy of the whole response: it is public only if every
 * hint is public, and it lives as long as the shortest non-zero
 * {@code maxAge}.</p>
 *
 * @param isPublic whether shared caches may store the response
 * @param maxAge the number of seconds the response stays fresh, 0 for
 *               no caching
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CacheControl(boolean isPublic, int maxAge) {

    /** Public, not cached. The neutral element of {@link #merge}. */
    public static final CacheControl DEFAULT = new CacheControl(true, 0);

    /** Validates the age. */
    public CacheControl {
        if (maxAge < 0) {
            throw new IllegalArgumentException(
                    "maxAge cannot be negative: " + maxAge);
        }
    }

    /**
     * Creates a public hint.
     *
     * @param maxAge the max age in seconds
     * @return the hint
     */
    public static CacheControl publicFor(final int maxAge) {
        return new CacheControl(true, maxAge);
    }

    /**
     * Creates a private hint.
     *
     * @param maxAge the max age in seconds
     * @return the hint
     */
    public static CacheControl privateFor(final int maxAge) {
        return new CacheControl(false, maxAge);
    }

    /**
     * Combines this hint with another one.
     *
     * @param other the other hint, may be null
     * @return the merged hint
     */
    public CacheControl merge(final CacheControl other) {
        if (other == null) {
            return this;
        }
        final int age;
        if (maxAge == 0) {
            age = other.maxAge;
        } else if (other.maxAge == 0) {
            age = maxAge;
        } else {
            age = Math.min(maxAge, other.maxAge);
        }
        return new CacheControl(isPublic && other.isPublic, age);
    }

    /**
     * Renders the value of a {@code Cache-Control} header.
     *
     * @return e.g. {@code max-age=60, private}, or null when nothing
     *         should be cached
     */
    public String headerValue() {
        if (maxAge == 0) {
            return null;
        }
        return isPublic ? "max-age=" + maxAge : "max-age=" + maxAge + ", private";
    }
}
