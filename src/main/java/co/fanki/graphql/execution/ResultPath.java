package co.fanki.graphql.execution;

import co.fanki.graphql.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The position of a value in the response tree: response keys and list
 * indexes from the root.
 *
 * <p>Immutable; every segment shares its parent.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ResultPath {

    private static final ResultPath ROOT = new ResultPath(null, null);

    private final ResultPath parent;
    private final Object segment;

    private ResultPath(final ResultPath theParent, final Object theSegment) {
        this.parent = theParent;
        this.segment = theSegment;
    }

    /** Returns the empty path. */
    public static ResultPath root() {
        return ROOT;
    }

    /**
     * Appends a response key.
     *
     * @param key the response key, cannot be blank
     * @return the new path
     */
    public ResultPath key(final String key) {
        Preconditions.requireNonBlank(key, "Key is required");
        return new ResultPath(this, key);
    }

    /**
     * Appends a list index.
     *
     * @param index the index, zero based
     * @return the new path
     */
    public ResultPath index(final int index) {
        Preconditions.requireNonNegative(index, "Index cannot be negative");
        return new ResultPath(this, index);
    }

    public boolean isRoot() {
        return parent == null;
    }

    /** Returns the segments from the root, strings and integers. */
    public List<Object> toList() {
        final List<Object> segments = new ArrayList<>();
        for (ResultPath current = this; !current.isRoot();
                current = current.parent) {
            segments.add(current.segment);
        }
        Collections.reverse(segments);
        return segments;
    }

    @Override
    public String toString() {
        if (isRoot()) {
            return "/";
        }
        final StringBuilder text = new StringBuilder();
        for (final Object item : toList()) {
            text.append('/').append(item);
        }
        return text.toString();
    }
}
