package co.fanki.graphql.language;

import co.fanki.graphql.shared.SourceLocation;

import java.util.List;

/**
 * One entry of a selection set: a field, a fragment spread or an
 * inline fragment.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface Selection {

    /** Returns the directives applied to the selection. */
    List<Directive> directives();

    /** Returns where the selection starts. */
    SourceLocation location();
}
