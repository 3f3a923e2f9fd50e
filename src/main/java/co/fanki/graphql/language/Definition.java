package co.fanki.graphql.language;

import co.fanki.graphql.shared.SourceLocation;

import java.util.List;

/**
 * A top level definition of a document: an operation or a fragment.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface Definition {

    /** Returns where the definition starts. */
    SourceLocation location();

    /** Returns the definition's selection set. */
    SelectionSet selectionSet();

    /** Returns the directives applied to the definition. */
    List<Directive> directives();
}
