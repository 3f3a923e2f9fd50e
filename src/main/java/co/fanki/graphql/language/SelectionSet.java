package co.fanki.graphql.language;

import java.util.List;

/**
 * The selections requested at one level of the response tree.
 *
 * @param selections the selections, in document order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SelectionSet(List<Selection> selections) {

    /** Copies the selections. */
    public SelectionSet {
        selections = List.copyOf(selections);
    }
}
