package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.Field;
import co.fanki.graphql.language.FragmentDefinition;
import co.fanki.graphql.language.FragmentSpread;
import co.fanki.graphql.language.InlineFragment;
import co.fanki.graphql.language.OperationDefinition;
import co.fanki.graphql.language.Selection;
import co.fanki.graphql.language.SelectionSet;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;

import java.util.HashSet;
import java.util.Set;

/**
 * Rejects operations whose fields nest deeper than a limit.
 *
 * <p>Top-level fields are at depth 1. Fragments count as if inlined. A
 * limit of zero or less disables the rule.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class MaxDepth extends ValidationRule {

    private final int limit;

    /**
     * Creates the rule.
     *
     * @param context the validation context
     * @param theLimit the deepest nesting allowed, or 0 for no limit
     */
    public MaxDepth(final ValidationContext context, final int theLimit) {
        super(context);
        this.limit = theLimit;
    }

    @Override
    public void enterOperation(final OperationDefinition operation) {
        if (limit <= 0) {
            return;
        }
        final int depth = depth(operation.selectionSet(), 1, new HashSet<>());
        if (depth > limit) {
            report("Query depth " + depth + " exceeds the maximum allowed"
                    + " depth of " + limit + ".", operation.location());
        }
    }

    private int depth(final SelectionSet selectionSet, final int current,
            final Set<String> expanding) {
        int deepest = current - 1;
        for (final Selection selection : selectionSet.selections()) {
            if (selection instanceof Field field) {
                deepest = Math.max(deepest, field.hasSelectionSet()
                        ? depth(field.selectionSet(), current + 1, expanding)
                        : current);
            } else if (selection instanceof InlineFragment inline) {
                deepest = Math.max(deepest,
                        depth(inline.selectionSet(), current, expanding));
            } else {
                final FragmentSpread spread = (FragmentSpread) selection;
                final FragmentDefinition fragment =
                        context().fragment(spread.name());
                if (fragment != null && expanding.add(spread.name())) {
                    deepest = Math.max(deepest,
                            depth(fragment.selectionSet(), current, expanding));
                    expanding.remove(spread.name());
                }
            }
        }
        return deepest;
    }
}
