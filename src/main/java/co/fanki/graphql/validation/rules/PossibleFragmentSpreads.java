package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.FragmentDefinition;
import co.fanki.graphql.language.FragmentSpread;
import co.fanki.graphql.language.InlineFragment;
import co.fanki.graphql.schema.TypeDefinition;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;

/**
 * A fragment is only spread where its type condition can match.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PossibleFragmentSpreads extends ValidationRule {

    public PossibleFragmentSpreads(final ValidationContext context) {
        super(context);
    }

    @Override
    public void enterInlineFragment(final InlineFragment fragment) {
        if (fragment.typeCondition() == null) {
            return;
        }
        final TypeDefinition parent = typeInfo().parentType();
        final TypeDefinition condition = composite(fragment.typeCondition());
        if (parent != null && condition != null
                && !context().schema().typesOverlap(condition, parent)) {
            report("Fragment cannot be spread here as objects of type \""
                    + parent.name() + "\" can never be of type \""
                    + condition.name() + "\".", fragment.location());
        }
    }

    @Override
    public void enterFragmentSpread(final FragmentSpread spread) {
        final FragmentDefinition fragment = context().fragment(spread.name());
        if (fragment == null) {
            return;
        }
        final TypeDefinition parent = typeInfo().parentType();
        final TypeDefinition condition = composite(fragment.typeCondition());
        if (parent != null && condition != null
                && !context().schema().typesOverlap(condition, parent)) {
            report("Fragment \"" + spread.name() + "\" cannot be spread here"
                    + " as objects of type \"" + parent.name()
                    + "\" can never be of type \"" + condition.name() + "\".",
                    spread.location());
        }
    }

    private TypeDefinition composite(final String typeName) {
        final TypeDefinition type = context().schema().type(typeName);
        return type != null && type.isComposite() ? type : null;
    }
}
