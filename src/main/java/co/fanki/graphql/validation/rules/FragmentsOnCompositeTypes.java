package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.FragmentDefinition;
import co.fanki.graphql.language.InlineFragment;
import co.fanki.graphql.schema.TypeDefinition;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;

/**
 * Fragments can only condition on objects, interfaces and unions.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FragmentsOnCompositeTypes extends ValidationRule {

    public FragmentsOnCompositeTypes(final ValidationContext context) {
        super(context);
    }

    @Override
    public void enterInlineFragment(final InlineFragment fragment) {
        if (fragment.typeCondition() != null
                && isNotComposite(fragment.typeCondition())) {
            report("Fragment cannot condition on non composite type \""
                    + fragment.typeCondition() + "\".", fragment.location());
        }
    }

    @Override
    public void enterFragmentDefinition(final FragmentDefinition fragment) {
        if (isNotComposite(fragment.typeCondition())) {
            report("Fragment \"" + fragment.name()
                    + "\" cannot condition on non composite type \""
                    + fragment.typeCondition() + "\".", fragment.location());
        }
    }

    /** Unknown types are reported by {@link KnownTypeNames}. */
    private boolean isNotComposite(final String typeName) {
        final TypeDefinition type = context().schema().type(typeName);
        return type != null && !type.isComposite();
    }
}
