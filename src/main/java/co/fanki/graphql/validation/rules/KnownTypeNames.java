package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.FragmentDefinition;
import co.fanki.graphql.language.InlineFragment;
import co.fanki.graphql.language.VariableDefinition;
import co.fanki.graphql.shared.SourceLocation;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;

/**
 * Type conditions and variable types name types of the schema.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class KnownTypeNames extends ValidationRule {

    public KnownTypeNames(final ValidationContext context) {
        super(context);
    }

    @Override
    public void enterVariableDefinition(final VariableDefinition definition) {
        check(definition.type().namedType(), definition.location());
    }

    @Override
    public void enterInlineFragment(final InlineFragment fragment) {
        if (fragment.typeCondition() != null) {
            check(fragment.typeCondition(), fragment.location());
        }
    }

    @Override
    public void enterFragmentDefinition(final FragmentDefinition fragment) {
        check(fragment.typeCondition(), fragment.location());
    }

    private void check(final String typeName, final SourceLocation location) {
        if (context().schema().type(typeName) == null) {
            report("Unknown type \"" + typeName + "\".", location);
        }
    }
}
