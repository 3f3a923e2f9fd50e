package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.VariableDefinition;
import co.fanki.graphql.schema.TypeDefinition;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;

/**
 * Variables can only be scalars, enums, input objects or wrappers of
 * them.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class VariablesAreInputTypes extends ValidationRule {

    public VariablesAreInputTypes(final ValidationContext context) {
        super(context);
    }

    @Override
    public void enterVariableDefinition(final VariableDefinition definition) {
        final TypeDefinition type = context().schema().type(definition.type());
        if (type != null && !type.isInput()) {
            report("Variable \"$" + definition.name()
                    + "\" cannot be non-input type \"" + definition.type()
                    + "\".", definition.location());
        }
    }
}
