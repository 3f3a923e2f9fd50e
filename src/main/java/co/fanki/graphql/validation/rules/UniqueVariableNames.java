package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.OperationDefinition;
import co.fanki.graphql.language.VariableDefinition;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;

import java.util.HashMap;
import java.util.Map;

/**
 * Variable names are unique within an operation.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class UniqueVariableNames extends ValidationRule {

    public UniqueVariableNames(final ValidationContext context) {
        super(context);
    }

    @Override
    public void enterOperation(final OperationDefinition operation) {
        final Map<String, VariableDefinition> known = new HashMap<>();
        for (final VariableDefinition definition
                : operation.variableDefinitions()) {
            final VariableDefinition first = known.putIfAbsent(
                    definition.name(), definition);
            if (first != null) {
                report("There can be only one variable named \"$"
                        + definition.name() + "\".",
                        first.location(), definition.location());
            }
        }
    }
}
