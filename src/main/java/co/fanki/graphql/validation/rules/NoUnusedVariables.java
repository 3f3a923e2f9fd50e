package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.OperationDefinition;
import co.fanki.graphql.language.VariableDefinition;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;
import co.fanki.graphql.validation.VariableUsage;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Every variable an operation defines is used.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class NoUnusedVariables extends ValidationRule {

    public NoUnusedVariables(final ValidationContext context) {
        super(context);
    }

    @Override
    public void leaveOperation(final OperationDefinition operation) {
        final Set<String> used = context().recursiveVariableUsages(operation)
                .stream()
                .map(VariableUsage::name)
                .collect(Collectors.toSet());
        for (final VariableDefinition definition
                : operation.variableDefinitions()) {
            if (!used.contains(definition.name())) {
                report(operation.isAnonymous()
                        ? "Variable \"$" + definition.name()
                                + "\" is never used."
                        : "Variable \"$" + definition.name()
                                + "\" is never used in operation \""
                                + operation.name() + "\".",
                        definition.location());
            }
        }
    }
}
