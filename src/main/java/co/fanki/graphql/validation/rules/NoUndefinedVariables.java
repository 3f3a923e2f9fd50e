package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.OperationDefinition;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;
import co.fanki.graphql.validation.VariableUsage;

import java.util.HashSet;
import java.util.Set;

/**
 * Every variable an operation uses, through its fragments included, is
 * defined by the operation.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class NoUndefinedVariables extends ValidationRule {

    public NoUndefinedVariables(final ValidationContext context) {
        super(context);
    }

    @Override
    public void leaveOperation(final OperationDefinition operation) {
        final Set<String> reported = new HashSet<>();
        for (final VariableUsage usage
                : context().recursiveVariableUsages(operation)) {
            if (operation.variableDefinition(usage.name()) == null
                    && reported.add(usage.name())) {
                report(operation.isAnonymous()
                        ? "Variable \"$" + usage.name() + "\" is not defined."
                        : "Variable \"$" + usage.name()
                                + "\" is not defined by operation \""
                                + operation.name() + "\".",
                        usage.location(), operation.location());
            }
        }
    }
}
