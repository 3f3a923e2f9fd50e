package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.OperationDefinition;
import co.fanki.graphql.language.TypeRef;
import co.fanki.graphql.language.Value;
import co.fanki.graphql.language.VariableDefinition;
import co.fanki.graphql.schema.Schema;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;
import co.fanki.graphql.validation.VariableUsage;

/**
 * Variables are only used where their type is accepted.
 *
 * <p>A nullable variable with a non-null default counts as non-null.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class VariablesInAllowedPosition extends ValidationRule {

    public VariablesInAllowedPosition(final ValidationContext context) {
        super(context);
    }

    @Override
    public void leaveOperation(final OperationDefinition operation) {
        final Schema schema = context().schema();
        for (final VariableUsage usage
                : context().recursiveVariableUsages(operation)) {
            final VariableDefinition definition =
                    operation.variableDefinition(usage.name());
            if (definition == null || usage.type() == null
                    || schema.type(definition.type()) == null) {
                continue;
            }
            final TypeRef effective = effectiveType(definition);
            if (!schema.isSubType(effective, usage.type())) {
                report("Variable \"$" + usage.name() + "\" of type \""
                        + definition.type() + "\" used in position expecting"
                        + " type \"" + usage.type() + "\".",
                        definition.location(), usage.location());
            }
        }
    }

    private static TypeRef effectiveType(final VariableDefinition definition) {
        final boolean hasNonNullDefault = definition.defaultValue() != null
                && !(definition.defaultValue() instanceof Value.NullValue);
        if (hasNonNullDefault && !definition.type().isNonNull()) {
            return TypeRef.nonNull(definition.type());
        }
        return definition.type();
    }
}
