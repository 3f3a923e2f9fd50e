package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.Argument;
import co.fanki.graphql.language.Printer;
import co.fanki.graphql.language.TypeRef;
import co.fanki.graphql.language.Value;
import co.fanki.graphql.language.VariableDefinition;
import co.fanki.graphql.schema.ArgumentDefinition;
import co.fanki.graphql.schema.CoercingException;
import co.fanki.graphql.schema.EnumType;
import co.fanki.graphql.schema.InputObjectType;
import co.fanki.graphql.schema.ScalarType;
import co.fanki.graphql.schema.TypeDefinition;
import co.fanki.graphql.shared.SourceLocation;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;

import java.util.Map;

/**
 * Literal values of arguments and variable defaults are accepted by the
 * type expected at their position.
 *
 * <p>Variables inside literals are not checked here, see
 * {@link VariablesInAllowedPosition}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ValuesOfCorrectType extends ValidationRule {

    public ValuesOfCorrectType(final ValidationContext context) {
        super(context);
    }

    @Override
    public void enterArgument(final Argument argument) {
        final ArgumentDefinition definition = typeInfo().argument();
        if (definition != null) {
            check(argument.value(), definition.type(), argument.location());
        }
    }

    @Override
    public void enterVariableDefinition(final VariableDefinition definition) {
        if (definition.defaultValue() != null
                && context().schema().isInputType(definition.type())) {
            check(definition.defaultValue(), definition.type(),
                    definition.location());
        }
    }

    private void check(final Value value, final TypeRef type,
            final SourceLocation location) {
        if (value instanceof Value.Variable) {
            return;
        }
        if (type instanceof TypeRef.NonNull nonNull) {
            if (value instanceof Value.NullValue) {
                report("Expected value of type \"" + type + "\", found null.",
                        location);
            } else {
                check(value, nonNull.ofType(), location);
            }
            return;
        }
        if (value instanceof Value.NullValue) {
            return;
        }
        if (type instanceof TypeRef.ListOf listOf) {
            if (value instanceof Value.ListValue list) {
                for (final Value item : list.values()) {
                    check(item, listOf.ofType(), location);
                }
            } else {
                check(value, listOf.ofType(), location);
            }
            return;
        }
        final TypeDefinition named = context().schema().type(type);
        if (named instanceof InputObjectType input) {
            checkInputObject(value, input, location);
        } else if (named instanceof EnumType enumType) {
            checkEnum(value, enumType, location);
        } else if (named instanceof ScalarType scalar) {
            checkScalar(value, scalar, location);
        }
    }

    private void checkInputObject(final Value value,
            final InputObjectType input, final SourceLocation location) {
        if (!(value instanceof Value.ObjectValue object)) {
            report(expected(input.name(), value), location);
            return;
        }
        for (final Map.Entry<String, Value> entry
                : object.fields().entrySet()) {
            final ArgumentDefinition field = input.field(entry.getKey());
            if (field == null) {
                report("Field \"" + entry.getKey()
                        + "\" is not defined by type \"" + input.name()
                        + "\".", location);
            } else {
                check(entry.getValue(), field.type(), location);
            }
        }
        for (final ArgumentDefinition field : input.fields().values()) {
            if (field.isRequired()
                    && !object.fields().containsKey(field.name())) {
                report("Field \"" + input.name() + "." + field.name()
                        + "\" of required type \"" + field.type()
                        + "\" was not provided.", location);
            }
        }
    }

    private void checkEnum(final Value value, final EnumType enumType,
            final SourceLocation location) {
        if (!(value instanceof Value.EnumValue enumValue)) {
            report("Enum \"" + enumType.name()
                    + "\" cannot represent non-enum value: "
                    + Printer.print(value) + ".", location);
        } else if (enumType.value(enumValue.name()) == null) {
            report("Value \"" + enumValue.name() + "\" does not exist in \""
                    + enumType.name() + "\" enum.", location);
        }
    }

    private void checkScalar(final Value value, final ScalarType scalar,
            final SourceLocation location) {
        if (value.hasVariables()) {
            return;
        }
        try {
            scalar.coercing().parseLiteral(value);
        } catch (final CoercingException e) {
            report("Expected value of type \"" + scalar.name()
                    + "\", found " + Printer.print(value) + "; "
                    + e.getMessage(), location);
        }
    }

    private static String expected(final String typeName, final Value value) {
        return "Expected value of type \"" + typeName + "\", found "
                + Printer.print(value) + ".";
    }
}
