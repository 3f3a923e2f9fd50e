package co.fanki.graphql.execution;

import co.fanki.graphql.language.Argument;
import co.fanki.graphql.language.OperationDefinition;
import co.fanki.graphql.language.Printer;
import co.fanki.graphql.language.TypeRef;
import co.fanki.graphql.language.Value;
import co.fanki.graphql.language.VariableDefinition;
import co.fanki.graphql.schema.ArgumentDefinition;
import co.fanki.graphql.schema.CoercingException;
import co.fanki.graphql.schema.EnumType;
import co.fanki.graphql.schema.InputObjectType;
import co.fanki.graphql.schema.ScalarType;
import co.fanki.graphql.schema.Schema;
import co.fanki.graphql.schema.TypeDefinition;
import co.fanki.graphql.shared.Preconditions;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns variable inputs and argument literals into the runtime values
 * resolvers receive.
 *
 * <p>Coerced values are plain Java objects: scalars as their
 * {@code Coercing} produces them, enums as the value name, lists as
 * {@link List} and input objects as {@link Map} in declaration
 * order.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ValuesCoercer {

    private final Schema schema;

    /**
     * Creates a new coercer.
     *
     * @param theSchema the schema, cannot be null
     */
    public ValuesCoercer(final Schema theSchema) {
        this.schema = Preconditions.requireNonNull(theSchema,
                "Schema is required");
    }

    // -- Variables -----------------------------------------------------------

    /**
     * Coerces the variables a request provides.
     *
     * <p>Defaults are applied to missing variables; missing variables
     * without default are left out of the result.</p>
     *
     * @param operation the operation declaring the variables
     * @param inputs the JSON-like inputs, may be null
     * @return the coerced variables, never null
     * @throws VariableCoercionException if an input is missing or invalid
     */
    public Map<String, Object> coerceVariableValues(
            final OperationDefinition operation,
            final Map<String, Object> inputs) {
        Preconditions.requireNonNull(operation, "Operation is required");
        final Map<String, Object> provided = inputs == null ? Map.of() : inputs;
        final Map<String, Object> coerced = new LinkedHashMap<>();

        for (final VariableDefinition definition
                : operation.variableDefinitions()) {
            final String name = definition.name();
            final TypeRef type = definition.type();
            if (!schema.isInputType(type)) {
                throw new VariableCoercionException("Variable \"$" + name
                        + "\" expected value of type \"" + type
                        + "\" which cannot be used as an input type.",
                        definition.location());
            }
            final boolean present = provided.containsKey(name);
            final Object value = provided.get(name);

            if (!present && definition.defaultValue() != null) {
                coerced.put(name, valueFromLiteral(definition.defaultValue(),
                        type, Map.of()));
            } else if (type.isNonNull() && value == null) {
                throw new VariableCoercionException(present
                        ? "Variable \"$" + name + "\" of non-null type \""
                                + type + "\" must not be null."
                        : "Variable \"$" + name + "\" of required type \""
                                + type + "\" was not provided.",
                        definition.location());
            } else if (present) {
                try {
                    coerced.put(name, coerceInput(value, type));
                } catch (final CoercingException e) {
                    throw new VariableCoercionException("Variable \"$" + name
                            + "\" got invalid value " + describe(value)
                            + "; " + e.getMessage(), definition.location());
                }
            }
        }
        return coerced;
    }

    /**
     * Coerces an external input value against an input type.
     *
     * @param value the JSON-like value
     * @param type the expected type
     * @return the coerced value
     * @throws CoercingException if the value is not accepted
     */
    public Object coerceInput(final Object value, final TypeRef type) {
        if (type instanceof TypeRef.NonNull nonNull) {
            if (value == null) {
                throw new CoercingException("Expected non-nullable type \""
                        + type + "\" not to be null.");
            }
            return coerceInput(value, nonNull.ofType());
        }
        if (value == null) {
            return null;
        }
        if (type instanceof TypeRef.ListOf listOf) {
            final List<Object> items = asList(value);
            if (items == null) {
                return Collections.singletonList(
                        coerceInput(value, listOf.ofType()));
            }
            final List<Object> coerced = new ArrayList<>(items.size());
            for (final Object item : items) {
                coerced.add(coerceInput(item, listOf.ofType()));
            }
            return coerced;
        }

        final TypeDefinition definition = schema.type(type);
        if (definition instanceof ScalarType scalar) {
            final Object result = scalar.coercing().parseValue(value);
            if (result == null) {
                throw new CoercingException("Expected type \""
                        + scalar.name() + "\".");
            }
            return result;
        }
        if (definition instanceof EnumType enumType) {
            if (!(value instanceof String name)
                    || enumType.value(name) == null) {
                throw new CoercingException("Value " + describe(value)
                        + " does not exist in \"" + enumType.name()
                        + "\" enum.");
            }
            return name;
        }
        if (definition instanceof InputObjectType input) {
            return coerceInputObject(value, input);
        }
        throw new CoercingException("Type \"" + type
                + "\" is not an input type.");
    }

    private Map<String, Object> coerceInputObject(final Object value,
            final InputObjectType input) {
        if (!(value instanceof Map<?, ?> fields)) {
            throw new CoercingException("Expected type \"" + input.name()
                    + "\" to be an object.");
        }
        for (final Object key : fields.keySet()) {
            if (input.field(String.valueOf(key)) == null) {
                throw new CoercingException("Field \"" + key
                        + "\" is not defined by type \"" + input.name()
                        + "\".");
            }
        }
        final Map<String, Object> coerced = new LinkedHashMap<>();
        for (final ArgumentDefinition field : input.fields().values()) {
            if (fields.containsKey(field.name())) {
                coerced.put(field.name(), coerceInput(
                        fields.get(field.name()), field.type()));
            } else if (field.hasDefaultValue()) {
                coerced.put(field.name(), valueFromLiteral(
                        field.defaultValue(), field.type(), Map.of()));
            } else if (field.type().isNonNull()) {
                throw new CoercingException("Field \"" + field.name()
                        + "\" of required type \"" + field.type()
                        + "\" was not provided.");
            }
        }
        return coerced;
    }

    // -- Arguments -----------------------------------------------------------

    /**
     * Coerces the arguments of a field or directive.
     *
     * <p>Defaults are applied to missing arguments. Arguments referencing
     * a variable the request did not provide are treated as
     * missing.</p>
     *
     * @param definitions the declared arguments, by name
     * @param arguments the arguments in the document
     * @param variables the coerced variables
     * @return the coerced arguments, in declaration order
     * @throws CoercingException if a value is missing or invalid
     */
    public Map<String, Object> coerceArgumentValues(
            final Map<String, ArgumentDefinition> definitions,
            final List<Argument> arguments,
            final Map<String, Object> variables) {
        final Map<String, Object> coerced = new LinkedHashMap<>();
        for (final ArgumentDefinition definition : definitions.values()) {
            final Value literal = find(arguments, definition.name());
            final boolean missing = literal == null
                    || literal instanceof Value.Variable variable
                            && !variables.containsKey(variable.name());
            if (missing) {
                if (definition.hasDefaultValue()) {
                    coerced.put(definition.name(), valueFromLiteral(
                            definition.defaultValue(), definition.type(),
                            variables));
                } else if (definition.type().isNonNull()) {
                    throw new CoercingException("Argument \""
                            + definition.name() + "\" of required type \""
                            + definition.type() + "\" was not provided.");
                }
                continue;
            }
            final Object value = valueFromLiteral(literal, definition.type(),
                    variables);
            if (value == null && definition.type().isNonNull()) {
                throw new CoercingException("Argument \"" + definition.name()
                        + "\" of non-null type \"" + definition.type()
                        + "\" must not be null.");
            }
            coerced.put(definition.name(), value);
        }
        return coerced;
    }

    /**
     * Coerces a literal against an input type.
     *
     * @param literal the literal, may reference variables
     * @param type the expected type
     * @param variables the coerced variables
     * @return the coerced value
     * @throws CoercingException if the literal is not accepted
     */
    public Object valueFromLiteral(final Value literal, final TypeRef type,
            final Map<String, Object> variables) {
        if (literal instanceof Value.Variable variable) {
            return variables.get(variable.name());
        }
        if (type instanceof TypeRef.NonNull nonNull) {
            if (literal instanceof Value.NullValue) {
                throw new CoercingException("Expected non-nullable type \""
                        + type + "\" not to be null.");
            }
            return valueFromLiteral(literal, nonNull.ofType(), variables);
        }
        if (literal instanceof Value.NullValue) {
            return null;
        }
        if (type instanceof TypeRef.ListOf listOf) {
            if (literal instanceof Value.ListValue list) {
                final List<Object> coerced = new ArrayList<>();
                for (final Value item : list.values()) {
                    coerced.add(valueFromLiteral(item, listOf.ofType(),
                            variables));
                }
                return coerced;
            }
            return Collections.singletonList(valueFromLiteral(literal,
                    listOf.ofType(), variables));
        }

        final TypeDefinition definition = schema.type(type);
        if (definition instanceof ScalarType scalar) {
            return scalar.coercing().parseLiteral(literal);
        }
        if (definition instanceof EnumType enumType) {
            if (!(literal instanceof Value.EnumValue enumValue)
                    || enumType.value(enumValue.name()) == null) {
                throw new CoercingException("Value " + Printer.print(literal)
                        + " does not exist in \"" + enumType.name()
                        + "\" enum.");
            }
            return enumValue.name();
        }
        if (definition instanceof InputObjectType input) {
            return inputObjectFromLiteral(literal, input, variables);
        }
        throw new CoercingException("Type \"" + type
                + "\" is not an input type.");
    }

    private Map<String, Object> inputObjectFromLiteral(final Value literal,
            final InputObjectType input, final Map<String, Object> variables) {
        if (!(literal instanceof Value.ObjectValue object)) {
            throw new CoercingException("Expected type \"" + input.name()
                    + "\", found " + Printer.print(literal) + ".");
        }
        final Map<String, Object> coerced = new LinkedHashMap<>();
        for (final ArgumentDefinition field : input.fields().values()) {
            final Value value = object.fields().get(field.name());
            final boolean missing = value == null
                    || value instanceof Value.Variable variable
                            && !variables.containsKey(variable.name());
            if (!missing) {
                coerced.put(field.name(), valueFromLiteral(value,
                        field.type(), variables));
            } else if (field.hasDefaultValue()) {
                coerced.put(field.name(), valueFromLiteral(
                        field.defaultValue(), field.type(), variables));
            } else if (field.type().isNonNull()) {
                throw new CoercingException("Field \"" + input.name() + "."
                        + field.name() + "\" of required type \""
                        + field.type() + "\" was not provided.");
            }
        }
        return coerced;
    }

    // -- Helpers -------------------------------------------------------------

    private static Value find(final List<Argument> arguments,
            final String name) {
        for (final Argument argument : arguments) {
            if (argument.name().equals(name)) {
                return argument.value();
            }
        }
        return null;
    }

    /** Returns the elements of a collection or array, or null. */
    static List<Object> asList(final Object value) {
        if (value instanceof Iterable<?> iterable) {
            final List<Object> items = new ArrayList<>();
            iterable.forEach(items::add);
            return items;
        }
        if (value != null && value.getClass().isArray()) {
            final int length = Array.getLength(value);
            final List<Object> items = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                items.add(Array.get(value, i));
            }
            return items;
        }
        return null;
    }

    private static String describe(final Object value) {
        return value instanceof String ? "\"" + value + "\""
                : String.valueOf(value);
    }
}
