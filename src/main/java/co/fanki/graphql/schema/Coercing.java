package co.fanki.graphql.schema;

import co.fanki.graphql.language.Value;

/**
 * Converts the values of a scalar type.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface Coercing {

    /**
     * Converts a resolver result into a value for the response.
     *
     * @param value the resolver result, never null
     * @return the serialized value
     * @throws CoercingException if the value cannot be represented
     */
    Object serialize(Object value);

    /**
     * Converts a JSON-like variable value into a runtime value.
     *
     * @param value the input, never null
     * @return the runtime value
     * @throws CoercingException if the input is not accepted
     */
    Object parseValue(Object value);

    /**
     * Converts a literal from the document into a runtime value.
     *
     * @param literal the literal, never a variable or null literal
     * @return the runtime value
     * @throws CoercingException if the literal is not accepted
     */
    Object parseLiteral(Value literal);
}
