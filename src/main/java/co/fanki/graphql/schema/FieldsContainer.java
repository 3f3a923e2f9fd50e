package co.fanki.graphql.schema;

import java.util.List;
import java.util.Map;

/**
 * A type that declares fields: an object or an interface.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface FieldsContainer extends TypeDefinition {

    /** Returns the fields keyed by name, in declaration order. */
    Map<String, FieldDefinition> fields();

    /** Returns the names of the implemented interfaces. */
    List<String> interfaces();

    /**
     * Finds a declared field.
     *
     * @param fieldName the field name
     * @return the field, or null if not declared
     */
    default FieldDefinition field(final String fieldName) {
        return fields().get(fieldName);
    }
}
