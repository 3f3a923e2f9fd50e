package co.fanki.graphql.schema;

import co.fanki.graphql.shared.Preconditions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A structured input, used as an argument or variable type.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class InputObjectType implements TypeDefinition {

    private final String name;
    private final String description;
    private final Map<String, ArgumentDefinition> fields;

    /**
     * Creates a new input object.
     *
     * @param theName the type name
     * @param theDescription the description, may be null
     * @param theFields the fields, in declaration order, not empty
     */
    public InputObjectType(final String theName, final String theDescription,
            final List<ArgumentDefinition> theFields) {
        this.name = Preconditions.requireName(theName, "Input object");
        this.description = theDescription;
        Preconditions.requireSchema(theFields != null && !theFields.isEmpty(),
                "Input object type " + theName
                        + " must define one or more fields.");
        final Map<String, ArgumentDefinition> byName = new LinkedHashMap<>();
        for (final ArgumentDefinition field : theFields) {
            Preconditions.requireSchema(
                    byName.put(field.name(), field) == null,
                    "Input field " + theName + "." + field.name()
                            + " can only be defined once.");
        }
        this.fields = Collections.unmodifiableMap(byName);
    }

    /**
     * Creates an input object without description.
     *
     * @param name the type name
     * @param fields the fields
     * @return the input object
     */
    public static InputObjectType of(final String name,
            final ArgumentDefinition... fields) {
        return new InputObjectType(name, null, List.of(fields));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public TypeKind kind() {
        return TypeKind.INPUT_OBJECT;
    }

    /** Returns the fields by name, in declaration order. */
    public Map<String, ArgumentDefinition> fields() {
        return fields;
    }

    /**
     * Finds a field.
     *
     * @param fieldName the field name
     * @return the field, or null if not declared
     */
    public ArgumentDefinition field(final String fieldName) {
        return fields.get(fieldName);
    }

    @Override
    public String toString() {
        return name;
    }
}
