package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.Field;
import co.fanki.graphql.language.TypeRef;
import co.fanki.graphql.schema.TypeDefinition;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;

/**
 * Leaf fields have no selection set and composite fields have one.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ScalarLeafs extends ValidationRule {

    public ScalarLeafs(final ValidationContext context) {
        super(context);
    }

    @Override
    public void enterField(final Field field) {
        final TypeRef type = typeInfo().outputType();
        if (type == null) {
            return;
        }
        final TypeDefinition named = context().schema().type(type);
        if (named == null) {
            return;
        }
        if (named.isLeaf() && field.hasSelectionSet()) {
            report("Field \"" + field.name() + "\" must not have a selection"
                    + " since type \"" + type + "\" has no subfields.",
                    field.location());
        } else if (!named.isLeaf() && !field.hasSelectionSet()) {
            report("Field \"" + field.name() + "\" of type \"" + type
                    + "\" must have a selection of subfields. Did you mean \""
                    + field.name() + " { ... }\"?", field.location());
        }
    }
}
