package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.Field;
import co.fanki.graphql.schema.TypeDefinition;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;

/**
 * Every selected field is declared by the type it is selected on.
 *
 * <p>On an interface only the interface's own fields can be selected;
 * on a union only {@code __typename}, the rest needs a fragment with a
 * type condition.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FieldsOnCorrectType extends ValidationRule {

    public FieldsOnCorrectType(final ValidationContext context) {
        super(context);
    }

    @Override
    public void enterField(final Field field) {
        final TypeDefinition parent = typeInfo().parentType();
        if (parent != null && typeInfo().fieldDefinition() == null) {
            report("Cannot query field \"" + field.name() + "\" on type \""
                    + parent.name() + "\".", field.location());
        }
    }
}
