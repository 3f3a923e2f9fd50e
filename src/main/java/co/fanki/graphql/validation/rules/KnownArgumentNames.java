package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.Argument;
import co.fanki.graphql.language.Directive;
import co.fanki.graphql.language.Field;
import co.fanki.graphql.schema.DirectiveLocation;
import co.fanki.graphql.schema.FieldDefinition;
import co.fanki.graphql.schema.TypeDefinition;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;

/**
 * Arguments are declared by their field or directive.
 *
 * <p>Arguments of unknown fields and unknown directives are left to
 * the rules reporting those.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class KnownArgumentNames extends ValidationRule {

    /** The directive owning the arguments being visited, or null. */
    private Directive currentDirective;

    public KnownArgumentNames(final ValidationContext context) {
        super(context);
    }

    @Override
    public void enterField(final Field field) {
        currentDirective = null;
    }

    @Override
    public void enterDirective(final Directive directive,
            final DirectiveLocation location) {
        currentDirective = directive;
    }

    @Override
    public void enterArgument(final Argument argument) {
        if (typeInfo().argument() != null) {
            return;
        }
        if (currentDirective != null) {
            if (typeInfo().directive() != null) {
                report("Unknown argument \"" + argument.name()
                        + "\" on directive \"@" + currentDirective.name()
                        + "\".", argument.location());
            }
            return;
        }
        final FieldDefinition field = typeInfo().fieldDefinition();
        final TypeDefinition parent = typeInfo().parentType();
        if (field != null && parent != null) {
            report("Unknown argument \"" + argument.name() + "\" on field \""
                    + parent.name() + "." + field.name() + "\".",
                    argument.location());
        }
    }
}
