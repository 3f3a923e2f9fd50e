package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.Argument;
import co.fanki.graphql.language.Directive;
import co.fanki.graphql.language.Field;
import co.fanki.graphql.schema.ArgumentDefinition;
import co.fanki.graphql.schema.DirectiveDefinition;
import co.fanki.graphql.schema.DirectiveLocation;
import co.fanki.graphql.schema.FieldDefinition;
import co.fanki.graphql.shared.SourceLocation;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;

import java.util.Collection;
import java.util.List;

/**
 * Non-null arguments without default are supplied.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ProvidedRequiredArguments extends ValidationRule {

    public ProvidedRequiredArguments(final ValidationContext context) {
        super(context);
    }

    @Override
    public void enterField(final Field field) {
        final FieldDefinition definition = typeInfo().fieldDefinition();
        if (definition != null) {
            check("Field \"" + field.name() + "\"",
                    definition.arguments().values(), field.arguments(),
                    field.location());
        }
    }

    @Override
    public void enterDirective(final Directive directive,
            final DirectiveLocation location) {
        final DirectiveDefinition definition = typeInfo().directive();
        if (definition != null) {
            check("Directive \"@" + directive.name() + "\"",
                    definition.arguments().values(), directive.arguments(),
                    directive.location());
        }
    }

    private void check(final String owner,
            final Collection<ArgumentDefinition> definitions,
            final List<Argument> provided, final SourceLocation location) {
        for (final ArgumentDefinition definition : definitions) {
            final boolean present = provided.stream()
                    .anyMatch(argument -> argument.name()
                            .equals(definition.name()));
            if (definition.isRequired() && !present) {
                report(owner + " argument \"" + definition.name()
                        + "\" of type \"" + definition.type()
                        + "\" is required, but it was not provided.",
                        location);
            }
        }
    }
}
