package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.Directive;
import co.fanki.graphql.schema.DirectiveDefinition;
import co.fanki.graphql.schema.DirectiveLocation;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;

/**
 * Directives are declared by the schema and used where allowed.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class KnownDirectives extends ValidationRule {

    public KnownDirectives(final ValidationContext context) {
        super(context);
    }

    @Override
    public void enterDirective(final Directive directive,
            final DirectiveLocation location) {
        final DirectiveDefinition definition = typeInfo().directive();
        if (definition == null) {
            report("Unknown directive \"@" + directive.name() + "\".",
                    directive.location());
        } else if (!definition.locations().contains(location)) {
            report("Directive \"@" + directive.name()
                    + "\" may not be used on " + location + ".",
                    directive.location());
        }
    }
}
