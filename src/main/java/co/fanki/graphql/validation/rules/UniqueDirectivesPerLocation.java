package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.Directive;
import co.fanki.graphql.schema.DirectiveDefinition;
import co.fanki.graphql.schema.DirectiveLocation;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A non-repeatable directive appears at most once per node.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class UniqueDirectivesPerLocation extends ValidationRule {

    public UniqueDirectivesPerLocation(final ValidationContext context) {
        super(context);
    }

    @Override
    public void enterDirectives(final List<Directive> directives,
            final DirectiveLocation location) {
        final Map<String, Directive> seen = new HashMap<>();
        for (final Directive directive : directives) {
            final DirectiveDefinition definition =
                    context().schema().directive(directive.name());
            if (definition == null || definition.isRepeatable()) {
                continue;
            }
            final Directive first = seen.putIfAbsent(directive.name(),
                    directive);
            if (first != null) {
                report("The directive \"@" + directive.name()
                        + "\" can only be used once at this location.",
                        first.location(), directive.location());
            }
        }
    }
}
