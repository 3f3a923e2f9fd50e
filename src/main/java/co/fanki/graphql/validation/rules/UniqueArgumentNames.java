package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.Argument;
import co.fanki.graphql.language.Directive;
import co.fanki.graphql.language.Field;
import co.fanki.graphql.schema.DirectiveLocation;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A field or directive receives each argument at most once.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class UniqueArgumentNames extends ValidationRule {

    public UniqueArgumentNames(final ValidationContext context) {
        super(context);
    }

    @Override
    public void enterField(final Field field) {
        check(field.arguments());
    }

    @Override
    public void enterDirective(final Directive directive,
            final DirectiveLocation location) {
        check(directive.arguments());
    }

    private void check(final List<Argument> arguments) {
        final Map<String, Argument> seen = new HashMap<>();
        for (final Argument argument : arguments) {
            final Argument first = seen.putIfAbsent(argument.name(), argument);
            if (first != null) {
                report("There can be only one argument named \""
                        + argument.name() + "\".",
                        first.location(), argument.location());
            }
        }
    }
}
