package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.FragmentSpread;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;

/**
 * Spread fragments are defined in the document.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class KnownFragmentNames extends ValidationRule {

    public KnownFragmentNames(final ValidationContext context) {
        super(context);
    }

    @Override
    public void enterFragmentSpread(final FragmentSpread spread) {
        if (context().fragment(spread.name()) == null) {
            report("Unknown fragment \"" + spread.name() + "\".",
                    spread.location());
        }
    }
}
