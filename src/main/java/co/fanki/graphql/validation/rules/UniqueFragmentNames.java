package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.FragmentDefinition;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;

import java.util.HashMap;
import java.util.Map;

/**
 * Fragment names are unique within a document.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class UniqueFragmentNames extends ValidationRule {

    private final Map<String, FragmentDefinition> known = new HashMap<>();

    public UniqueFragmentNames(final ValidationContext context) {
        super(context);
    }

    @Override
    public void enterFragmentDefinition(final FragmentDefinition fragment) {
        final FragmentDefinition first = known.putIfAbsent(fragment.name(),
                fragment);
        if (first != null) {
            report("There can be only one fragment named \""
                    + fragment.name() + "\".",
                    first.location(), fragment.location());
        }
    }
}
