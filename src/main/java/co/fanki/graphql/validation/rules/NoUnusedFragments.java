package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.Definition;
import co.fanki.graphql.language.Document;
import co.fanki.graphql.language.FragmentDefinition;
import co.fanki.graphql.language.OperationDefinition;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;

import java.util.HashSet;
import java.util.Set;

/**
 * Every fragment is reached from some operation.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class NoUnusedFragments extends ValidationRule {

    public NoUnusedFragments(final ValidationContext context) {
        super(context);
    }

    @Override
    public void leaveDocument(final Document document) {
        final Set<String> used = new HashSet<>();
        for (final OperationDefinition operation : document.operations()) {
            for (final FragmentDefinition fragment
                    : context().recursivelyReferencedFragments(operation)) {
                used.add(fragment.name());
            }
        }
        for (final Definition definition : document.definitions()) {
            if (definition instanceof FragmentDefinition fragment
                    && !used.contains(fragment.name())) {
                report("Fragment \"" + fragment.name() + "\" is never used.",
                        fragment.location());
            }
        }
    }
}
