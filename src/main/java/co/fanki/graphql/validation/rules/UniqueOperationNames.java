package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.OperationDefinition;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;

import java.util.HashMap;
import java.util.Map;

/**
 * Operation names are unique within a document.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class UniqueOperationNames extends ValidationRule {

    private final Map<String, OperationDefinition> known = new HashMap<>();

    public UniqueOperationNames(final ValidationContext context) {
        super(context);
    }

    @Override
    public void enterOperation(final OperationDefinition operation) {
        if (operation.isAnonymous()) {
            return;
        }
        final OperationDefinition first = known.putIfAbsent(operation.name(),
                operation);
        if (first != null) {
            report("There can be only one operation named \""
                    + operation.name() + "\".",
                    first.location(), operation.location());
        }
    }
}
