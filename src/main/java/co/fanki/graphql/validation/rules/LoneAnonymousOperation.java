package co.fanki.graphql.validation.rules;

import co.fanki.graphql.language.OperationDefinition;
import co.fanki.graphql.validation.ValidationContext;
import co.fanki.graphql.validation.ValidationRule;

/**
 * An anonymous operation must be the only operation of its document.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class LoneAnonymousOperation extends ValidationRule {

    public LoneAnonymousOperation(final ValidationContext context) {
        super(context);
    }

    @Override
    public void enterOperation(final OperationDefinition operation) {
        if (operation.isAnonymous()
                && context().document().operations().size() > 1) {
            report("This anonymous operation must be the only defined"
                    + " operation.", operation.location());
        }
    }
}
