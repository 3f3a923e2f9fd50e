package co.fanki.graphql.validation;

import co.fanki.graphql.language.TypeRef;
import co.fanki.graphql.language.Value;
import co.fanki.graphql.shared.SourceLocation;

/**
 * A variable reference together with the type expected where it
 * appears.
 *
 * @param variable the reference
 * @param type the expected type, null if unknown
 * @param location the location of the argument holding the reference
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record VariableUsage(
        Value.Variable variable,
        TypeRef type,
        SourceLocation location) {

    /** Returns the variable name. */
    public String name() {
        return variable.name();
    }
}
