package co.fanki.graphql.language;

import co.fanki.graphql.shared.Preconditions;
import co.fanki.graphql.shared.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * An operation: a query, mutation or subscription.
 *
 * @param operation the operation kind
 * @param name the operation name, or null when anonymous
 * @param variableDefinitions the declared variables
 * @param directives the directives
 * @param selectionSet the root selection set
 * @param location where the operation starts
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record OperationDefinition(
        OperationType operation,
        String name,
        List<VariableDefinition> variableDefinitions,
        List<Directive> directives,
        SelectionSet selectionSet,
        SourceLocation location) implements Definition {

    /** Validates the operation. */
    public OperationDefinition {
        Preconditions.requireNonNull(operation, "Operation type is required");
        if (name != null) {
            Preconditions.requireName(name, "Operation");
        }
        variableDefinitions = List.copyOf(variableDefinitions);
        directives = List.copyOf(directives);
        Preconditions.requireNonNull(selectionSet,
                "Operation selection set is required");
    }

    /** Returns true if the operation has no name. */
    public boolean isAnonymous() {
        return name == null;
    }

    /**
     * Finds a variable definition by name.
     *
     * @param variableName the variable name
     * @return the definition, or null if not declared
     */
    public VariableDefinition variableDefinition(final String variableName) {
        for (final VariableDefinition definition : variableDefinitions) {
            if (definition.name().equals(variableName)) {
                return definition;
            }
        }
        return null;
    }

    @Override
    public boolean equals(final Object other) {
        return other instanceof OperationDefinition that
                && operation == that.operation
                && Objects.equals(name, that.name)
                && variableDefinitions.equals(that.variableDefinitions)
                && directives.equals(that.directives)
                && selectionSet.equals(that.selectionSet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operation, name, variableDefinitions, directives,
                selectionSet);
    }
}
