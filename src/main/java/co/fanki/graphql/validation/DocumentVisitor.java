package co.fanki.graphql.validation;

import co.fanki.graphql.language.Argument;
import co.fanki.graphql.language.Directive;
import co.fanki.graphql.language.Document;
import co.fanki.graphql.language.Field;
import co.fanki.graphql.language.FragmentDefinition;
import co.fanki.graphql.language.FragmentSpread;
import co.fanki.graphql.language.InlineFragment;
import co.fanki.graphql.language.OperationDefinition;
import co.fanki.graphql.language.SelectionSet;
import co.fanki.graphql.language.Value;
import co.fanki.graphql.language.VariableDefinition;
import co.fanki.graphql.schema.DirectiveLocation;

import java.util.List;

/**
 * Callbacks of a {@link DocumentWalker}.
 *
 * <p>Each callback runs while the walker's {@link TypeInfo} describes
 * the visited node.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface DocumentVisitor {

    default void enterDocument(final Document document) {
    }

    default void leaveDocument(final Document document) {
    }

    default void enterOperation(final OperationDefinition operation) {
    }

    default void leaveOperation(final OperationDefinition operation) {
    }

    default void enterFragmentDefinition(final FragmentDefinition fragment) {
    }

    default void enterVariableDefinition(final VariableDefinition definition) {
    }

    default void enterSelectionSet(final SelectionSet selectionSet) {
    }

    default void leaveSelectionSet(final SelectionSet selectionSet) {
    }

    default void enterField(final Field field) {
    }

    default void leaveField(final Field field) {
    }

    default void enterInlineFragment(final InlineFragment fragment) {
    }

    default void enterFragmentSpread(final FragmentSpread spread) {
    }

    /**
     * Called once per node carrying directives, before each directive
     * is entered.
     *
     * @param directives the directives of the node, may be empty
     * @param location where they appear
     */
    default void enterDirectives(final List<Directive> directives,
            final DirectiveLocation location) {
    }

    default void enterDirective(final Directive directive,
            final DirectiveLocation location) {
    }

    default void enterArgument(final Argument argument) {
    }

    /**
     * Called for every variable reference inside a value, with the
     * expected input type available from {@link TypeInfo#inputType()}.
     *
     * @param variable the reference
     */
    default void enterVariable(final Value.Variable variable) {
    }
}
