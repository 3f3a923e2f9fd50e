package co.fanki.graphql.validation;

import co.fanki.graphql.language.Argument;
import co.fanki.graphql.language.Definition;
import co.fanki.graphql.language.Directive;
import co.fanki.graphql.language.Document;
import co.fanki.graphql.language.Field;
import co.fanki.graphql.language.FragmentDefinition;
import co.fanki.graphql.language.FragmentSpread;
import co.fanki.graphql.language.InlineFragment;
import co.fanki.graphql.language.OperationDefinition;
import co.fanki.graphql.language.Selection;
import co.fanki.graphql.language.SelectionSet;
import co.fanki.graphql.language.TypeRef;
import co.fanki.graphql.language.Value;
import co.fanki.graphql.language.VariableDefinition;
import co.fanki.graphql.schema.ArgumentDefinition;
import co.fanki.graphql.schema.DirectiveDefinition;
import co.fanki.graphql.schema.DirectiveLocation;
import co.fanki.graphql.schema.FieldDefinition;
import co.fanki.graphql.schema.InputObjectType;
import co.fanki.graphql.schema.ObjectType;
import co.fanki.graphql.schema.Schema;
import co.fanki.graphql.schema.TypeDefinition;

import java.util.List;
import java.util.Map;

/**
 * Depth-first traversal of a document that keeps a {@link TypeInfo} in
 * step with the visited node.
 *
 * <p>Each definition is visited once: fragment spreads are reported to
 * the visitor but not followed.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DocumentWalker {

    private final Schema schema;
    private final DocumentVisitor visitor;
    private final TypeInfo typeInfo;

    /**
     * Creates a new walker.
     *
     * @param theSchema the schema
     * @param theVisitor the visitor
     */
    public DocumentWalker(final Schema theSchema,
            final DocumentVisitor theVisitor) {
        this.schema = theSchema;
        this.visitor = theVisitor;
        this.typeInfo = new TypeInfo(theSchema);
    }

    /** Returns the type information, updated as the walk proceeds. */
    public TypeInfo typeInfo() {
        return typeInfo;
    }

    /**
     * Walks a whole document.
     *
     * @param document the document
     */
    public void walk(final Document document) {
        visitor.enterDocument(document);
        for (final Definition definition : document.definitions()) {
            walk(definition);
        }
        visitor.leaveDocument(document);
    }

    /**
     * Walks a single operation or fragment definition.
     *
     * @param definition the definition
     */
    public void walk(final Definition definition) {
        if (definition instanceof OperationDefinition operation) {
            walkOperation(operation);
        } else {
            walkFragmentDefinition((FragmentDefinition) definition);
        }
    }

    private void walkOperation(final OperationDefinition operation) {
        final ObjectType root = schema.rootType(operation.operation());
        typeInfo.pushOutputType(root == null ? null : TypeRef.named(root.name()));
        visitor.enterOperation(operation);

        for (final VariableDefinition definition
                : operation.variableDefinitions()) {
            walkVariableDefinition(definition);
        }
        walkDirectives(operation.directives(),
                DirectiveLocation.valueOf(operation.operation().name()));
        walkSelectionSet(operation.selectionSet());

        visitor.leaveOperation(operation);
        typeInfo.popOutputType();
    }

    private void walkVariableDefinition(final VariableDefinition definition) {
        typeInfo.pushInputType(schema.isInputType(definition.type())
                ? definition.type()
                : null);
        visitor.enterVariableDefinition(definition);
        if (definition.defaultValue() != null) {
            typeInfo.valueLocation(definition.location());
            walkValue(definition.defaultValue());
        }
        typeInfo.popInputType();
        walkDirectives(definition.directives(),
                DirectiveLocation.VARIABLE_DEFINITION);
    }

    private void walkFragmentDefinition(final FragmentDefinition fragment) {
        typeInfo.pushOutputType(TypeRef.named(fragment.typeCondition()));
        visitor.enterFragmentDefinition(fragment);
        walkDirectives(fragment.directives(),
                DirectiveLocation.FRAGMENT_DEFINITION);
        walkSelectionSet(fragment.selectionSet());
        typeInfo.popOutputType();
    }

    // -- Selections ----------------------------------------------------------

    private void walkSelectionSet(final SelectionSet selectionSet) {
        typeInfo.pushParentType();
        visitor.enterSelectionSet(selectionSet);
        for (final Selection selection : selectionSet.selections()) {
            if (selection instanceof Field field) {
                walkField(field);
            } else if (selection instanceof InlineFragment inline) {
                walkInlineFragment(inline);
            } else {
                final FragmentSpread spread = (FragmentSpread) selection;
                visitor.enterFragmentSpread(spread);
                walkDirectives(spread.directives(),
                        DirectiveLocation.FRAGMENT_SPREAD);
            }
        }
        visitor.leaveSelectionSet(selectionSet);
        typeInfo.popParentType();
    }

    private void walkField(final Field field) {
        final FieldDefinition definition = schema.fieldDefinition(
                typeInfo.parentType(), field.name());
        typeInfo.pushFieldDefinition(definition);
        typeInfo.pushOutputType(definition == null ? null : definition.type());
        visitor.enterField(field);

        walkArguments(field.arguments(),
                definition == null ? Map.of() : definition.arguments());
        walkDirectives(field.directives(), DirectiveLocation.FIELD);
        if (field.hasSelectionSet()) {
            walkSelectionSet(field.selectionSet());
        }

        visitor.leaveField(field);
        typeInfo.popOutputType();
        typeInfo.popFieldDefinition();
    }

    private void walkInlineFragment(final InlineFragment fragment) {
        if (fragment.typeCondition() != null) {
            typeInfo.pushOutputType(TypeRef.named(fragment.typeCondition()));
        } else {
            final TypeDefinition parent = typeInfo.parentType();
            typeInfo.pushOutputType(parent == null
                    ? null
                    : TypeRef.named(parent.name()));
        }
        visitor.enterInlineFragment(fragment);
        walkDirectives(fragment.directives(),
                DirectiveLocation.INLINE_FRAGMENT);
        walkSelectionSet(fragment.selectionSet());
        typeInfo.popOutputType();
    }

    // -- Directives and arguments --------------------------------------------

    private void walkDirectives(final List<Directive> directives,
            final DirectiveLocation location) {
        visitor.enterDirectives(directives, location);
        for (final Directive directive : directives) {
            final DirectiveDefinition definition =
                    schema.directive(directive.name());
            typeInfo.directive(definition);
            visitor.enterDirective(directive, location);
            walkArguments(directive.arguments(),
                    definition == null ? Map.of() : definition.arguments());
            typeInfo.directive(null);
        }
    }

    private void walkArguments(final List<Argument> arguments,
            final Map<String, ArgumentDefinition> definitions) {
        for (final Argument argument : arguments) {
            final ArgumentDefinition definition =
                    definitions.get(argument.name());
            typeInfo.argument(definition);
            typeInfo.pushInputType(definition == null
                    ? null
                    : definition.type());
            typeInfo.valueLocation(argument.location());
            visitor.enterArgument(argument);
            walkValue(argument.value());
            typeInfo.popInputType();
            typeInfo.argument(null);
        }
    }

    // -- Values --------------------------------------------------------------

    private void walkValue(final Value value) {
        if (value instanceof Value.Variable variable) {
            visitor.enterVariable(variable);
        } else if (value instanceof Value.ListValue list) {
            final TypeRef expected = typeInfo.inputType();
            final TypeRef itemType = expected != null
                    && expected.nullable() instanceof TypeRef.ListOf listOf
                    ? listOf.ofType()
                    : null;
            for (final Value item : list.values()) {
                typeInfo.pushInputType(itemType);
                walkValue(item);
                typeInfo.popInputType();
            }
        } else if (value instanceof Value.ObjectValue object) {
            final TypeRef expected = typeInfo.inputType();
            final TypeDefinition type = expected == null
                    ? null
                    : schema.type(expected);
            for (final Map.Entry<String, Value> entry
                    : object.fields().entrySet()) {
                final ArgumentDefinition field =
                        type instanceof InputObjectType input
                                ? input.field(entry.getKey())
                                : null;
                typeInfo.pushInputType(field == null ? null : field.type());
                walkValue(entry.getValue());
                typeInfo.popInputType();
            }
        }
    }
}
