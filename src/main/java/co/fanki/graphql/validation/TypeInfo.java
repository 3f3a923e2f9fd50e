package co.fanki.graphql.validation;

import co.fanki.graphql.language.TypeRef;
import co.fanki.graphql.schema.ArgumentDefinition;
import co.fanki.graphql.schema.DirectiveDefinition;
import co.fanki.graphql.schema.FieldDefinition;
import co.fanki.graphql.schema.Schema;
import co.fanki.graphql.schema.TypeDefinition;
import co.fanki.graphql.shared.SourceLocation;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * The schema information of the node a {@link DocumentWalker} is on.
 *
 * <p>Every getter returns null when the information is unknown, e.g.
 * inside a field the parent type does not declare.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class TypeInfo {

    /** Stands for null in the stacks, which reject null elements. */
    private static final Object NONE = new Object();

    private final Schema schema;
    private final Deque<Object> parentTypes = new ArrayDeque<>();
    private final Deque<Object> outputTypes = new ArrayDeque<>();
    private final Deque<Object> fieldDefinitions = new ArrayDeque<>();
    private final Deque<Object> inputTypes = new ArrayDeque<>();
    private DirectiveDefinition directive;
    private ArgumentDefinition argument;
    private SourceLocation valueLocation;

    TypeInfo(final Schema theSchema) {
        this.schema = theSchema;
    }

    /** Returns the composite type owning the current selection set. */
    public TypeDefinition parentType() {
        return peek(parentTypes);
    }

    /** Returns the type of the current field or fragment. */
    public TypeRef outputType() {
        return peek(outputTypes);
    }

    /** Returns the definition of the current field. */
    public FieldDefinition fieldDefinition() {
        return peek(fieldDefinitions);
    }

    /** Returns the type expected at the current value. */
    public TypeRef inputType() {
        return peek(inputTypes);
    }

    /** Returns the directive whose arguments are being visited. */
    public DirectiveDefinition directive() {
        return directive;
    }

    /** Returns the definition of the current argument. */
    public ArgumentDefinition argument() {
        return argument;
    }

    /** Returns the location of the argument or variable holding the value. */
    public SourceLocation valueLocation() {
        return valueLocation;
    }

    // -- Mutators, used by the walker ----------------------------------------

    void pushOutputType(final TypeRef type) {
        outputTypes.push(orNone(type));
    }

    void popOutputType() {
        outputTypes.pop();
    }

    /** Pushes the named type of the current output type, if composite. */
    void pushParentType() {
        final TypeRef output = outputType();
        final TypeDefinition type = output == null ? null : schema.type(output);
        parentTypes.push(orNone(type != null && type.isComposite()
                ? type
                : null));
    }

    void popParentType() {
        parentTypes.pop();
    }

    void pushFieldDefinition(final FieldDefinition definition) {
        fieldDefinitions.push(orNone(definition));
    }

    void popFieldDefinition() {
        fieldDefinitions.pop();
    }

    void pushInputType(final TypeRef type) {
        inputTypes.push(orNone(type));
    }

    void popInputType() {
        inputTypes.pop();
    }

    void directive(final DirectiveDefinition theDirective) {
        directive = theDirective;
    }

    void argument(final ArgumentDefinition theArgument) {
        argument = theArgument;
    }

    void valueLocation(final SourceLocation location) {
        valueLocation = location;
    }

    private static Object orNone(final Object value) {
        return value == null ? NONE : value;
    }

    @SuppressWarnings("unchecked")
    private static <T> T peek(final Deque<Object> stack) {
        final Object top = stack.peek();
        return top == null || top == NONE ? null : (T) top;
    }
}
