package co.fanki.graphql.execution;

import co.fanki.graphql.language.Field;
import co.fanki.graphql.language.OperationDefinition;
import co.fanki.graphql.schema.FieldDefinition;
import co.fanki.graphql.schema.ObjectType;
import co.fanki.graphql.schema.ResolverContext;
import co.fanki.graphql.schema.Schema;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * The {@link ResolverContext} handed to resolvers by the executor.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class DefaultResolverContext implements ResolverContext {

    private final ExecutionContext execution;
    private final ObjectType parentType;
    private final FieldDefinition fieldDefinition;
    private final List<Field> fields;
    private final ResultPath path;

    DefaultResolverContext(final ExecutionContext theExecution,
            final ObjectType theParentType,
            final FieldDefinition theFieldDefinition,
            final List<Field> theFields, final ResultPath thePath) {
        this.execution = theExecution;
        this.parentType = theParentType;
        this.fieldDefinition = theFieldDefinition;
        this.fields = theFields;
        this.path = thePath;
    }

    @Override
    public Schema schema() {
        return execution.schema();
    }

    @Override
    public OperationDefinition operation() {
        return execution.operation();
    }

    @Override
    public Map<String, Object> variables() {
        return execution.variables();
    }

    @Override
    public Object rootValue() {
        return execution.rootValue();
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T hostContext() {
        return (T) execution.hostContext();
    }

    @Override
    public ObjectType parentType() {
        return parentType;
    }

    @Override
    public FieldDefinition fieldDefinition() {
        return fieldDefinition;
    }

    @Override
    public List<Field> fields() {
        return fields;
    }

    @Override
    public List<Object> path() {
        return path.toList();
    }

    @Override
    public boolean isCancelled() {
        return execution.isCancelled();
    }

    @Override
    public Executor executor() {
        return execution.executor();
    }
}
