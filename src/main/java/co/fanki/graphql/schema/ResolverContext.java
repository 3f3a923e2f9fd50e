package co.fanki.graphql.schema;

import co.fanki.graphql.language.Field;
import co.fanki.graphql.language.OperationDefinition;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * What a resolver knows about the field it resolves and the request it
 * belongs to.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ResolverContext {

    /** Returns the schema. */
    Schema schema();

    /** Returns the operation being executed. */
    OperationDefinition operation();

    /** Returns the coerced variables of the request. */
    Map<String, Object> variables();

    /** Returns the root value the request started from. */
    Object rootValue();

    /**
     * Returns the host supplied context object, e.g. the authenticated
     * user.
     *
     * @param <T> the expected type
     * @return the host context, or null
     */
    <T> T hostContext();

    /** Returns the object type declaring the field. */
    ObjectType parentType();

    /** Returns the definition of the field. */
    FieldDefinition fieldDefinition();

    /** Returns the name of the field. */
    default String fieldName() {
        return fieldDefinition().name();
    }

    /** Returns all the field nodes merged under this response key. */
    List<Field> fields();

    /** Returns the first field node. */
    default Field field() {
        return fields().get(0);
    }

    /** Returns the response path, keys and list indexes. */
    List<Object> path();

    /** Returns true once the request was cancelled or timed out. */
    boolean isCancelled();

    /** Returns the executor running the resolvers of this request. */
    Executor executor();
}
