package co.fanki.graphql.schema;

import java.util.Map;

/**
 * Produces the value of a field.
 *
 * <p>The result may be a plain value, null, or a
 * {@link java.util.concurrent.CompletionStage} that completes later.
 * Whatever is thrown becomes an error on the field and does not abort
 * the rest of the request.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@FunctionalInterface
public interface Resolver {

    /**
     * Resolves a field.
     *
     * @param parent the value of the parent object, the root value for
     *               top level fields
     * @param arguments the coerced arguments, keyed by name
     * @param context the request and field information
     * @return the field value, a completion stage of it, or null
     * @throws Exception on any failure
     */
    Object resolve(Object parent, Map<String, Object> arguments,
            ResolverContext context) throws Exception;
}
