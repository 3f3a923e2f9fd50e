package co.fanki.graphql.schema;

/**
 * Tells which object type a value of an interface or union is.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@FunctionalInterface
public interface TypeResolver {

    /**
     * Resolves the runtime type of a value.
     *
     * @param value the value, never null
     * @param context the context of the field being completed
     * @return the object type name, or null if unknown
     */
    String resolveType(Object value, ResolverContext context);
}
