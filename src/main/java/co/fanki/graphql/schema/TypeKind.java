package co.fanki.graphql.schema;

/**
 * The kinds of types, as exposed by introspection.
 *
 * <p>{@code LIST} and {@code NON_NULL} only describe wrapped type
 * references; no {@link TypeDefinition} has those kinds.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum TypeKind {
    SCALAR,
    OBJECT,
    INTERFACE,
    UNION,
    ENUM,
    INPUT_OBJECT,
    LIST,
    NON_NULL
}
