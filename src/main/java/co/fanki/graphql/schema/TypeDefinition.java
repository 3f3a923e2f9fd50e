package co.fanki.graphql.schema;

/**
 * A named type of the schema.
 *
 * <p>Implementations are immutable: {@link ScalarType},
 * {@link ObjectType}, {@link InterfaceType}, {@link UnionType},
 * {@link EnumType} and {@link InputObjectType}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface TypeDefinition {

    /** Returns the unique type name. */
    String name();

    /** Returns the description, or null. */
    String description();

    /** Returns the kind of this type. */
    TypeKind kind();

    /** Returns true for scalars and enums. */
    default boolean isLeaf() {
        return kind() == TypeKind.SCALAR || kind() == TypeKind.ENUM;
    }

    /** Returns true for objects, interfaces and unions. */
    default boolean isComposite() {
        return kind() == TypeKind.OBJECT || kind() == TypeKind.INTERFACE
                || kind() == TypeKind.UNION;
    }

    /** Returns true for interfaces and unions. */
    default boolean isAbstract() {
        return kind() == TypeKind.INTERFACE || kind() == TypeKind.UNION;
    }

    /** Returns true for types allowed in argument and variable positions. */
    default boolean isInput() {
        return kind() == TypeKind.SCALAR || kind() == TypeKind.ENUM
                || kind() == TypeKind.INPUT_OBJECT;
    }

    /** Returns true for types allowed as field results. */
    default boolean isOutput() {
        return kind() != TypeKind.INPUT_OBJECT;
    }
}
