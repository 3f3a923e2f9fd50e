package co.fanki.graphql.schema;

/**
 * The places where a directive may appear.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum DirectiveLocation {

    QUERY(true),
    MUTATION(true),
    SUBSCRIPTION(true),
    FIELD(true),
    FRAGMENT_DEFINITION(true),
    FRAGMENT_SPREAD(true),
    INLINE_FRAGMENT(true),
    VARIABLE_DEFINITION(true),
    SCHEMA(false),
    SCALAR(false),
    OBJECT(false),
    FIELD_DEFINITION(false),
    ARGUMENT_DEFINITION(false),
    INTERFACE(false),
    UNION(false),
    ENUM(false),
    ENUM_VALUE(false),
    INPUT_OBJECT(false),
    INPUT_FIELD_DEFINITION(false);

    private final boolean executable;

    DirectiveLocation(final boolean isExecutable) {
        this.executable = isExecutable;
    }

    /** Returns true for locations inside executable documents. */
    public boolean isExecutable() {
        return executable;
    }
}
