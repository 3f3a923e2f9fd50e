package co.fanki.graphql.language;

/**
 * The kind of an operation.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum OperationType {
    QUERY("query"),
    MUTATION("mutation"),
    SUBSCRIPTION("subscription");

    private final String keyword;

    OperationType(final String theKeyword) {
        this.keyword = theKeyword;
    }

    /** Returns the keyword used in documents. */
    public String keyword() {
        return keyword;
    }

    /**
     * Finds the operation type for a keyword.
     *
     * @param keyword the keyword
     * @return the operation type, or null if the keyword is not one
     */
    public static OperationType fromKeyword(final String keyword) {
        for (final OperationType type : values()) {
            if (type.keyword.equals(keyword)) {
                return type;
            }
        }
        return null;
    }
}
