package co.fanki.graphql.shared;

/**
 * A position in the request document.
 *
 * @param line the 1-based line number
 * @param column the 1-based column number
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SourceLocation(int line, int column) {

    /** Validates both coordinates are 1-based. */
    public SourceLocation {
        Preconditions.require(line >= 1, "Line must be >= 1");
        Preconditions.require(column >= 1, "Column must be >= 1");
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
