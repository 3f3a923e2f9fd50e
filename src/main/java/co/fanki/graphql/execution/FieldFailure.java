package co.fanki.graphql.execution;

/**
 * Completes the future of a value that could not be produced. The error
 * is already recorded; the failure travels up to the nearest nullable
 * position, which becomes null.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class FieldFailure extends RuntimeException {

    private static final long serialVersionUID = 1L;

    FieldFailure(final ResultPath path) {
        super("Field failed at " + path, null, false, false);
    }
}
