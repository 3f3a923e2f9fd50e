package co.fanki.graphql.shared;

import java.util.regex.Pattern;

/**
 * Utility class for argument validation and precondition checks.
 *
 * <p>Used by the schema builder and the AST constructors to reject
 * malformed definitions as early as possible.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Preconditions {

    /** The GraphQL {@code Name} production. */
    private static final Pattern NAME =
            Pattern.compile("[_A-Za-z][_0-9A-Za-z]*");

    private Preconditions() {
        // Utility class, not instantiable
    }

    /**
     * Ensures that an object reference is not null.
     *
     * @param reference the object reference to check
     * @param message the exception message if null
     * @param <T> the type of the reference
     * @return the non-null reference
     * @throws IllegalArgumentException if reference is null
     */
    public static <T> T requireNonNull(final T reference, final String message) {
        if (reference == null) {
            throw new IllegalArgumentException(message);
        }
        return reference;
    }

    /**
     * Ensures that a string is not null or blank.
     *
     * @param value the string to check
     * @param message the exception message if null or blank
     * @return the non-blank string
     * @throws IllegalArgumentException if value is null or blank
     */
    public static String requireNonBlank(final String value,
            final String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a string is a valid GraphQL name.
     *
     * @param value the candidate name
     * @param what what the name identifies, used in the message
     * @return the name
     * @throws IllegalArgumentException if value is not a valid name
     */
    public static String requireName(final String value, final String what) {
        requireNonBlank(value, what + " name is required");
        if (!NAME.matcher(value).matches()) {
            throw new IllegalArgumentException(
                    what + " name must match /[_A-Za-z][_0-9A-Za-z]*/."
                            + " Got: " + value);
        }
        return value;
    }

    /**
     * Ensures that a condition is true.
     *
     * @param condition the condition to check
     * @param message the exception message if false
     * @throws IllegalArgumentException if condition is false
     */
    public static void require(final boolean condition, final String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Ensures that a schema invariant holds.
     *
     * @param condition the condition to check
     * @param message the exception message if false
     * @throws GraphQLException with code {@code INVALID_SCHEMA}
     *         if condition is false
     */
    public static void requireSchema(final boolean condition,
            final String message) {
        if (!condition) {
            throw new GraphQLException(message, "INVALID_SCHEMA");
        }
    }

    /**
     * Ensures that a number is non-negative.
     *
     * @param value the number to check
     * @param message the exception message if negative
     * @return the non-negative number
     * @throws IllegalArgumentException if value is negative
     */
    public static long requireNonNegative(final long value,
            final String message) {
        if (value < 0) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

}
