package co.fanki.graphql.shared;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for Preconditions utility.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PreconditionsTest {

    @Test
    void whenRequireNonNull_givenNonNullValue_shouldReturnValue() {
        final String value = "test";

        final String result = Preconditions.requireNonNull(value, "message");

        assertEquals(value, result);
    }

    @Test
    void whenRequireNonNull_givenNullValue_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonNull(null, "Value is null"));
    }

    @Test
    void whenRequireNonBlank_givenBlankString_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonBlank("  ", "String is blank"));
    }

    @Test
    void whenRequireName_givenValidName_shouldReturnName() {
        assertEquals("_user2", Preconditions.requireName("_user2", "Type"));
    }

    @Test
    void whenRequireName_givenLeadingDigit_shouldThrowException() {
        final IllegalArgumentException e = assertThrows(
                IllegalArgumentException.class,
                () -> Preconditions.requireName("2user", "Type"));

        assertEquals("Type name must match /[_A-Za-z][_0-9A-Za-z]*/."
                + " Got: 2user", e.getMessage());
    }

    @Test
    void whenRequire_givenFalseCondition_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.require(false, "Condition is false"));
    }

    @Test
    void whenRequireSchema_givenFalseCondition_shouldThrowInvalidSchema() {
        final GraphQLException e = assertThrows(GraphQLException.class,
                () -> Preconditions.requireSchema(false, "Broken"));

        assertEquals("INVALID_SCHEMA", e.getErrorCode());
        assertEquals("Broken", e.getMessage());
    }

    @Test
    void whenRequireNonNegative_givenNegative_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonNegative(-1, "Negative"));
    }
}
