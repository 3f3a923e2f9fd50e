package co.fanki.graphql.schema;

import co.fanki.graphql.language.Parser;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link Scalars}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ScalarsTest {

    @Test
    void whenSerializingInt_givenAnyIntegralWidth_shouldReturnInteger() {
        final Coercing coercing = Scalars.INT.coercing();

        assertEquals(7, coercing.serialize(7L));
        assertEquals(7, coercing.serialize((short) 7));
        assertEquals(7, coercing.serialize(BigInteger.valueOf(7)));
        assertEquals(7, coercing.serialize(7.0d));
        assertEquals(7, coercing.serialize("7"));
    }

    @Test
    void whenSerializingInt_givenOutOfRangeOrFraction_shouldFail() {
        final Coercing coercing = Scalars.INT.coercing();

        final CoercingException e = assertThrows(CoercingException.class,
                () -> coercing.serialize(3_000_000_000L));
        assertEquals("Int cannot represent non 32-bit signed integer value:"
                + " 3000000000", e.getMessage());
        assertThrows(CoercingException.class,
                () -> coercing.serialize(1.5d));
    }

    @Test
    void whenCoercingInt_givenNonFiniteDouble_shouldFail() {
        final Coercing coercing = Scalars.INT.coercing();

        final CoercingException e = assertThrows(CoercingException.class,
                () -> coercing.parseValue(Double.NaN));
        assertEquals("Int cannot represent non-integer value: NaN",
                e.getMessage());
        assertThrows(CoercingException.class,
                () -> coercing.serialize(Double.POSITIVE_INFINITY));
        assertThrows(CoercingException.class,
                () -> coercing.serialize(Float.NEGATIVE_INFINITY));
    }

    @Test
    void whenParsingIntLiteral_givenFloatLiteral_shouldFail() {
        final CoercingException e = assertThrows(CoercingException.class,
                () -> Scalars.INT.coercing().parseLiteral(
                        Parser.parseValue("1.5")));

        assertEquals("Int cannot represent non-integer value: 1.5",
                e.getMessage());
    }

    @Test
    void whenParsingIntValue_givenString_shouldFail() {
        assertThrows(CoercingException.class,
                () -> Scalars.INT.coercing().parseValue("7"));
    }

    @Test
    void whenParsingFloatLiteral_givenIntLiteral_shouldWidenToDouble() {
        assertEquals(4.0d, Scalars.FLOAT.coercing().parseLiteral(
                Parser.parseValue("4")));
    }

    @Test
    void whenSerializingFloat_givenNaN_shouldFail() {
        assertThrows(CoercingException.class,
                () -> Scalars.FLOAT.coercing().serialize(Double.NaN));
    }

    @Test
    void whenSerializingString_givenEnumOrNumber_shouldUseText() {
        final Coercing coercing = Scalars.STRING.coercing();

        assertEquals("RED", coercing.serialize(Color.RED));
        assertEquals("12", coercing.serialize(12));
        assertThrows(CoercingException.class,
                () -> coercing.parseLiteral(Parser.parseValue("12")));
    }

    @Test
    void whenSerializingBoolean_givenNumber_shouldTestForZero() {
        assertEquals(false, Scalars.BOOLEAN.coercing().serialize(0));
        assertEquals(true, Scalars.BOOLEAN.coercing().serialize(2));
        assertThrows(CoercingException.class,
                () -> Scalars.BOOLEAN.coercing().parseValue("true"));
    }

    @Test
    void whenCoercingId_givenIntegersAndUuids_shouldReturnString() {
        final UUID uuid = UUID.randomUUID();
        final Coercing coercing = Scalars.ID.coercing();

        assertEquals("42", coercing.serialize(42));
        assertEquals(uuid.toString(), coercing.serialize(uuid));
        assertEquals("42", coercing.parseLiteral(Parser.parseValue("42")));
        assertThrows(CoercingException.class,
                () -> coercing.parseLiteral(Parser.parseValue("4.2")));
    }

    @Test
    void whenCoercingDecimal_givenStrings_shouldKeepPrecision() {
        final Coercing coercing = Scalars.DECIMAL.coercing();

        assertEquals("10.50", coercing.serialize(new BigDecimal("10.50")));
        assertEquals(new BigDecimal("0.1000000000000000000001"),
                coercing.parseValue("0.1000000000000000000001"));
        assertEquals(new BigDecimal("3.14"),
                coercing.parseLiteral(Parser.parseValue("\"3.14\"")));
    }

    @Test
    void whenCoercingDecimal_givenNumberLiteralOrGarbage_shouldFail() {
        final Coercing coercing = Scalars.DECIMAL.coercing();

        assertThrows(CoercingException.class,
                () -> coercing.parseLiteral(Parser.parseValue("3.14")));
        assertThrows(CoercingException.class,
                () -> coercing.parseValue("abc"));
    }

    private enum Color {
        RED
    }
}
