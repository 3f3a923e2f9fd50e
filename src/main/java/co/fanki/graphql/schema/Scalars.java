package co.fanki.graphql.schema;

import co.fanki.graphql.language.Printer;
import co.fanki.graphql.language.Value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.UUID;

/**
 * The built-in scalar types, plus {@link #DECIMAL}.
 *
 * <p>{@code Int}, {@code Float}, {@code String}, {@code Boolean} and
 * {@code ID} are registered in every schema. {@code Decimal} is
 * opt-in.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Scalars {

    private static final BigInteger INT_MIN =
            BigInteger.valueOf(Integer.MIN_VALUE);
    private static final BigInteger INT_MAX =
            BigInteger.valueOf(Integer.MAX_VALUE);

    /** 32-bit signed integers. */
    public static final ScalarType INT = ScalarType.of("Int",
            "The `Int` scalar type represents non-fractional signed whole"
                    + " numeric values. Int can represent values between"
                    + " -(2^31) and 2^31 - 1.",
            new IntCoercing());

    /** Double precision floating point numbers. */
    public static final ScalarType FLOAT = ScalarType.of("Float",
            "The `Float` scalar type represents signed double-precision"
                    + " fractional values as specified by IEEE 754.",
            new FloatCoercing());

    /** UTF-8 character sequences. */
    public static final ScalarType STRING = ScalarType.of("String",
            "The `String` scalar type represents textual data, represented"
                    + " as UTF-8 character sequences.",
            new StringCoercing());

    /** {@code true} or {@code false}. */
    public static final ScalarType BOOLEAN = ScalarType.of("Boolean",
            "The `Boolean` scalar type represents `true` or `false`.",
            new BooleanCoercing());

    /** Unique identifiers, serialized as strings. */
    public static final ScalarType ID = ScalarType.of("ID",
            "The `ID` scalar type represents a unique identifier,"
                    + " serialized as a String.",
            new IdCoercing());

    /** Arbitrary precision decimals, serialized as strings. */
    public static final ScalarType DECIMAL = ScalarType.of("Decimal",
            "Arbitrary precision decimal number, serialized as a String.",
            new DecimalCoercing());

    private Scalars() {
    }

    /** Returns the scalars registered in every schema. */
    public static List<ScalarType> builtIns() {
        return List.of(INT, FLOAT, STRING, BOOLEAN, ID);
    }

    // -- Int -----------------------------------------------------------------

    private static final class IntCoercing implements Coercing {

        @Override
        public Object serialize(final Object value) {
            final BigInteger integer = toBigInteger(value);
            if (integer == null) {
                throw new CoercingException(
                        "Int cannot represent non-integer value: " + value);
            }
            return checkRange(integer, value);
        }

        @Override
        public Object parseValue(final Object value) {
            if (value instanceof String || value instanceof Boolean) {
                throw new CoercingException(
                        "Int cannot represent non-integer value: "
                                + describe(value));
            }
            return serialize(value);
        }

        @Override
        public Object parseLiteral(final Value literal) {
            if (!(literal instanceof Value.IntValue intValue)) {
                throw new CoercingException(
                        "Int cannot represent non-integer value: "
                                + literalText(literal));
            }
            return checkRange(intValue.value(), intValue.value());
        }

        private static Integer checkRange(final BigInteger integer,
                final Object original) {
            if (integer.compareTo(INT_MIN) < 0
                    || integer.compareTo(INT_MAX) > 0) {
                throw new CoercingException(
                        "Int cannot represent non 32-bit signed integer"
                                + " value: " + original);
            }
            return integer.intValue();
        }

        private static BigInteger toBigInteger(final Object value) {
            if (value instanceof Integer || value instanceof Long
                    || value instanceof Short || value instanceof Byte) {
                return BigInteger.valueOf(((Number) value).longValue());
            }
            if (value instanceof BigInteger bigInteger) {
                return bigInteger;
            }
            if (value instanceof Number || value instanceof String) {
                return integralPart(value.toString().trim());
            }
            return null;
        }

        private static BigInteger integralPart(final String text) {
            try {
                return integralPart(new BigDecimal(text));
            } catch (final NumberFormatException e) {
                // NaN, Infinity or not a number at all.
                return null;
            }
        }

        private static BigInteger integralPart(final BigDecimal decimal) {
            try {
                return decimal.toBigIntegerExact();
            } catch (final ArithmeticException e) {
                return null;
            }
        }
    }

    // -- Float ---------------------------------------------------------------

    private static final class FloatCoercing implements Coercing {

        @Override
        public Object serialize(final Object value) {
            final Double number = toDouble(value);
            if (number == null || number.isNaN() || number.isInfinite()) {
                throw new CoercingException(
                        "Float cannot represent non numeric value: "
                                + describe(value));
            }
            return number;
        }

        @Override
        public Object parseValue(final Object value) {
            if (!(value instanceof Number)) {
                throw new CoercingException(
                        "Float cannot represent non numeric value: "
                                + describe(value));
            }
            return serialize(value);
        }

        @Override
        public Object parseLiteral(final Value literal) {
            if (literal instanceof Value.IntValue intValue) {
                return intValue.value().doubleValue();
            }
            if (literal instanceof Value.FloatValue floatValue) {
                return floatValue.value().doubleValue();
            }
            throw new CoercingException(
                    "Float cannot represent non numeric value: "
                            + literalText(literal));
        }

        private static Double toDouble(final Object value) {
            if (value instanceof Number number) {
                return number.doubleValue();
            }
            if (value instanceof String text) {
                try {
                    return Double.valueOf(text.trim());
                } catch (final NumberFormatException e) {
                    return null;
                }
            }
            return null;
        }
    }

    // -- String --------------------------------------------------------------

    private static final class StringCoercing implements Coercing {

        @Override
        public Object serialize(final Object value) {
            if (value instanceof String || value instanceof Character
                    || value instanceof Boolean || value instanceof Number) {
                return value.toString();
            }
            if (value instanceof Enum<?> constant) {
                return constant.name();
            }
            throw new CoercingException(
                    "String cannot represent value: " + describe(value));
        }

        @Override
        public Object parseValue(final Object value) {
            if (!(value instanceof String)) {
                throw new CoercingException(
                        "String cannot represent a non string value: "
                                + describe(value));
            }
            return value;
        }

        @Override
        public Object parseLiteral(final Value literal) {
            if (!(literal instanceof Value.StringValue string)) {
                throw new CoercingException(
                        "String cannot represent a non string value: "
                                + literalText(literal));
            }
            return string.value();
        }
    }

    // -- Boolean -------------------------------------------------------------

    private static final class BooleanCoercing implements Coercing {

        @Override
        public Object serialize(final Object value) {
            if (value instanceof Boolean) {
                return value;
            }
            if (value instanceof Number number
                    && Double.isFinite(number.doubleValue())) {
                return number.doubleValue() != 0;
            }
            throw new CoercingException(
                    "Boolean cannot represent a non boolean value: "
                            + describe(value));
        }

        @Override
        public Object parseValue(final Object value) {
            if (!(value instanceof Boolean)) {
                throw new CoercingException(
                        "Boolean cannot represent a non boolean value: "
                                + describe(value));
            }
            return value;
        }

        @Override
        public Object parseLiteral(final Value literal) {
            if (!(literal instanceof Value.BooleanValue bool)) {
                throw new CoercingException(
                        "Boolean cannot represent a non boolean value: "
                                + literalText(literal));
            }
            return bool.value();
        }
    }

    // -- ID ------------------------------------------------------------------

    private static final class IdCoercing implements Coercing {

        @Override
        public Object serialize(final Object value) {
            if (value instanceof String) {
                return value;
            }
            if (value instanceof Integer || value instanceof Long
                    || value instanceof Short || value instanceof Byte
                    || value instanceof BigInteger) {
                return value.toString();
            }
            if (value instanceof UUID) {
                return value.toString();
            }
            throw new CoercingException(
                    "ID cannot represent value: " + describe(value));
        }

        @Override
        public Object parseValue(final Object value) {
            return serialize(value);
        }

        @Override
        public Object parseLiteral(final Value literal) {
            if (literal instanceof Value.StringValue string) {
                return string.value();
            }
            if (literal instanceof Value.IntValue intValue) {
                return intValue.value().toString();
            }
            throw new CoercingException(
                    "ID cannot represent a non-string and non-integer"
                            + " value: " + literalText(literal));
        }
    }

    // -- Decimal -------------------------------------------------------------

    private static final class DecimalCoercing implements Coercing {

        @Override
        public Object serialize(final Object value) {
            if (value instanceof BigDecimal decimal) {
                return decimal.toPlainString();
            }
            if (value instanceof Number || value instanceof String) {
                return parse(value.toString()).toPlainString();
            }
            throw new CoercingException(
                    "Decimal cannot represent value: " + describe(value));
        }

        @Override
        public Object parseValue(final Object value) {
            if (!(value instanceof String text)) {
                throw new CoercingException(
                        "Decimal must be provided as a string: "
                                + describe(value));
            }
            return parse(text);
        }

        @Override
        public Object parseLiteral(final Value literal) {
            if (!(literal instanceof Value.StringValue string)) {
                throw new CoercingException(
                        "Decimal must be provided as a string: "
                                + literalText(literal));
            }
            return parse(string.value());
        }

        private static BigDecimal parse(final String text) {
            try {
                return new BigDecimal(text.trim());
            } catch (final NumberFormatException e) {
                throw new CoercingException(
                        "Decimal cannot represent value: \"" + text + "\"",
                        e);
            }
        }
    }

    // -- Helpers -------------------------------------------------------------

    private static String describe(final Object value) {
        return value instanceof String ? "\"" + value + "\"" : String.valueOf(value);
    }

    private static String literalText(final Value literal) {
        return Printer.print(literal);
    }
}
