package co.fanki.graphql.language;

import co.fanki.graphql.shared.Preconditions;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A literal or variable in the request document, before coercion.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface Value {

    /** The null literal. */
    NullValue NULL = new NullValue();

    /**
     * A reference to an operation variable.
     *
     * @param name the variable name, without {@code $}
     */
    record Variable(String name) implements Value {

        /** Validates the name. */
        public Variable {
            Preconditions.requireName(name, "Variable");
        }
    }

    /**
     * An integer literal.
     *
     * @param value the value
     */
    record IntValue(BigInteger value) implements Value {

        /** Validates the value. */
        public IntValue {
            Preconditions.requireNonNull(value, "Int value is required");
        }
    }

    /**
     * A float literal.
     *
     * <p>Two float literals are equal when they denote the same
     * number, regardless of how it was written.</p>
     *
     * @param value the value
     */
    record FloatValue(BigDecimal value) implements Value {

        /** Validates the value. */
        public FloatValue {
            Preconditions.requireNonNull(value, "Float value is required");
        }

        @Override
        public boolean equals(final Object other) {
            return other instanceof FloatValue that
                    && value.compareTo(that.value) == 0;
        }

        @Override
        public int hashCode() {
            return value.stripTrailingZeros().hashCode();
        }
    }

    /**
     * A string literal, block strings included.
     *
     * @param value the decoded value
     */
    record StringValue(String value) implements Value {

        /** Validates the value. */
        public StringValue {
            Preconditions.requireNonNull(value, "String value is required");
        }
    }

    /**
     * A boolean literal.
     *
     * @param value the value
     */
    record BooleanValue(boolean value) implements Value {
    }

    /** The null literal. */
    record NullValue() implements Value {
    }

    /**
     * An enum literal.
     *
     * @param name the enum value name
     */
    record EnumValue(String name) implements Value {

        /** Validates the name. */
        public EnumValue {
            Preconditions.requireName(name, "Enum value");
        }
    }

    /**
     * A list literal.
     *
     * @param values the elements
     */
    record ListValue(List<Value> values) implements Value {

        /** Copies the elements. */
        public ListValue {
            values = List.copyOf(values);
        }
    }

    /**
     * An input object literal.
     *
     * @param fields the fields, in document order
     */
    record ObjectValue(Map<String, Value> fields) implements Value {

        /** Copies the fields preserving their order. */
        public ObjectValue {
            fields = Collections.unmodifiableMap(
                    new LinkedHashMap<>(fields));
        }
    }

    /** Returns true if this value is, or contains, a variable. */
    default boolean hasVariables() {
        if (this instanceof Variable) {
            return true;
        }
        if (this instanceof ListValue list) {
            return list.values().stream().anyMatch(Value::hasVariables);
        }
        if (this instanceof ObjectValue object) {
            return object.fields().values().stream()
                    .anyMatch(Value::hasVariables);
        }
        return false;
    }
}
