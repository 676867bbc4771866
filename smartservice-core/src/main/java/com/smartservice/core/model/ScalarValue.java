package com.smartservice.core.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Scalar value of an open {@code extra} mapping.
 *
 * <p>Restricted to a closed set of variants so downstream collaborators dispatch on
 * {@link Type} rather than inspecting runtime classes.
 *
 * @param type value variant
 * @param value the value: {@link String}, {@link BigDecimal} or {@link Boolean} matching {@code type}
 */
public record ScalarValue(
    Type type,
    Object value
) {
    /**
     * Scalar variants.
     */
    public enum Type {
        STRING,
        NUMBER,
        BOOLEAN
    }

    /**
     * Compact constructor with validation.
     */
    public ScalarValue {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Class<?> expected = switch (type) {
            case STRING -> String.class;
            case NUMBER -> BigDecimal.class;
            case BOOLEAN -> Boolean.class;
        };
        if (!expected.isInstance(value)) {
            throw new IllegalArgumentException(
                "value of type " + type + " must be a " + expected.getSimpleName() + ": " + value);
        }
    }

    public static ScalarValue ofString(String value) {
        return new ScalarValue(Type.STRING, value);
    }

    public static ScalarValue ofNumber(BigDecimal value) {
        return new ScalarValue(Type.NUMBER, value);
    }

    public static ScalarValue ofBoolean(boolean value) {
        return new ScalarValue(Type.BOOLEAN, value);
    }

    public String asString() {
        return value.toString();
    }
}
