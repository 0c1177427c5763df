package com.templateweaver.core.node;

import java.math.BigInteger;

/**
 * A scalar leaf: string, integer, floating point number, boolean or null.
 *
 * <p>Integers are held as {@link Long} (or {@link BigInteger} when out of range) and
 * floating point values as {@link Double}, regardless of the source format, so that
 * trees parsed from YAML and JSON compare equal.
 *
 * @param value the scalar value, or {@code null} for a null scalar
 */
public record ScalarNode(Object value) implements DocumentNode {

    private static final ScalarNode NULL = new ScalarNode(null);

    /**
     * Compact constructor with validation.
     */
    public ScalarNode {
        if (value != null
            && !(value instanceof String)
            && !(value instanceof Long)
            && !(value instanceof BigInteger)
            && !(value instanceof Double)
            && !(value instanceof Boolean)) {
            throw new IllegalArgumentException("Unsupported scalar type: " + value.getClass().getName());
        }
    }

    public static ScalarNode of(String value) {
        return new ScalarNode(value);
    }

    public static ScalarNode of(long value) {
        return new ScalarNode(value);
    }

    public static ScalarNode of(double value) {
        return new ScalarNode(value);
    }

    public static ScalarNode of(boolean value) {
        return new ScalarNode(value);
    }

    public static ScalarNode nullValue() {
        return NULL;
    }

    public boolean isString() {
        return value instanceof String;
    }

    public boolean isNumber() {
        return value instanceof Number;
    }

    public boolean isBoolean() {
        return value instanceof Boolean;
    }

    public boolean isNull() {
        return value == null;
    }

    /**
     * Returns the value rendered as text; {@code null} stays {@code null}.
     *
     * @return textual form of the value
     */
    public String asText() {
        return value == null ? null : String.valueOf(value);
    }

    @Override
    public String describe() {
        if (value == null) {
            return "null";
        }
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        return "number";
    }
}
