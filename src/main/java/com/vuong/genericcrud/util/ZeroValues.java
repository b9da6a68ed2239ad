package com.vuong.genericcrud.util;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Zero-value rules used by by-example filtering and primary key checks.
 * <p>
 * An attribute is at its zero value when it holds what an uninitialized field of
 * its declared type holds: {@code null} for references, {@code 0}, {@code false}
 * or {@code '\0'} for primitives. Such attributes never produce a filter, so
 * by-example filtering cannot ask for "attribute is null" or "attribute is 0" on a
 * primitive; use a structured query for that.
 */
public final class ZeroValues {

    private ZeroValues() {
        // Utility class
    }

    /**
     * Checks an attribute value against the zero value of its declared type.
     * @param declaredType the declared field type
     * @param value the current value, boxed for primitives
     * @return true when the value is the zero value of the declared type
     */
    public static boolean isZeroValue(Class<?> declaredType, Object value) {
        if (value == null) {
            return true;
        }
        if (!declaredType.isPrimitive()) {
            return false;
        }
        return isZero(value);
    }

    /**
     * Returns the zero value of a declared type, boxed for primitives.
     */
    public static Object zeroValueOf(Class<?> declaredType) {
        if (!declaredType.isPrimitive()) {
            return null;
        }
        if (declaredType == boolean.class) {
            return false;
        }
        if (declaredType == char.class) {
            return '\0';
        }
        if (declaredType == long.class) {
            return 0L;
        }
        if (declaredType == double.class) {
            return 0d;
        }
        if (declaredType == float.class) {
            return 0f;
        }
        if (declaredType == short.class) {
            return (short) 0;
        }
        if (declaredType == byte.class) {
            return (byte) 0;
        }
        return 0;
    }

    /**
     * Checks a key-like value: {@code null}, numeric zero, {@code false},
     * {@code '\0'} and the empty string all count as zero.
     * @param value the value to test
     * @return true when the value is considered unassigned
     */
    public static boolean isZero(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Boolean b) {
            return !b;
        }
        if (value instanceof Character c) {
            return c == '\0';
        }
        if (value instanceof CharSequence s) {
            return s.length() == 0;
        }
        if (value instanceof BigDecimal d) {
            return d.signum() == 0;
        }
        if (value instanceof BigInteger i) {
            return i.signum() == 0;
        }
        if (value instanceof Double d) {
            return d == 0d;
        }
        if (value instanceof Float f) {
            return f == 0f;
        }
        if (value instanceof Number n) {
            return n.longValue() == 0L;
        }
        return false;
    }
}
