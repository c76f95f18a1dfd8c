package com.sentrius.props;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Loose numeric conversion and comparison used by the built-in rules.
 */
public final class Values {
    private static final Pattern NUMERIC = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private Values() {
    }

    /**
     * Convert a number, or a string that is entirely a decimal number, to a BigDecimal.
     * @param value The value to convert
     * @return The numeric value, or null if the value is not numeric
     */
    public static BigDecimal toNumber(Object value) {
        if (value == null || value instanceof Boolean) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return BigDecimal.valueOf(d);
        }
        if (value instanceof Number || value instanceof CharSequence) {
            String text = value.toString().trim();
            if (!NUMERIC.matcher(text).matches()) {
                return null;
            }
            try {
                return new BigDecimal(text);
            } catch (NumberFormatException e) {
                // exponent outside the int range
                return null;
            }
        }
        return null;
    }

    public static boolean isNumeric(Object value) {
        return toNumber(value) != null;
    }

    /**
     * True for integer-typed values and for numeric values without a fractional part.
     */
    public static boolean isIntegral(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return true;
        }
        BigDecimal number = toNumber(value);
        if (number == null) {
            return false;
        }
        return number.signum() == 0 || number.stripTrailingZeros().scale() <= 0;
    }

    /**
     * Loose equality between a value and a rule argument.
     * Numbers and numeric strings compare numerically, booleans compare
     * against their textual forms, everything else compares as text.
     */
    public static boolean looseEquals(Object value, String argument) {
        if (value == null) {
            return argument == null || argument.isEmpty();
        }
        if (argument == null) {
            return false;
        }

        if (value instanceof Boolean) {
            boolean b = (Boolean) value;
            if (b) {
                return "1".equals(argument) || "true".equalsIgnoreCase(argument);
            }
            return argument.isEmpty() || "0".equals(argument) || "false".equalsIgnoreCase(argument);
        }

        BigDecimal left = toNumber(value);
        BigDecimal right = toNumber(argument);
        if (left != null && right != null) {
            return left.compareTo(right) == 0;
        }
        if (value instanceof Number) {
            return false;
        }

        return value.toString().equals(argument);
    }

    /**
     * Compare two values numerically.
     * @return The comparison result, or null if either side is not numeric
     */
    public static Integer compareNumbers(Object left, Object right) {
        BigDecimal leftNum = toNumber(left);
        BigDecimal rightNum = toNumber(right);
        if (leftNum == null || rightNum == null) {
            return null;
        }
        return leftNum.compareTo(rightNum);
    }
}
