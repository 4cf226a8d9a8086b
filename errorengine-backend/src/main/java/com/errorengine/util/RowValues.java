package com.errorengine.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;

/**
 * Explicit coercions applied to fetched row values. Rows are ordered maps of column name to scalar;
 * every comparison and signature goes through these helpers so SQL and HTTP rows behave the same.
 */
public final class RowValues {

    private RowValues() {
    }

    /**
     * Look up a field by name, falling back to a case-insensitive match.
     *
     * @param row row
     * @param field field name
     * @return the column value, or null when absent or null
     */
    public static Object lookup(Map<String, Object> row, String field) {
        if (row == null || field == null) {
            return null;
        }
        if (row.containsKey(field)) {
            return row.get(field);
        }
        for (Map.Entry<String, Object> e : row.entrySet()) {
            if (field.equalsIgnoreCase(e.getKey())) {
                return e.getValue();
            }
        }
        return null;
    }

    /**
     * Resolve the actual column name for a field, case-insensitively.
     *
     * @param row row
     * @param field field name
     * @return column name as present in the row, empty when the row has no such column
     */
    public static Optional<String> findColumn(Map<String, Object> row, String field) {
        if (row == null || field == null) {
            return Optional.empty();
        }
        if (row.containsKey(field)) {
            return Optional.of(field);
        }
        return row.keySet().stream().filter(field::equalsIgnoreCase).findFirst();
    }

    /**
     * Text form of a scalar: null becomes "", numbers are rendered in plain decimal form without
     * trailing zeros (so {@code 42}, {@code 42.0} and {@code "42"} agree), everything else uses
     * {@link String#valueOf(Object)}.
     *
     * @param value value
     * @return text form, never null
     */
    public static String asText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal bd) {
            return plain(bd);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return String.valueOf(value);
            }
            return plain(new BigDecimal(value.toString()));
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return value.toString();
        }
        return String.valueOf(value);
    }

    /**
     * Normalized text used in key signatures: {@link #asText(Object)} trimmed.
     *
     * @param value value
     * @return normalized text
     */
    public static String normalize(Object value) {
        return asText(value).trim();
    }

    /**
     * Parse text as a decimal number.
     *
     * @param text text
     * @return the number, empty when the text is blank or not numeric
     */
    public static Optional<BigDecimal> parseNumber(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String t = text.trim();
        if (t.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(t));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Coarse type name used when listing available fields.
     *
     * @param value sample value
     * @return one of number, boolean, string, null
     */
    public static String typeOf(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        return "string";
    }

    private static String plain(BigDecimal bd) {
        if (bd.signum() == 0) {
            return "0";
        }
        return bd.stripTrailingZeros().toPlainString();
    }
}
