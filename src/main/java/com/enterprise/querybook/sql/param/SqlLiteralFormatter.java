package com.enterprise.querybook.sql.param;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Converts typed Java values to PostgreSQL literals. Only used to produce
 * human-readable debug output; executed SQL always binds parameters.
 */
public final class SqlLiteralFormatter {

    private SqlLiteralFormatter() {}

    /**
     * @throws IllegalArgumentException if the type is not supported
     */
    public static String format(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String s) {
            return quote(s);
        }
        if (value instanceof Character || value instanceof Enum<?>) {
            return quote(value.toString());
        }
        if (value instanceof BigDecimal bd) {
            return bd.toPlainString();
        }
        if (value instanceof Number n) {
            return n.toString();
        }
        if (value instanceof Boolean b) {
            return b ? "true" : "false";
        }
        if (value instanceof UUID uuid) {
            return "'" + uuid + "'::uuid";
        }
        if (value instanceof LocalDate ld) {
            return "DATE '" + ld + "'";
        }
        if (value instanceof LocalDateTime || value instanceof OffsetDateTime || value instanceof Instant) {
            return "TIMESTAMP '" + value + "'";
        }

        throw new IllegalArgumentException(
                "Unsupported literal type: " + value.getClass().getName());
    }

    /**
     * Like {@link #format(Object)}, but renders unsupported types as a quoted
     * {@code toString()} (byte arrays as a length note) instead of failing.
     * For log output only.
     */
    public static String formatForDisplay(Object value) {
        if (value instanceof byte[] bytes) {
            return "<" + bytes.length + " bytes>";
        }
        try {
            return format(value);
        } catch (IllegalArgumentException e) {
            return quote(String.valueOf(value));
        }
    }

    private static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }
}
