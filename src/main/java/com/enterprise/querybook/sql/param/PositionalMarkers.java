package com.enterprise.querybook.sql.param;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text transforms over numbered placeholders ({@code $1}, {@code $2}, ...).
 * Unaware of SQL syntax: a {@code $n} inside a string literal is treated as
 * a marker too.
 */
public final class PositionalMarkers {

    private PositionalMarkers() {}

    private static final Pattern NUMBERED = Pattern.compile("\\$(\\d+)");

    /** Marker indices in textual order, repeats included. */
    public static List<Integer> indices(String sql) {
        List<Integer> indices = new ArrayList<>();
        Matcher m = NUMBERED.matcher(sql);
        while (m.find()) {
            indices.add(Integer.parseInt(m.group(1)));
        }
        return indices;
    }

    /** Renumbers every {@code $n} to {@code $(n + offset)}. */
    public static String shift(String sql, int offset) {
        if (offset == 0) {
            return sql;
        }
        Matcher m = NUMBERED.matcher(sql);
        StringBuilder shifted = new StringBuilder(sql.length() + 8);
        while (m.find()) {
            int index = Integer.parseInt(m.group(1)) + offset;
            m.appendReplacement(shifted, Matcher.quoteReplacement("$" + index));
        }
        m.appendTail(shifted);
        return shifted.toString();
    }

    /**
     * Rewrites {@code $n} markers to JDBC {@code ?} and lays the values out in
     * occurrence order, so repeated or out-of-order markers still bind the
     * right value.
     *
     * @throws IllegalStateException if a marker has no matching value
     */
    public static Rewritten toOrdinal(String sql, List<?> values) {
        Matcher m = NUMBERED.matcher(sql);
        StringBuilder ordinal = new StringBuilder(sql.length());
        List<Object> ordered = new ArrayList<>();
        while (m.find()) {
            int index = Integer.parseInt(m.group(1));
            if (index < 1 || index > values.size()) {
                throw new IllegalStateException("SQL references $" + index
                        + " but only " + values.size() + " parameter(s) are bound");
            }
            ordered.add(values.get(index - 1));
            m.appendReplacement(ordinal, "?");
        }
        m.appendTail(ordinal);
        return new Rewritten(ordinal.toString(), ordered);
    }

    public record Rewritten(String sql, List<Object> values) {}
}
