package com.enterprise.querybook.sql.param;

import com.enterprise.querybook.sql.core.Dialects;
import com.enterprise.querybook.sql.core.SqlDialect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects parameter values in binding order and hands out the dialect
 * placeholder for each one. {@link #bind(Object)} returns {@code $n} where
 * {@code n} is the next position after {@code offset}, so a binder started
 * after the parameters already present in a query continues their sequence.
 *
 * <p>One binder belongs to one render pass; it is not shared between threads.
 */
public class ParameterBinder {

    /** Generic marker written in condition expressions, translated on render. */
    public static final String GENERIC_MARKER = "$?";

    private final List<Object> parameters = new ArrayList<>();
    private final SqlDialect dialect;
    private final int offset;

    public ParameterBinder() {
        this(Dialects.POSTGRES, 0);
    }

    public ParameterBinder(SqlDialect dialect, int offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        }
        this.dialect = dialect;
        this.offset = offset;
    }

    /** Binds a value and returns its placeholder (e.g. {@code $3}). */
    public String bind(Object value) {
        parameters.add(value);
        return dialect.placeholder(offset + parameters.size());
    }

    /**
     * Replaces each generic marker of {@code expression}, left to right, by the
     * placeholder of the matching value. Caller guarantees the counts agree.
     */
    public String bindAll(String expression, List<?> values) {
        StringBuilder sql = new StringBuilder(expression.length() + values.size() * 2);
        int from = 0;
        for (Object value : values) {
            int at = expression.indexOf(GENERIC_MARKER, from);
            if (at < 0) {
                throw new IllegalStateException(
                        "Fewer markers than values in expression: " + expression);
            }
            sql.append(expression, from, at).append(bind(value));
            from = at + GENERIC_MARKER.length();
        }
        sql.append(expression, from, expression.length());
        return sql.toString();
    }

    public static int countMarkers(String expression) {
        int count = 0;
        int at = expression.indexOf(GENERIC_MARKER);
        while (at >= 0) {
            count++;
            at = expression.indexOf(GENERIC_MARKER, at + GENERIC_MARKER.length());
        }
        return count;
    }

    public SqlDialect dialect() {
        return dialect;
    }

    /** Values bound by this binder, in binding order (excludes the offset). */
    public List<Object> getParameters() {
        return Collections.unmodifiableList(new ArrayList<>(parameters));
    }
}
