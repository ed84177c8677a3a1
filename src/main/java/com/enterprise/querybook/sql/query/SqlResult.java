package com.enterprise.querybook.sql.query;

import com.enterprise.querybook.sql.core.Dialects;
import com.enterprise.querybook.sql.core.SqlDialect;
import com.enterprise.querybook.sql.core.SourceAliases;
import com.enterprise.querybook.sql.param.PositionalMarkers;
import com.enterprise.querybook.sql.param.SqlLiteralFormatter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * SQL text plus the ordered parameters its placeholders bind to. Produced by
 * {@link com.enterprise.querybook.sql.condition.Condition#expand()} for a
 * fragment and by {@link Query#render()} for a complete statement.
 */
public class SqlResult {

    private final String sql;
    private final List<Object> parameters;
    private final SqlDialect dialect;

    public SqlResult(String sql, List<?> parameters) {
        this(sql, parameters, Dialects.POSTGRES);
    }

    public SqlResult(String sql, List<?> parameters, SqlDialect dialect) {
        this.sql = Objects.requireNonNull(sql, "sql");
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    public String sql() { return sql; }

    public List<Object> parameters() { return parameters; }

    public SqlDialect dialect() { return dialect; }

    public boolean isBlank() {
        return sql.isBlank();
    }

    /**
     * Renumbers the placeholders by {@code offset}, for embedding this
     * fragment after {@code offset} parameters that are already bound.
     * Ordinal dialects need no renumbering.
     */
    public SqlResult shift(int offset) {
        if (!dialect.numberedPlaceholders()) {
            return this;
        }
        return new SqlResult(PositionalMarkers.shift(sql, offset), parameters, dialect);
    }

    /** Resolves {@code {:slot:}} source aliases in the text. */
    public SqlResult withSourceAliases(SourceAliases aliases) {
        return new SqlResult(aliases.apply(sql), parameters, dialect);
    }

    /** Converts numbered placeholders to JDBC {@code ?} in occurrence order. */
    public PositionalQuery toPositional() {
        if (!dialect.numberedPlaceholders()) {
            return new PositionalQuery(sql, parameters.toArray());
        }
        PositionalMarkers.Rewritten rewritten = PositionalMarkers.toOrdinal(sql, parameters);
        return new PositionalQuery(rewritten.sql(), rewritten.values().toArray());
    }

    /** Returns the SQL with all parameter values inlined for debugging. Never fails on value types. */
    public String toDebugString() {
        PositionalQuery pq = toPositional();
        StringBuilder inlined = new StringBuilder();
        int from = 0;
        for (Object value : pq.values()) {
            int at = pq.sql().indexOf('?', from);
            if (at < 0) {
                break;
            }
            inlined.append(pq.sql(), from, at).append(SqlLiteralFormatter.formatForDisplay(value));
            from = at + 1;
        }
        inlined.append(pq.sql(), from, pq.sql().length());
        return inlined.toString();
    }

    /**
     * Verifies that every placeholder has a parameter and every parameter is
     * referenced at least once.
     */
    public void verify() {
        if (!dialect.numberedPlaceholders()) {
            long markers = sql.chars().filter(c -> c == '?').count();
            if (markers != parameters.size()) {
                throw new IllegalStateException("SQL has " + markers
                        + " placeholder(s) but " + parameters.size() + " parameter(s) are bound");
            }
            return;
        }
        Set<Integer> referenced = new TreeSet<>();
        for (int index : PositionalMarkers.indices(sql)) {
            if (index < 1 || index > parameters.size()) {
                throw new IllegalStateException("SQL references $" + index
                        + " but only " + parameters.size() + " parameter(s) are bound");
            }
            referenced.add(index);
        }
        if (referenced.size() != parameters.size()) {
            throw new IllegalStateException(parameters.size() + " parameter(s) are bound but SQL"
                    + " only references " + referenced);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SqlResult other
                && sql.equals(other.sql)
                && parameters.equals(other.parameters)
                && dialect.equals(other.dialect);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sql, parameters);
    }

    @Override
    public String toString() {
        return sql + " " + parameters;
    }

    public record PositionalQuery(String sql, Object[] values) {}
}
