package com.enterprise.querybook.sql.book;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Typed column reads for {@link SqlEntity#hydrate(ResultSet)} implementations,
 * turning absent columns and unexpected nulls into {@link HydrationException}.
 */
public final class ResultColumns {

    private ResultColumns() {}

    /**
     * Reads a NOT NULL column.
     *
     * @throws HydrationException if the column is not in the row or holds null
     */
    public static <V> V required(ResultSet row, String column, Class<V> type) throws SQLException {
        V value = optional(row, column, type);
        if (value == null) {
            throw HydrationException.invalidData(column, null);
        }
        return value;
    }

    /**
     * Reads a nullable column.
     *
     * @throws HydrationException if the column is not in the row
     */
    public static <V> V optional(ResultSet row, String column, Class<V> type) throws SQLException {
        int index;
        try {
            index = row.findColumn(column);
        } catch (SQLException e) {
            throw HydrationException.missingColumn(column, e);
        }
        return row.getObject(index, type);
    }
}
