package com.enterprise.querybook.sql.book;

import com.enterprise.querybook.sql.core.Projection;
import com.enterprise.querybook.sql.core.Structure;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Describes how one entity type maps to SQL: its column {@link Structure},
 * the {@link Projection} a query selects to build it, and how a result row is
 * hydrated. The same definition supplies both projection and hydration, so the
 * columns selected are the columns read.
 *
 * @param <T> entity type
 */
public interface SqlEntity<T> {

    Structure structure();

    /** Defaults to every structure field selected as itself. */
    default Projection projection() {
        return Projection.defaultFor(structure());
    }

    /**
     * Maps the current row to an entity. Must not move the cursor.
     *
     * @throws HydrationException if the row data cannot build an entity
     * @throws SQLException       if the driver fails to read a column
     */
    T hydrate(ResultSet row) throws SQLException;
}
