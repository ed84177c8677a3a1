package com.enterprise.querybook.sql.book;

import com.enterprise.querybook.sql.core.Dialects;
import com.enterprise.querybook.sql.core.SqlDialect;
import com.enterprise.querybook.sql.query.Query;

/**
 * The queries of one SQL source (table, view, function, sub-query) for one
 * entity type. Capabilities are added by the sub-interfaces
 * {@link ReadQueryBook}, {@link InsertQueryBook}, {@link UpdateQueryBook} and
 * {@link DeleteQueryBook}, whose default methods build the {@link Query}.
 *
 * <p>Implementations must be stateless: every call builds a fresh query.
 *
 * @param <T> entity type
 */
public interface QueryBook<T> {

    /** SQL text of the source, e.g. {@code pommr.contact}. */
    String sqlSource();

    SqlEntity<T> entity();

    default SqlDialect dialect() {
        return Dialects.POSTGRES;
    }

    /**
     * Query on {@code definition} with {@code source}, {@code projection} and
     * {@code structure} already set.
     */
    default Query newQuery(String definition) {
        return new Query(definition, dialect())
                .setVariable("source", sqlSource())
                .setVariable("projection", entity().projection().render())
                .setVariable("structure", entity().structure().columnList());
    }
}
