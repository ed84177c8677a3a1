package com.enterprise.querybook.spring;

import com.enterprise.querybook.sql.book.SqlEntity;
import com.enterprise.querybook.sql.debug.QueryDebugger;
import com.enterprise.querybook.sql.query.Query;
import com.enterprise.querybook.sql.query.SqlResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import javax.sql.DataSource;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs rendered {@link Query} instances through Spring's {@link JdbcTemplate}.
 *
 * <p>Each query is rendered, verified, and its numbered placeholders are
 * converted to JDBC {@code ?} via {@link SqlResult#toPositional()} before being
 * bound with an {@link ArgumentPreparedStatementSetter}. Rows are hydrated by
 * the {@link SqlEntity} that supplied the projection.
 *
 * <p>Thread-safe: holds no state besides the template.
 */
public class QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(QueryExecutor.class);

    private final JdbcTemplate jdbcTemplate;
    private boolean logSql;

    public QueryExecutor(DataSource dataSource) {
        this(new JdbcTemplate(Objects.requireNonNull(dataSource, "dataSource")));
    }

    public QueryExecutor(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
    }

    /** Fetches every row of the query, hydrated by {@code entity}. */
    public <T> List<T> fetch(Query query, SqlEntity<T> entity) {
        SqlResult.PositionalQuery pq = prepare(query);
        RowMapper<T> mapper = (rs, rowNum) -> entity.hydrate(rs);
        List<T> rows = jdbcTemplate.query(pq.sql(),
                new ArgumentPreparedStatementSetter(pq.values()), mapper);
        log.debug("Fetched {} row(s)", rows.size());
        return rows;
    }

    /** First row of the query, if any. */
    public <T> Optional<T> fetchOne(Query query, SqlEntity<T> entity) {
        return fetch(query, entity).stream().findFirst();
    }

    /** Executes a statement that returns no rows and reports the update count. */
    public int execute(Query query) {
        SqlResult.PositionalQuery pq = prepare(query);
        int updated = jdbcTemplate.update(pq.sql(), new ArgumentPreparedStatementSetter(pq.values()));
        log.debug("Statement affected {} row(s)", updated);
        return updated;
    }

    /**
     * Renders and verifies the query without executing it.
     * Useful for logging, testing, and dry-run scenarios.
     */
    public SqlResult resolve(Query query) {
        SqlResult result = query.render();
        result.verify();
        return result;
    }

    private SqlResult.PositionalQuery prepare(Query query) {
        SqlResult result = resolve(query);
        if (logSql && log.isDebugEnabled()) {
            log.debug("Executing query\n{}", QueryDebugger.format(query));
        } else {
            log.debug("Executing [{}] with {} parameter(s)", result.sql(), result.parameters().size());
        }
        return result.toPositional();
    }

    public JdbcTemplate jdbcTemplate() {
        return jdbcTemplate;
    }

    /** Logs the full debug dump (values inlined) of each query at DEBUG. Default false. */
    public void setLogSql(boolean logSql) {
        this.logSql = logSql;
    }

    /** Fetch size hint. */
    public void setFetchSize(int fetchSize) {
        jdbcTemplate.setFetchSize(fetchSize);
    }

    /** Query timeout in seconds. 0 = no timeout (default). */
    public void setQueryTimeout(int seconds) {
        jdbcTemplate.setQueryTimeout(seconds);
    }
}
