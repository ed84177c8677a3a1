package com.enterprise.querybook.spring;

import com.enterprise.querybook.sql.book.SqlEntity;
import com.enterprise.querybook.sql.query.Query;
import com.enterprise.querybook.sql.query.SqlResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.item.database.JdbcCursorItemReader;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * Builds streaming Spring Batch readers for rendered queries.
 *
 * <p>Where {@link QueryExecutor} materializes a result list, the reader
 * returned here walks a database cursor and hydrates rows one at a time:
 * <pre>{@code
 * @Bean
 * @StepScope
 * public JdbcCursorItemReader<Contact> contactReader(BatchReaderFactory factory) {
 *     ContactQueryBook book = new ContactQueryBook();
 *     return factory.cursorReader("contactReader", book.selectAll(), book.entity());
 * }
 * }</pre>
 */
public class BatchReaderFactory {

    private static final Logger log = LoggerFactory.getLogger(BatchReaderFactory.class);

    private final DataSource dataSource;
    private int fetchSize = 1000;
    private int queryTimeout = 0;

    public BatchReaderFactory(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    /**
     * Creates a {@link JdbcCursorItemReader} for the query. The query is
     * rendered and verified once, here.
     *
     * @param name reader name (used for restart data and logging)
     * @return configured reader; Spring calls afterPropertiesSet() in managed Steps
     */
    public <T> JdbcCursorItemReader<T> cursorReader(String name, Query query, SqlEntity<T> entity) {
        SqlResult result = query.render();
        result.verify();
        SqlResult.PositionalQuery pq = result.toPositional();
        log.debug("Reader '{}' on [{}]", name, result.sql());

        JdbcCursorItemReader<T> reader = new JdbcCursorItemReader<>();
        reader.setName(name);
        reader.setDataSource(dataSource);
        reader.setSql(pq.sql());
        reader.setRowMapper((rs, rowNum) -> entity.hydrate(rs));
        reader.setFetchSize(fetchSize);
        if (queryTimeout > 0) {
            reader.setQueryTimeout(queryTimeout);
        }
        reader.setPreparedStatementSetter(new ArgumentPreparedStatementSetter(pq.values()));
        return reader;
    }

    /** Fetch size hint. Default 1000. */
    public void setFetchSize(int fetchSize) {
        this.fetchSize = fetchSize;
    }

    /** Query timeout in seconds. 0 = no timeout (default). */
    public void setQueryTimeout(int seconds) {
        this.queryTimeout = seconds;
    }
}
