package com.enterprise.querybook.spring;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Wires the query execution beans from a {@link DataSource}.
 * Import this configuration or let component scanning pick it up:
 * <pre>{@code
 * @Import(QueryBookConfig.class)
 * @Configuration
 * public class PersistenceConfig { ... }
 * }</pre>
 *
 * <p>Tune through properties:
 * <pre>
 * querybook.fetch-size=5000
 * querybook.query-timeout=300
 * querybook.log-sql=true
 * </pre>
 */
@Configuration
@EnableConfigurationProperties(QueryBookProperties.class)
public class QueryBookConfig {

    @Bean
    @ConditionalOnMissingBean
    public QueryExecutor queryExecutor(DataSource dataSource, QueryBookProperties properties) {
        QueryExecutor executor = new QueryExecutor(dataSource);
        executor.setFetchSize(properties.getFetchSize());
        executor.setQueryTimeout(properties.getQueryTimeout());
        executor.setLogSql(properties.isLogSql());
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public BatchReaderFactory batchReaderFactory(DataSource dataSource, QueryBookProperties properties) {
        BatchReaderFactory factory = new BatchReaderFactory(dataSource);
        factory.setFetchSize(properties.getFetchSize());
        factory.setQueryTimeout(properties.getQueryTimeout());
        return factory;
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryBookRegistry queryBookRegistry() {
        return new QueryBookRegistry();
    }
}
