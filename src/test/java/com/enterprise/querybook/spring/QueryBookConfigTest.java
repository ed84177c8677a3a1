package com.enterprise.querybook.spring;

import com.enterprise.querybook.example.pommr.Contact;
import com.enterprise.querybook.example.pommr.ContactQueryBook;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import static org.assertj.core.api.Assertions.*;

/**
 * Bean wiring of {@link QueryBookConfig} and binding of {@code querybook.*} properties.
 */
class QueryBookConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(DataSourceConfig.class, QueryBookConfig.class);

    @Test
    void wiresExecutionBeans() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(QueryExecutor.class);
            assertThat(ctx).hasSingleBean(BatchReaderFactory.class);
            assertThat(ctx).hasSingleBean(QueryBookRegistry.class);

            QueryBookProperties props = ctx.getBean(QueryBookProperties.class);
            assertThat(props.getFetchSize()).isEqualTo(1000);
            assertThat(props.getQueryTimeout()).isZero();
            assertThat(props.isLogSql()).isFalse();
        });
    }

    @Test
    void bindsProperties() {
        runner.withPropertyValues(
                        "querybook.fetch-size=50",
                        "querybook.query-timeout=30",
                        "querybook.log-sql=true")
                .run(ctx -> {
                    QueryBookProperties props = ctx.getBean(QueryBookProperties.class);
                    assertThat(props.getFetchSize()).isEqualTo(50);
                    assertThat(props.isLogSql()).isTrue();

                    QueryExecutor executor = ctx.getBean(QueryExecutor.class);
                    assertThat(executor.jdbcTemplate().getFetchSize()).isEqualTo(50);
                    assertThat(executor.jdbcTemplate().getQueryTimeout()).isEqualTo(30);
                });
    }

    @Test
    void executorRunsAgainstContextDataSource() {
        runner.run(ctx -> {
            EntityProvider<Contact> provider = new EntityProvider<>(ctx.getBean(QueryExecutor.class),
                    new ContactQueryBook());
            assertThat(provider.fetchAll()).hasSize(2);
        });
    }

    @Configuration
    static class DataSourceConfig {

        @Bean(destroyMethod = "shutdown")
        EmbeddedDatabase dataSource() {
            return PommrDatabase.create();
        }
    }
}
