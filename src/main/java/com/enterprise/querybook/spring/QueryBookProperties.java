package com.enterprise.querybook.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the query execution beans, bound from {@code querybook.*}.
 */
@ConfigurationProperties(prefix = "querybook")
public class QueryBookProperties {

    /** JDBC fetch size hint for executors and cursor readers. */
    private int fetchSize = 1000;

    /** Statement timeout in seconds, 0 for none. */
    private int queryTimeout = 0;

    /** Log every executed query with its values inlined (DEBUG level). */
    private boolean logSql = false;

    public int getFetchSize() { return fetchSize; }
    public void setFetchSize(int fetchSize) { this.fetchSize = fetchSize; }

    public int getQueryTimeout() { return queryTimeout; }
    public void setQueryTimeout(int queryTimeout) { this.queryTimeout = queryTimeout; }

    public boolean isLogSql() { return logSql; }
    public void setLogSql(boolean logSql) { this.logSql = logSql; }
}
