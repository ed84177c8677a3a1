package com.enterprise.querybook.sql.core;

/**
 * Placeholder convention of the target database driver.
 * Generic {@code $?} markers are translated through this interface only.
 */
public interface SqlDialect {

    /** Placeholder for the 1-based parameter position, e.g. {@code $3} or {@code ?}. */
    String placeholder(int position);

    /** True when placeholders carry their position ({@code $n}), false for ordinal {@code ?}. */
    boolean numberedPlaceholders();
}
