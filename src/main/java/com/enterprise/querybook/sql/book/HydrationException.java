package com.enterprise.querybook.sql.book;

/**
 * A result row could not be mapped to an entity.
 */
public class HydrationException extends RuntimeException {

    public HydrationException(String message) {
        super(message);
    }

    public HydrationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static HydrationException invalidData(String column, Object value) {
        return new HydrationException("Invalid data in column '" + column + "': " + value);
    }

    public static HydrationException missingColumn(String column, Throwable cause) {
        return new HydrationException("Column '" + column + "' is missing from the result row", cause);
    }
}
