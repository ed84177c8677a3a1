package com.enterprise.querybook.sql.validation;

import java.util.regex.Pattern;

/**
 * Checks names that are spliced verbatim into SQL or templates: column and
 * field names, projection and source aliases, template variable names.
 *
 * <p>Only names are checked. Condition expressions are trusted SQL fragments
 * and values always travel as bound parameters, so neither passes through here.
 */
public final class SqlIdentifiers {

    private SqlIdentifiers() {}

    // optionally qualified: schema.table.column
    private static final Pattern NAME =
            Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    public static boolean isValid(String name) {
        return name != null && NAME.matcher(name).matches();
    }

    /**
     * @param role what the name designates, used in the error message
     * @return {@code name}
     * @throws IllegalArgumentException if {@code name} is not a plain or dotted SQL name
     */
    public static String requireValid(String name, String role) {
        if (!isValid(name)) {
            throw new IllegalArgumentException("Invalid " + role + " name '" + name + "'");
        }
        return name;
    }
}
