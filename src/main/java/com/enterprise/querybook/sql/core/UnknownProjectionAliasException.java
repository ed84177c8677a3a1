package com.enterprise.querybook.sql.core;

/**
 * Raised when a strict {@link Projection} is asked to redefine an alias it
 * does not declare.
 */
public class UnknownProjectionAliasException extends IllegalArgumentException {

    private final String alias;

    public UnknownProjectionAliasException(String alias, Iterable<String> knownAliases) {
        super("Unknown projection alias '" + alias + "'. Known aliases are ["
                + String.join(", ", knownAliases) + "]");
        this.alias = alias;
    }

    public String alias() {
        return alias;
    }
}
