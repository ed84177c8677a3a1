package com.enterprise.querybook.sql.core;

import java.util.Objects;

/** One output column of a {@link Projection}: {@code expression as alias}. */
public record ProjectionField(String alias, String expression) {

    public ProjectionField {
        Objects.requireNonNull(alias, "alias");
        Objects.requireNonNull(expression, "expression");
    }

    public String render() {
        return expression + " as " + alias;
    }
}
