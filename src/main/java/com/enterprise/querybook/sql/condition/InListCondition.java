package com.enterprise.querybook.sql.condition;

import com.enterprise.querybook.sql.param.ParameterBinder;
import com.enterprise.querybook.sql.validation.SqlIdentifiers;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code col [not] in ($1, $2, ...)}, one placeholder per value.
 * Empty list rejected at construction.
 */
public class InListCondition implements Condition {

    private final String column;
    private final List<Object> values;
    private final boolean negated;

    public InListCondition(String column, Collection<?> values, boolean negated) {
        SqlIdentifiers.requireValid(column, "column");
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("IN list for '" + column + "' must not be empty");
        }
        this.column = column;
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
        this.negated = negated;
    }

    public List<Object> values() {
        return values;
    }

    @Override
    public String toSql(ParameterBinder binder) {
        String params = values.stream()
                .map(binder::bind)
                .collect(Collectors.joining(", "));
        return column + (negated ? " not in (" : " in (") + params + ")";
    }
}
