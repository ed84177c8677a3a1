package com.enterprise.querybook.sql.condition;

import com.enterprise.querybook.sql.param.ParameterBinder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Leaf condition: a literal SQL boolean expression with {@code $?} markers,
 * one bound value per marker. The text is emitted as written; only the
 * marker count is checked.
 */
public class ExpressionCondition implements Condition {

    private final String expression;
    private final List<Object> values;

    /**
     * @throws ParameterCountMismatchException if the marker count differs from {@code values.size()}
     */
    public ExpressionCondition(String expression, List<?> values) {
        Objects.requireNonNull(expression, "expression");
        int markers = ParameterBinder.countMarkers(expression);
        if (markers != values.size()) {
            throw new ParameterCountMismatchException(expression, markers, values.size());
        }
        this.expression = expression;
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public String expression() {
        return expression;
    }

    public List<Object> values() {
        return values;
    }

    @Override
    public String toSql(ParameterBinder binder) {
        return binder.bindAll(expression, values);
    }

    @Override
    public String toString() {
        return expression;
    }
}
