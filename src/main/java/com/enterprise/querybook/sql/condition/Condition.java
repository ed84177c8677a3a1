package com.enterprise.querybook.sql.condition;

import com.enterprise.querybook.sql.param.ParameterBinder;
import com.enterprise.querybook.sql.query.SqlResult;

/**
 * A boolean SQL fragment that carries its own bound parameters.
 *
 * <p>Conditions are immutable trees. {@link #and(Condition)} and
 * {@link #or(Condition)} build a new composite; the empty condition
 * ({@link Conditions#none()}) is an identity on both sides. Rendering walks
 * the tree depth-first, left to right, binding values through one
 * {@link ParameterBinder} so placeholders come out numbered {@code 1..n}
 * in textual order.
 */
public interface Condition {

    /** Renders this node, binding its values in order through {@code binder}. */
    String toSql(ParameterBinder binder);

    default boolean isEmpty() {
        return false;
    }

    default Condition and(Condition other) {
        return combine(CompositeCondition.Logic.AND, other);
    }

    default Condition or(Condition other) {
        return combine(CompositeCondition.Logic.OR, other);
    }

    private Condition combine(CompositeCondition.Logic logic, Condition other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        return new CompositeCondition(this, logic, other);
    }

    /** Renders with placeholders numbered from 1. */
    default SqlResult expand() {
        return expand(new ParameterBinder());
    }

    /** Renders continuing the sequence of {@code binder}. */
    default SqlResult expand(ParameterBinder binder) {
        String sql = toSql(binder);
        return new SqlResult(sql, binder.getParameters(), binder.dialect());
    }
}
