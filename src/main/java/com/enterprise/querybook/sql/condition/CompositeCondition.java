package com.enterprise.querybook.sql.condition;

import com.enterprise.querybook.sql.param.ParameterBinder;

import java.util.Objects;

/**
 * Binary AND/OR node. A child is wrapped in parentheses exactly when it is
 * itself a composite, so {@code a and (b or c)} keeps its meaning while a
 * lone leaf is never parenthesized.
 * Created via {@link Condition#and}/{@link Condition#or}.
 */
public class CompositeCondition implements Condition {

    public enum Logic {
        AND("and"), OR("or");

        private final String keyword;

        Logic(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    private final Condition left;
    private final Logic logic;
    private final Condition right;

    public CompositeCondition(Condition left, Logic logic, Condition right) {
        this.left = Objects.requireNonNull(left, "left");
        this.logic = Objects.requireNonNull(logic, "logic");
        this.right = Objects.requireNonNull(right, "right");
    }

    public Condition left() { return left; }
    public Logic logic() { return logic; }
    public Condition right() { return right; }

    @Override
    public String toSql(ParameterBinder binder) {
        // left first: binding order follows textual order
        String lhs = operand(left, binder);
        String rhs = operand(right, binder);
        return lhs + " " + logic.keyword() + " " + rhs;
    }

    private static String operand(Condition child, ParameterBinder binder) {
        String sql = child.toSql(binder);
        return child instanceof CompositeCondition ? "(" + sql + ")" : sql;
    }
}
