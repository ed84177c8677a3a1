package com.enterprise.querybook.sql.condition;

import com.enterprise.querybook.sql.param.ParameterBinder;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

/**
 * Static factory for {@link Condition} instances.
 * Designed to be imported statically for a clean DSL.
 *
 * <pre>{@code
 * import static com.enterprise.querybook.sql.condition.Conditions.*;
 *
 * Condition byCompany = where("company_id = $?", companyId);
 *
 * // "a and (b or c)": the OR composite is parenthesized under AND
 * Condition c = where("email is not null")
 *     .and(where("name = $?", name).or(whereIn("phone_number", phones)));
 *
 * // Optional filters collapse to none() and vanish from the rendered text
 * Condition f = and(
 *     whereIfPresent("name = $?", params.get("name")),
 *     whereIfPresent("email = $?", params.get("email")));
 * }</pre>
 */
public final class Conditions {

    private Conditions() {}

    /**
     * Leaf condition. Use {@code $?} for each parameter.
     *
     * @throws ParameterCountMismatchException if markers and values disagree
     */
    public static Condition where(String expression, Object... values) {
        Objects.requireNonNull(expression, "expression");
        return new ExpressionCondition(expression, Arrays.asList(values));
    }

    /**
     * Returns {@link #none()} if value is null, otherwise a single-parameter leaf.
     */
    public static Condition whereIfPresent(String expression, Object value) {
        return value == null ? none() : where(expression, value);
    }

    public static Condition whereIn(String column, Collection<?> values) {
        return new InListCondition(column, values, false);
    }

    public static Condition whereNotIn(String column, Collection<?> values) {
        return new InListCondition(column, values, true);
    }

    /** The identity condition: renders to empty text with no parameters. */
    public static Condition none() {
        return EmptyCondition.INSTANCE;
    }

    /**
     * Left-folds with AND. Null and empty conditions are skipped;
     * returns {@link #none()} when nothing remains.
     */
    public static Condition and(Condition... conditions) {
        Condition result = none();
        for (Condition c : conditions) {
            result = result.and(c);
        }
        return result;
    }

    /**
     * Left-folds with OR. Null and empty conditions are skipped;
     * returns {@link #none()} when nothing remains.
     */
    public static Condition or(Condition... conditions) {
        Condition result = none();
        for (Condition c : conditions) {
            result = result.or(c);
        }
        return result;
    }

    /**
     * Wraps {@code condition} in parentheses when it is embedded next to other
     * SQL operators. Leaves an empty condition empty.
     */
    public static Condition group(Condition condition) {
        Objects.requireNonNull(condition, "condition");
        return condition.isEmpty() ? none() : new GroupedCondition(condition);
    }

    private record GroupedCondition(Condition inner) implements Condition {

        @Override
        public String toSql(ParameterBinder binder) {
            return "(" + inner.toSql(binder) + ")";
        }
    }

    private enum EmptyCondition implements Condition {
        INSTANCE;

        @Override
        public String toSql(ParameterBinder binder) {
            return "";
        }

        @Override
        public boolean isEmpty() {
            return true;
        }
    }
}
