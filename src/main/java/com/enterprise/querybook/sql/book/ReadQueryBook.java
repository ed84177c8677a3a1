package com.enterprise.querybook.sql.book;

import com.enterprise.querybook.sql.condition.Condition;
import com.enterprise.querybook.sql.condition.Conditions;
import com.enterprise.querybook.sql.query.Query;

public interface ReadQueryBook<T> extends QueryBook<T> {

    String SELECT_DEFINITION = "select {:projection:} from {:source:} where {:condition:}";

    /** Override to select from joins or add grouping; must keep the {@code condition} slot. */
    default String selectDefinition() {
        return SELECT_DEFINITION;
    }

    default Query select(Condition condition) {
        return newQuery(selectDefinition()).setCondition("condition", condition);
    }

    /** Unfiltered select; the {@code where} keyword is omitted. */
    default Query selectAll() {
        return select(Conditions.none());
    }
}
