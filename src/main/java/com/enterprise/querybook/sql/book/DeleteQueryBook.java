package com.enterprise.querybook.sql.book;

import com.enterprise.querybook.sql.condition.Condition;
import com.enterprise.querybook.sql.query.Query;

public interface DeleteQueryBook<T> extends QueryBook<T> {

    String DELETE_DEFINITION = "delete from {:source:} where {:condition:} returning {:projection:}";

    default String deleteDefinition() {
        return DELETE_DEFINITION;
    }

    /** Deletes matching rows and returns them. An empty condition deletes every row. */
    default Query delete(Condition condition) {
        return newQuery(deleteDefinition()).setCondition("condition", condition);
    }
}
