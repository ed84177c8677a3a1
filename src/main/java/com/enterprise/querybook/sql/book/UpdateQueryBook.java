package com.enterprise.querybook.sql.book;

import com.enterprise.querybook.sql.condition.Condition;
import com.enterprise.querybook.sql.core.Structure;
import com.enterprise.querybook.sql.query.Query;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public interface UpdateQueryBook<T> extends QueryBook<T> {

    String UPDATE_DEFINITION =
            "update {:source:} set {:updates:} where {:condition:} returning {:projection:}";

    default String updateDefinition() {
        return UPDATE_DEFINITION;
    }

    /**
     * Updates matching rows. The assigned values are bound first, the
     * condition's placeholders continue the numbering after them.
     *
     * @throws IllegalArgumentException if a key is not a structure field, or updates is empty
     */
    default Query update(Map<String, ?> updates, Condition condition) {
        if (updates.isEmpty()) {
            throw new IllegalArgumentException("update of " + sqlSource() + " needs at least one column");
        }
        Structure structure = entity().structure();
        Query query = newQuery(updateDefinition());
        List<String> assignments = new ArrayList<>();
        for (Map.Entry<String, ?> update : updates.entrySet()) {
            if (!structure.contains(update.getKey())) {
                throw new IllegalArgumentException("Column '" + update.getKey()
                        + "' is not part of the structure of " + sqlSource());
            }
            query.addParameter(update.getValue());
            assignments.add(update.getKey() + " = "
                    + dialect().placeholder(query.getParameters().size()));
        }
        return query
                .setVariable("updates", String.join(", ", assignments))
                .setCondition("condition", condition);
    }
}
