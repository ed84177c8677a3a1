package com.enterprise.querybook.sql.book;

import com.enterprise.querybook.sql.core.Structure;
import com.enterprise.querybook.sql.query.Query;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public interface InsertQueryBook<T> extends QueryBook<T> {

    String INSERT_DEFINITION =
            "insert into {:source:} ({:structure:}) values ({:values:}) returning {:projection:}";

    default String insertDefinition() {
        return INSERT_DEFINITION;
    }

    /**
     * Inserts one row. Columns are listed in structure order; columns absent
     * from {@code values} are left to their database default.
     *
     * @throws IllegalArgumentException if a key is not a structure field, or values is empty
     */
    default Query insert(Map<String, ?> values) {
        Structure structure = entity().structure();
        for (String column : values.keySet()) {
            if (!structure.contains(column)) {
                throw new IllegalArgumentException("Column '" + column
                        + "' is not part of the structure of " + sqlSource());
            }
        }
        if (values.isEmpty()) {
            throw new IllegalArgumentException("insert into " + sqlSource() + " needs at least one value");
        }

        Query query = newQuery(insertDefinition());
        List<String> columns = new ArrayList<>();
        List<String> placeholders = new ArrayList<>();
        for (String column : structure.columnNames()) {
            if (values.containsKey(column)) {
                columns.add(column);
                query.addParameter(values.get(column));
                placeholders.add(dialect().placeholder(query.getParameters().size()));
            }
        }
        return query
                .setVariable("structure", String.join(", ", columns))
                .setVariable("values", String.join(", ", placeholders));
    }
}
