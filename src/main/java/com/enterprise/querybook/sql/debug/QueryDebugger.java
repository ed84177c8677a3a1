package com.enterprise.querybook.sql.debug;

import com.enterprise.querybook.sql.query.Query;
import com.enterprise.querybook.sql.query.SqlResult;

import java.util.List;
import java.util.Map;

/**
 * Debug utility: formats a {@link Query} showing its template, variables,
 * rendered SQL, JDBC positional SQL, values-inlined SQL and the parameter
 * list with types.
 */
public final class QueryDebugger {

    private QueryDebugger() {}

    public static String format(Query query) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== SQL Query Debug ===\n");

        sb.append("Template:\n  ").append(query.template()).append("\n");

        Map<String, String> variables = query.getVariables();
        sb.append("Variables (").append(variables.size()).append("):\n");
        for (Map.Entry<String, String> e : variables.entrySet()) {
            sb.append("  ").append(e.getKey()).append(" = ").append(e.getValue()).append("\n");
        }

        sb.append(format(query.render()));
        return sb.toString();
    }

    public static String format(SqlResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("SQL (").append(result.dialect()).append("):\n  ")
                .append(result.sql()).append("\n");

        SqlResult.PositionalQuery pq = result.toPositional();
        sb.append("SQL (positional):\n  ").append(pq.sql()).append("\n");

        sb.append("SQL (values inlined):\n  ").append(result.toDebugString()).append("\n");

        List<Object> params = result.parameters();
        sb.append("Parameters (").append(params.size()).append("):\n");
        for (int i = 0; i < params.size(); i++) {
            Object val = params.get(i);
            String typeName = val != null ? val.getClass().getSimpleName() : "null";
            sb.append("  ").append(result.dialect().placeholder(i + 1)).append(" = ").append(val)
                    .append(" (").append(typeName).append(")\n");
        }
        sb.append("======================");
        return sb.toString();
    }
}
