package de.mirkosertic.mcp.queryexplainer.mcp.dto;

import de.mirkosertic.mcp.queryexplainer.mcp.SchemaGenerator.Description;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for the explainQueries tool.
 */
public record ExplainQueriesRequest(
        @Description("Lucene queries to explain. Invalid queries are reported per entry and do not fail the batch.")
        List<String> queries
) {
    public static ExplainQueriesRequest fromMap(final Map<String, Object> args) {
        final Object raw = args.get("queries");
        if (!(raw instanceof List<?> list)) {
            return new ExplainQueriesRequest(null);
        }
        final List<String> queries = new ArrayList<>(list.size());
        for (final Object entry : list) {
            queries.add(entry != null ? entry.toString() : null);
        }
        return new ExplainQueriesRequest(queries);
    }
}
