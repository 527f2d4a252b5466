package de.mirkosertic.mcp.queryexplainer.mcp.dto;

import de.mirkosertic.mcp.queryexplainer.mcp.SchemaGenerator.Description;

import java.util.Map;

/**
 * Request DTO for the explainQuery tool.
 */
public record ExplainQueryRequest(
        @Description("Lucene query to explain, e.g. 'title:(\"Machine Learning\" OR \"AI\")' or '(\"a\" OR \"b\") NOT \"c\"'")
        String query
) {
    public static ExplainQueryRequest fromMap(final Map<String, Object> args) {
        return new ExplainQueryRequest((String) args.get("query"));
    }
}
