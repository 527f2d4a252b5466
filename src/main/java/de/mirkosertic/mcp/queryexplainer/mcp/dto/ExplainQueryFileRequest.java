package de.mirkosertic.mcp.queryexplainer.mcp.dto;

import de.mirkosertic.mcp.queryexplainer.mcp.SchemaGenerator.Description;

import java.util.Map;

/**
 * Request DTO for the explainQueryFile tool.
 */
public record ExplainQueryFileRequest(
        @Description("Absolute path of a UTF-8 text file containing a single Lucene query")
        String path
) {
    public static ExplainQueryFileRequest fromMap(final Map<String, Object> args) {
        return new ExplainQueryFileRequest((String) args.get("path"));
    }
}
