package de.mirkosertic.mcp.queryexplainer.mcp.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.mcp.queryexplainer.QueryResult;

/**
 * Response DTO for the explainQuery and explainQueryFile tools.
 */
public record ExplainQueryResponse(
        boolean success,
        String query,
        @JsonProperty("deterministic_text") String deterministicText,
        @JsonProperty("narrative_text") String narrativeText,
        @JsonProperty("ast_json") ObjectNode astJson,
        String error
) {
    public static ExplainQueryResponse success(final QueryResult result) {
        return new ExplainQueryResponse(true, result.query(), result.deterministicText(),
                result.narrativeText(), result.astJson(), null);
    }

    public static ExplainQueryResponse error(final String errorMessage) {
        return new ExplainQueryResponse(false, null, null, null, null, errorMessage);
    }
}
