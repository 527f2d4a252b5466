package de.mirkosertic.mcp.queryexplainer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.mcp.queryexplainer.tree.Node;

/**
 * Result of explaining one query.
 *
 * @param query             the query exactly as passed in
 * @param deterministicText the fixed template rendering
 * @param narrativeText     the natural language sentence
 * @param astJson           the syntax tree as JSON
 * @param tree              the parsed syntax tree, not exported
 */
public record QueryResult(
        @JsonProperty("query") String query,
        @JsonProperty("deterministic_text") String deterministicText,
        @JsonProperty("narrative_text") String narrativeText,
        @JsonProperty("ast_json") ObjectNode astJson,
        @JsonIgnore Node tree
) {

    public QueryResult {
        // The JSON tree is mutable, keep a private copy
        astJson = astJson.deepCopy();
    }

    @Override
    public ObjectNode astJson() {
        return astJson.deepCopy();
    }
}
