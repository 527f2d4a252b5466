package de.mirkosertic.mcp.queryexplainer;

/**
 * Explains a Lucene query as deterministic text, narrative text and AST JSON.
 */
public interface QueryExplainer {

    /**
     * Parses and explains a query.
     *
     * @param query the raw query string
     * @return the complete result, never partial
     * @throws QuerySyntaxException if the query is empty, invalid, or cannot be explained
     */
    QueryResult parse(String query) throws QuerySyntaxException;
}
