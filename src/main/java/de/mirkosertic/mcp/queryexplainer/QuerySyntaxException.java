package de.mirkosertic.mcp.queryexplainer;

/**
 * The single error kind reported by a {@link QueryExplainer}: the query is empty, rejected by the
 * grammar, or could not be turned into its representations.
 */
public class QuerySyntaxException extends Exception {

    public QuerySyntaxException(final String message) {
        super(message);
    }

    public QuerySyntaxException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
