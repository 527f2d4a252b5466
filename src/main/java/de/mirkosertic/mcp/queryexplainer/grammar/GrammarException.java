package de.mirkosertic.mcp.queryexplainer.grammar;

/**
 * Signals that a {@link GrammarParser} rejected a query string.
 */
public class GrammarException extends Exception {

    public GrammarException(final String message) {
        super(message);
    }

    public GrammarException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
