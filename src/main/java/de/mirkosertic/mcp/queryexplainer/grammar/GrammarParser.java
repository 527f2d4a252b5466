package de.mirkosertic.mcp.queryexplainer.grammar;

import de.mirkosertic.mcp.queryexplainer.tree.Node;

/**
 * Turns raw query syntax into a {@link Node} tree.
 *
 * <p>Implementations must be safe for concurrent use; each call receives no shared mutable
 * context.</p>
 */
public interface GrammarParser {

    /**
     * Parses a query string.
     *
     * @param query the raw query syntax
     * @return the root of the parsed tree
     * @throws GrammarException if the query is not valid syntax
     */
    Node parse(String query) throws GrammarException;
}
