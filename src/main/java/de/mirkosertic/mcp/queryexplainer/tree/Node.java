package de.mirkosertic.mcp.queryexplainer.tree;

/**
 * One element of a parsed query syntax tree.
 *
 * <p>Nodes are produced by a {@link de.mirkosertic.mcp.queryexplainer.grammar.GrammarParser}
 * and are immutable. Every variant is a record, so two structurally identical subtrees are
 * {@code equals} and render identically.</p>
 *
 * <p>The renderer and the serializer both dispatch over the permitted variants. A variant added
 * here must be handled in both places.</p>
 */
public sealed interface Node
        permits Word, Phrase, SearchField, Group, FieldGroup,
        OrOperation, AndOperation, Not, UnknownOperation, Unsupported {

    /**
     * Name of the variant as exported in the AST JSON.
     */
    String typeName();
}
