package de.mirkosertic.mcp.queryexplainer.render;

import de.mirkosertic.mcp.queryexplainer.tree.AndOperation;
import de.mirkosertic.mcp.queryexplainer.tree.FieldGroup;
import de.mirkosertic.mcp.queryexplainer.tree.Group;
import de.mirkosertic.mcp.queryexplainer.tree.Node;
import de.mirkosertic.mcp.queryexplainer.tree.Not;
import de.mirkosertic.mcp.queryexplainer.tree.OrOperation;
import de.mirkosertic.mcp.queryexplainer.tree.SearchField;
import de.mirkosertic.mcp.queryexplainer.tree.UnknownOperation;

import java.util.List;

/**
 * Structural metrics of a {@link Node} tree, used for query complexity analysis.
 */
public final class TreeMetrics {

    private TreeMetrics() {
    }

    /**
     * Depth of the tree, following the same edges as the AST JSON: 0 for a single leaf,
     * otherwise one more than the deepest child.
     */
    public static int depth(final Node node) {
        if (node instanceof SearchField field) {
            return 1 + depth(field.expr());
        }
        if (node instanceof FieldGroup fieldGroup) {
            return 1 + depth(fieldGroup.expr());
        }
        if (node instanceof Group group) {
            return 1 + depth(group.child());
        }
        if (node instanceof OrOperation or) {
            return 1 + maxDepth(or.children());
        }
        if (node instanceof AndOperation and) {
            return 1 + maxDepth(and.children());
        }
        if (node instanceof Not not) {
            return 1 + maxDepth(not.children());
        }
        if (node instanceof UnknownOperation unknown) {
            return 1 + maxDepth(unknown.children());
        }
        return 0;
    }

    private static int maxDepth(final List<Node> nodes) {
        int max = -1;
        for (final Node node : nodes) {
            max = Math.max(max, depth(node));
        }
        return max;
    }
}
