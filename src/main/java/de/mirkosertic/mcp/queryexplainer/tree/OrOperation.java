package de.mirkosertic.mcp.queryexplainer.tree;

import java.util.List;

/**
 * Boolean OR across all children.
 */
public record OrOperation(List<Node> children) implements Node {

    public OrOperation {
        children = List.copyOf(children);
    }

    public OrOperation(final Node... children) {
        this(List.of(children));
    }

    @Override
    public String typeName() {
        return "OrOperation";
    }
}
