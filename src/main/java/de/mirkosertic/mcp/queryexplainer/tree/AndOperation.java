package de.mirkosertic.mcp.queryexplainer.tree;

import java.util.List;

/**
 * Boolean AND across all children.
 */
public record AndOperation(List<Node> children) implements Node {

    public AndOperation {
        children = List.copyOf(children);
    }

    public AndOperation(final Node... children) {
        this(List.of(children));
    }

    @Override
    public String typeName() {
        return "AndOperation";
    }
}
