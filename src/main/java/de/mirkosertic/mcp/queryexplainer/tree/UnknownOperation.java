package de.mirkosertic.mcp.queryexplainer.tree;

import java.util.List;

/**
 * Terms written next to each other without an explicit operator, as in {@code a NOT b}.
 */
public record UnknownOperation(List<Node> children) implements Node {

    public UnknownOperation {
        children = List.copyOf(children);
    }

    public UnknownOperation(final Node... children) {
        this(List.of(children));
    }

    @Override
    public String typeName() {
        return "UnknownOperation";
    }
}
