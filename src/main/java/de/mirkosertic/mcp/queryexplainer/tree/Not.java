package de.mirkosertic.mcp.queryexplainer.tree;

import java.util.List;

/**
 * Boolean negation. Only the first child carries meaning; the grammar never emits more than one.
 */
public record Not(List<Node> children) implements Node {

    public Not {
        children = List.copyOf(children);
    }

    public Not(final Node... children) {
        this(List.of(children));
    }

    @Override
    public String typeName() {
        return "Not";
    }
}
