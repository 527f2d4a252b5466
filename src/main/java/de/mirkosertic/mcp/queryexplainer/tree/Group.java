package de.mirkosertic.mcp.queryexplainer.tree;

import java.util.Objects;

/**
 * A parenthesized sub-expression without field scope.
 */
public record Group(Node child) implements Node {

    public Group {
        Objects.requireNonNull(child, "child");
    }

    @Override
    public String typeName() {
        return "Group";
    }
}
