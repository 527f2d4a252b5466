package de.mirkosertic.mcp.queryexplainer.tree;

import java.util.Objects;

/**
 * A field scoped sub-expression, {@code name:expr}.
 */
public record SearchField(String name, Node expr) implements Node {

    public SearchField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(expr, "expr");
    }

    @Override
    public String typeName() {
        return "SearchField";
    }
}
