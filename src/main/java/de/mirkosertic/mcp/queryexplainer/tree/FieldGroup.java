package de.mirkosertic.mcp.queryexplainer.tree;

import java.util.Objects;

/**
 * A parenthesized sub-expression directly inside a {@link SearchField}, as in {@code title:(a OR b)}.
 */
public record FieldGroup(Node expr) implements Node {

    public FieldGroup {
        Objects.requireNonNull(expr, "expr");
    }

    @Override
    public String typeName() {
        return "FieldGroup";
    }
}
