package de.mirkosertic.mcp.queryexplainer.tree;

import java.util.Objects;

/**
 * A bare, unquoted term.
 */
public record Word(String value) implements Node {

    public Word {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String typeName() {
        return "Word";
    }
}
