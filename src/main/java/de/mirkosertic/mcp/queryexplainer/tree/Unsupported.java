package de.mirkosertic.mcp.queryexplainer.tree;

import java.util.Objects;

/**
 * A grammar construct outside the supported variants, for example a fuzzy term, a boost or a
 * range. It is carried through the pipeline as its query syntax text.
 *
 * @param kind the construct kind, e.g. {@code Fuzzy} or {@code Boost}
 * @param text the construct in query syntax, may be empty
 */
public record Unsupported(String kind, String text) implements Node {

    public Unsupported {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String typeName() {
        return kind;
    }
}
