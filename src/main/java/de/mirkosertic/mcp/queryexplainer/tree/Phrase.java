package de.mirkosertic.mcp.queryexplainer.tree;

import java.util.Objects;

/**
 * A quoted exact phrase. The value keeps its surrounding quote characters.
 */
public record Phrase(String value) implements Node {

    public Phrase {
        Objects.requireNonNull(value, "value");
    }

    /**
     * The phrase text without leading and trailing quote characters.
     */
    public String unquoted() {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '"') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '"') {
            end--;
        }
        return value.substring(start, end);
    }

    @Override
    public String typeName() {
        return "Phrase";
    }
}
