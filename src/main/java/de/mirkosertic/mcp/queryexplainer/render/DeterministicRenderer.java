package de.mirkosertic.mcp.queryexplainer.render;

import de.mirkosertic.mcp.queryexplainer.tree.AndOperation;
import de.mirkosertic.mcp.queryexplainer.tree.FieldGroup;
import de.mirkosertic.mcp.queryexplainer.tree.Group;
import de.mirkosertic.mcp.queryexplainer.tree.Node;
import de.mirkosertic.mcp.queryexplainer.tree.Not;
import de.mirkosertic.mcp.queryexplainer.tree.OrOperation;
import de.mirkosertic.mcp.queryexplainer.tree.Phrase;
import de.mirkosertic.mcp.queryexplainer.tree.SearchField;
import de.mirkosertic.mcp.queryexplainer.tree.UnknownOperation;
import de.mirkosertic.mcp.queryexplainer.tree.Unsupported;
import de.mirkosertic.mcp.queryexplainer.tree.Word;

import java.util.List;
import java.util.StringJoiner;

/**
 * Renders a {@link Node} tree into the deterministic text form.
 *
 * <h2>Phrasing</h2>
 * <pre>
 * "exact phrase"            →  "exact phrase"
 * term                      →  contains "term"
 * a OR b                    →  Include items that match ANY of: (contains "a"; contains "b")
 * a AND b                   →  Include items that match ALL of: (contains "a"; contains "b")
 * NOT a                     →  EXCLUDE items where: (contains "a")
 * a b                       →  contains "a" contains "b"
 * title:("x y")             →  title: contains the EXACT PHRASE "x y"
 * title:("a" OR b)          →  title: contains ANY of ["a"; "b"]
 * title:("a" AND b)         →  title: contains ALL of ["a"; "b"]
 * title:a                   →  title: contains "a"
 * </pre>
 *
 * <p>Field scoped boolean groups use bracket lists while unscoped boolean groups use
 * parenthesized phrasing. {@link NarrativeNormalizer} matches on these exact literals, so any
 * change here has to be reflected there.</p>
 *
 * <p>Instances are stateless and thread-safe.</p>
 */
public class DeterministicRenderer {

    static final String ANY_OF = "Include items that match ANY of: (";
    static final String ALL_OF = "Include items that match ALL of: (";
    static final String EXCLUDE = "EXCLUDE items where: (";
    static final String SEPARATOR = "; ";

    /**
     * Renders the given tree.
     *
     * @param node the root node
     * @return the deterministic text, never empty
     */
    public String render(final Node node) {
        if (node instanceof Phrase phrase) {
            return phrase.value();
        }
        if (node instanceof Word word) {
            return "contains \"" + word.value() + "\"";
        }
        if (node instanceof OrOperation or) {
            return ANY_OF + renderAll(or.children(), SEPARATOR) + ")";
        }
        if (node instanceof AndOperation and) {
            return ALL_OF + renderAll(and.children(), SEPARATOR) + ")";
        }
        if (node instanceof Not not) {
            // Only the first child is rendered, the grammar emits exactly one
            return EXCLUDE + render(not.children().get(0)) + ")";
        }
        if (node instanceof Group group) {
            return render(group.child());
        }
        if (node instanceof FieldGroup fieldGroup) {
            return render(fieldGroup.expr());
        }
        if (node instanceof UnknownOperation unknown) {
            return renderAll(unknown.children(), " ");
        }
        if (node instanceof SearchField field) {
            return renderField(field);
        }
        if (node instanceof Unsupported unsupported) {
            return unsupported.text().isEmpty() ? unsupported.kind() : unsupported.text();
        }
        throw new IllegalStateException("No rendering for node type " + node.typeName());
    }

    private String renderField(final SearchField field) {
        final String name = field.name();
        if (!(field.expr() instanceof FieldGroup fieldGroup)) {
            return name + ": " + render(field.expr());
        }

        final Node inner = fieldGroup.expr();
        if (inner instanceof Phrase phrase) {
            return name + ": contains the EXACT PHRASE \"" + phrase.unquoted() + "\"";
        }
        if (inner instanceof OrOperation or) {
            return name + ": contains ANY of [" + renderListItems(or.children()) + "]";
        }
        if (inner instanceof AndOperation and) {
            return name + ": contains ALL of [" + renderListItems(and.children()) + "]";
        }
        return name + ": " + render(inner);
    }

    private String renderListItems(final List<Node> items) {
        final StringJoiner joiner = new StringJoiner(SEPARATOR);
        for (final Node item : items) {
            if (item instanceof Phrase phrase) {
                joiner.add(phrase.value());
            } else if (item instanceof Word word) {
                joiner.add("\"" + word.value() + "\"");
            } else {
                joiner.add(render(item));
            }
        }
        return joiner.toString();
    }

    private String renderAll(final List<Node> nodes, final String delimiter) {
        final StringJoiner joiner = new StringJoiner(delimiter);
        for (final Node node : nodes) {
            joiner.add(render(node));
        }
        return joiner.toString();
    }
}
