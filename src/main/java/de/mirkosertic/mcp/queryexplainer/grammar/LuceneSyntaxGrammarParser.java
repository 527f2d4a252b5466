package de.mirkosertic.mcp.queryexplainer.grammar;

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
import org.apache.lucene.queryparser.flexible.core.QueryNodeParseException;
import org.apache.lucene.queryparser.flexible.core.nodes.AndQueryNode;
import org.apache.lucene.queryparser.flexible.core.nodes.FieldableNode;
import org.apache.lucene.queryparser.flexible.core.nodes.BooleanQueryNode;
import org.apache.lucene.queryparser.flexible.core.nodes.FieldQueryNode;
import org.apache.lucene.queryparser.flexible.core.nodes.FuzzyQueryNode;
import org.apache.lucene.queryparser.flexible.core.nodes.GroupQueryNode;
import org.apache.lucene.queryparser.flexible.core.nodes.ModifierQueryNode;
import org.apache.lucene.queryparser.flexible.core.nodes.OrQueryNode;
import org.apache.lucene.queryparser.flexible.core.nodes.QueryNode;
import org.apache.lucene.queryparser.flexible.core.nodes.QueryNodeImpl;
import org.apache.lucene.queryparser.flexible.core.nodes.QuotedFieldQueryNode;
import org.apache.lucene.queryparser.flexible.core.parser.EscapeQuerySyntax;
import org.apache.lucene.queryparser.flexible.standard.parser.EscapeQuerySyntaxImpl;
import org.apache.lucene.queryparser.flexible.standard.nodes.TermRangeQueryNode;
import org.apache.lucene.queryparser.flexible.standard.parser.StandardSyntaxParser;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * {@link GrammarParser} backed by the syntax parser of Lucene's flexible query parser framework.
 *
 * <p>The Lucene syntax tree is translated into the {@link Node} model:</p>
 * <ul>
 *   <li>{@link OrQueryNode} and {@link AndQueryNode} become {@link OrOperation} and {@link AndOperation}</li>
 *   <li>any other {@link BooleanQueryNode} (terms side by side without an operator) becomes an
 *       {@link UnknownOperation}, a single clause is unwrapped</li>
 *   <li>{@code NOT x} and {@code -x} become {@link Not}</li>
 *   <li>quoted terms become {@link Phrase}, plain terms and wildcards {@link Word}</li>
 *   <li>explicitly fielded terms are wrapped in a {@link SearchField}</li>
 *   <li>a group whose terms all carry the same explicit field is a field group,
 *       {@code title:(a OR b)} becomes {@code SearchField(title, FieldGroup(Or(a, b)))}</li>
 *   <li>ranges become {@link Unsupported} repeating the range as written, {@code date:[2020 TO 2021]}
 *       becomes {@code SearchField(date, Unsupported(TermRange, [2020 TO 2021]))}</li>
 *   <li>everything else (fuzzy, boost, slop, regular expressions, {@code +x}) becomes
 *       {@link Unsupported} carrying its query syntax text</li>
 * </ul>
 *
 * <p>Lucene pushes the field of {@code title:( ... )} down into every term of the group, so
 * {@code (title:a OR title:b)} produces the same syntax tree as {@code title:(a OR b)}. Both are
 * treated as a field group.</p>
 */
public class LuceneSyntaxGrammarParser implements GrammarParser {

    private static final Logger logger = LoggerFactory.getLogger(LuceneSyntaxGrammarParser.class);

    /**
     * Field assigned to terms written without a field.
     */
    private static final String DEFAULT_FIELD = QueryNodeImpl.PLAINTEXT_FIELD_NAME;

    private static final EscapeQuerySyntax ESCAPER = new EscapeQuerySyntaxImpl();

    @Override
    public Node parse(final String query) throws GrammarException {
        // The generated parser keeps token state, one instance per call
        final StandardSyntaxParser syntaxParser = new StandardSyntaxParser();
        final QueryNode root;
        try {
            root = syntaxParser.parse(query, DEFAULT_FIELD);
        } catch (final QueryNodeParseException e) {
            throw new GrammarException(e.getMessage(), e);
        }

        logger.debug("Lucene syntax tree: {}", root);
        return convert(root, null);
    }

    private Node convert(final QueryNode node, final @Nullable String scope) {
        if (node instanceof FuzzyQueryNode fuzzy) {
            return scoped(fuzzy, scope, new Unsupported("Fuzzy", fuzzyText(fuzzy)));
        }
        if (node instanceof QuotedFieldQueryNode quoted) {
            return scoped(quoted, scope, new Phrase("\"" + quoted.getTextAsString() + "\""));
        }
        if (node instanceof FieldQueryNode term) {
            return scoped(term, scope, new Word(term.getTextAsString()));
        }
        if (node instanceof TermRangeQueryNode range) {
            return scoped(range, scope, new Unsupported("TermRange", rangeText(range)));
        }
        if (node instanceof GroupQueryNode group) {
            return convertGroup(group, scope);
        }
        if (node instanceof ModifierQueryNode modifier) {
            return convertModifier(modifier, scope);
        }
        if (node instanceof OrQueryNode) {
            return new OrOperation(convertChildren(node, scope));
        }
        if (node instanceof AndQueryNode) {
            return new AndOperation(convertChildren(node, scope));
        }
        if (node instanceof BooleanQueryNode) {
            final List<Node> clauses = convertChildren(node, scope);
            if (clauses.size() == 1) {
                return clauses.get(0);
            }
            return new UnknownOperation(clauses);
        }
        return unsupported(node);
    }

    private Node convertGroup(final GroupQueryNode group, final @Nullable String scope) {
        final QueryNode inner = group.getChild();
        final String groupField = commonField(inner);
        if (groupField != null && !groupField.equals(scope)) {
            return new SearchField(groupField, new FieldGroup(convert(inner, groupField)));
        }
        return new Group(convert(inner, scope));
    }

    private Node convertModifier(final ModifierQueryNode modifier, final @Nullable String scope) {
        return switch (modifier.getModifier()) {
            case MOD_NOT -> new Not(convert(modifier.getChild(), scope));
            case MOD_NONE -> convert(modifier.getChild(), scope);
            default -> new Unsupported("Required", queryString(modifier));
        };
    }

    private List<Node> convertChildren(final QueryNode node, final @Nullable String scope) {
        final List<Node> converted = new ArrayList<>();
        for (final QueryNode child : childrenOf(node)) {
            converted.add(convert(child, scope));
        }
        return converted;
    }

    /**
     * Wraps a term or range in a {@link SearchField} unless it is unfielded or inside a group scoped to its field.
     */
    private Node scoped(final FieldableNode term, final @Nullable String scope, final Node converted) {
        final String field = explicitField(term);
        if (field == null || field.equals(scope)) {
            return converted;
        }
        return new SearchField(field, converted);
    }

    /**
     * The explicit field shared by every term below the given node, or null if there is none.
     */
    private @Nullable String commonField(final QueryNode node) {
        final Set<String> fields = new LinkedHashSet<>();
        if (!collectFields(node, fields) || fields.size() != 1) {
            return null;
        }
        return fields.iterator().next();
    }

    private boolean collectFields(final QueryNode node, final Set<String> fields) {
        if (node instanceof FieldQueryNode term) {
            final String field = explicitField(term);
            if (field == null) {
                return false;
            }
            fields.add(field);
            return true;
        }
        for (final QueryNode child : childrenOf(node)) {
            if (!collectFields(child, fields)) {
                return false;
            }
        }
        return true;
    }

    private static @Nullable String explicitField(final FieldableNode term) {
        final CharSequence field = term.getField();
        if (field == null) {
            return null;
        }
        final String name = field.toString();
        if (name.isEmpty() || DEFAULT_FIELD.equals(name)) {
            return null;
        }
        return name;
    }

    private static List<QueryNode> childrenOf(final QueryNode node) {
        final List<QueryNode> children = node.getChildren();
        return children != null ? children : List.of();
    }

    private static Unsupported unsupported(final QueryNode node) {
        String kind = node.getClass().getSimpleName();
        if (kind.endsWith("QueryNode") && kind.length() > "QueryNode".length()) {
            kind = kind.substring(0, kind.length() - "QueryNode".length());
        }
        return new Unsupported(kind, queryString(node));
    }

    private static String queryString(final QueryNode node) {
        final CharSequence text = node.toQueryString(ESCAPER);
        return text != null ? text.toString() : "";
    }

    /**
     * The range without its field, e.g. {@code [2020 TO 2021]}. Lucene's own query string repeats the
     * field in both bounds and drops the {@code TO}.
     */
    private static String rangeText(final TermRangeQueryNode range) {
        return (range.isLowerInclusive() ? "[" : "{")
                + boundText(range.getLowerBound())
                + " TO "
                + boundText(range.getUpperBound())
                + (range.isUpperInclusive() ? "]" : "}");
    }

    private static String boundText(final @Nullable FieldQueryNode bound) {
        if (bound == null) {
            return "*";
        }
        final String text = bound.getTextAsString();
        if (text.isEmpty()) {
            return "*";
        }
        return text.indexOf(' ') >= 0 ? "\"" + text + "\"" : text;
    }

    private static String fuzzyText(final FuzzyQueryNode fuzzy) {
        final float similarity = fuzzy.getSimilarity();
        if (similarity == Math.rint(similarity)) {
            return fuzzy.getTextAsString() + "~" + (int) similarity;
        }
        return fuzzy.getTextAsString() + "~" + similarity;
    }
}
