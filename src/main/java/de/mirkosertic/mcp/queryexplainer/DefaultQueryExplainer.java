package de.mirkosertic.mcp.queryexplainer;

import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.mcp.queryexplainer.grammar.GrammarException;
import de.mirkosertic.mcp.queryexplainer.grammar.GrammarParser;
import de.mirkosertic.mcp.queryexplainer.grammar.LuceneSyntaxGrammarParser;
import de.mirkosertic.mcp.queryexplainer.render.AstSerializer;
import de.mirkosertic.mcp.queryexplainer.render.DeterministicRenderer;
import de.mirkosertic.mcp.queryexplainer.render.NarrativeNormalizer;
import de.mirkosertic.mcp.queryexplainer.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The explanation pipeline: grammar parser, deterministic renderer, narrative normalizer and
 * AST serializer.
 *
 * <p>Every failure is reported as {@link QuerySyntaxException}, including unexpected runtime
 * errors while rendering or serializing. The underlying message is kept in the exception
 * message and the original exception is attached as cause.</p>
 *
 * <p>Instances hold no mutable state and can be shared between threads, provided the
 * {@link GrammarParser} can.</p>
 */
public class DefaultQueryExplainer implements QueryExplainer {

    private static final Logger logger = LoggerFactory.getLogger(DefaultQueryExplainer.class);

    static final String INVALID_SYNTAX_PREFIX = "Invalid Lucene query syntax: ";
    static final String EMPTY_QUERY_MESSAGE = "Query cannot be empty or whitespace only";

    private final GrammarParser grammarParser;
    private final DeterministicRenderer renderer;
    private final NarrativeNormalizer normalizer;
    private final AstSerializer serializer;

    public DefaultQueryExplainer() {
        this(new LuceneSyntaxGrammarParser());
    }

    public DefaultQueryExplainer(final GrammarParser grammarParser) {
        this(grammarParser, new DeterministicRenderer(), new NarrativeNormalizer(), new AstSerializer());
    }

    public DefaultQueryExplainer(final GrammarParser grammarParser,
                                 final DeterministicRenderer renderer,
                                 final NarrativeNormalizer normalizer,
                                 final AstSerializer serializer) {
        this.grammarParser = grammarParser;
        this.renderer = renderer;
        this.normalizer = normalizer;
        this.serializer = serializer;
    }

    @Override
    public QueryResult parse(final String query) throws QuerySyntaxException {
        if (query == null || query.isBlank()) {
            throw new QuerySyntaxException(EMPTY_QUERY_MESSAGE);
        }

        logger.info("Parsing query: {}", abbreviate(query));

        try {
            final Node tree = grammarParser.parse(query);

            final String deterministicText = renderer.render(tree);
            logger.debug("Generated deterministic text: {}", abbreviate(deterministicText));

            final String narrativeText = normalizer.normalize(deterministicText);
            logger.debug("Generated narrative text: {}", abbreviate(narrativeText));

            final ObjectNode astJson = serializer.serialize(tree);

            return new QueryResult(query, deterministicText, narrativeText, astJson, tree);
        } catch (final GrammarException e) {
            logger.warn("Failed to parse query: {}", e.getMessage());
            throw new QuerySyntaxException(INVALID_SYNTAX_PREFIX + e.getMessage(), e);
        } catch (final RuntimeException e) {
            logger.error("Unexpected error explaining query '{}'", abbreviate(query), e);
            throw new QuerySyntaxException(INVALID_SYNTAX_PREFIX + e.getMessage(), e);
        }
    }

    private static String abbreviate(final String text) {
        return text.length() > 100 ? text.substring(0, 100) + "..." : text;
    }
}
