package de.mirkosertic.mcp.queryexplainer;

import de.mirkosertic.mcp.queryexplainer.grammar.GrammarException;
import de.mirkosertic.mcp.queryexplainer.grammar.GrammarParser;
import de.mirkosertic.mcp.queryexplainer.tree.Node;
import de.mirkosertic.mcp.queryexplainer.tree.Not;
import de.mirkosertic.mcp.queryexplainer.tree.UnknownOperation;
import de.mirkosertic.mcp.queryexplainer.tree.Word;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("DefaultQueryExplainer")
class DefaultQueryExplainerTest {

    private final DefaultQueryExplainer explainer = new DefaultQueryExplainer();

    @Nested
    @DisplayName("Explaining queries")
    class Explaining {

        @Test
        @DisplayName("Single term")
        void singleTerm() throws QuerySyntaxException {
            final QueryResult result = explainer.parse("test");

            assertThat(result.query()).isEqualTo("test");
            assertThat(result.deterministicText()).isEqualTo("contains \"test\"");
            assertThat(result.narrativeText()).isEqualTo("The term \"test\".");
            assertThat(result.astJson().get("type").asText()).isEqualTo("Word");
            assertThat(result.astJson().get("value").asText()).isEqualTo("test");
        }

        @Test
        @DisplayName("Exact phrase")
        void phrase() throws QuerySyntaxException {
            final QueryResult result = explainer.parse("\"Python Programming\"");

            assertThat(result.deterministicText()).isEqualTo("\"Python Programming\"");
            assertThat(result.narrativeText()).isEqualTo("\"Python Programming\".");
            assertThat(result.astJson().get("type").asText()).isEqualTo("Phrase");
        }

        @Test
        @DisplayName("OR group")
        void orGroup() throws QuerySyntaxException {
            final QueryResult result = explainer.parse("(\"Python\" OR \"Java\")");

            assertThat(result.deterministicText())
                    .isEqualTo("Include items that match ANY of: (\"Python\"; \"Java\")");
            assertThat(result.narrativeText())
                    .isEqualTo("Search for documents containing any of the following: \"Python\", \"Java\".");
        }

        @Test
        @DisplayName("Field group with OR")
        void fieldGroup() throws QuerySyntaxException {
            final QueryResult result = explainer.parse("title:(\"Machine Learning\" OR \"AI\")");

            assertThat(result.deterministicText())
                    .isEqualTo("title: contains ANY of [\"Machine Learning\"; \"AI\"]");
            assertThat(result.narrativeText())
                    .containsIgnoringCase("title contains any of [\"Machine Learning\", \"AI\"]")
                    .endsWith(".");
            assertThat(result.astJson().get("type").asText()).isEqualTo("SearchField");
            assertThat(result.astJson().get("value").asText()).isEqualTo("title");
            assertThat(result.astJson().get("expr").get("type").asText()).isEqualTo("FieldGroup");
        }

        @Test
        @DisplayName("OR group with exclusion")
        void orGroupWithExclusion() throws QuerySyntaxException {
            final QueryResult result = explainer.parse("(\"A\" OR \"B\") NOT \"C\"");

            assertThat(result.deterministicText())
                    .isEqualTo("Include items that match ANY of: (\"A\"; \"B\") EXCLUDE items where: (\"C\")");
            assertThat(result.narrativeText()).isEqualTo(
                    "Search for documents containing any of the following: \"A\", \"B\" but exclude documents where \"C\".");
            assertThat(result.astJson().get("type").asText()).isEqualTo("UnknownOperation");
            assertThat(result.astJson().get("children")).hasSize(2);
        }

        @Test
        @DisplayName("Fielded range is repeated as written")
        void fieldedRange() throws QuerySyntaxException {
            final QueryResult result = explainer.parse("date:[2020 TO 2021]");

            assertThat(result.deterministicText()).isEqualTo("date: [2020 TO 2021]");
            assertThat(result.narrativeText()).isEqualTo("Date: [2020 TO 2021].");
            assertThat(result.astJson().get("type").asText()).isEqualTo("SearchField");
            assertThat(result.astJson().get("expr").get("type").asText()).isEqualTo("TermRange");
            assertThat(result.astJson().get("expr").get("value").asText()).isEqualTo("[2020 TO 2021]");
        }

        @Test
        @DisplayName("Narrative never contains parentheses")
        void narrativeWithoutParentheses() throws QuerySyntaxException {
            final QueryResult result = explainer.parse("(a OR (b AND c)) NOT (d OR e)");

            assertThat(result.narrativeText()).doesNotContain("(").doesNotContain(")").endsWith(".");
        }

        @Test
        @DisplayName("Same query yields equal results")
        void deterministic() throws QuerySyntaxException {
            final QueryResult first = explainer.parse("title:(a AND \"b c\") OR d");
            final QueryResult second = explainer.parse("title:(a AND \"b c\") OR d");

            assertThat(first).isEqualTo(second);
        }

        @Test
        @DisplayName("AST JSON of a result cannot be modified from outside")
        void astJsonIsCopied() throws QuerySyntaxException {
            final QueryResult result = explainer.parse("test");

            result.astJson().put("type", "Changed");

            assertThat(result.astJson().get("type").asText()).isEqualTo("Word");
        }
    }

    @Nested
    @DisplayName("Rejecting queries")
    class Rejecting {

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "\t\n"})
        @DisplayName("Empty queries are rejected")
        void emptyQuery(final String query) {
            assertThatThrownBy(() -> explainer.parse(query))
                    .isInstanceOf(QuerySyntaxException.class)
                    .hasMessage(DefaultQueryExplainer.EMPTY_QUERY_MESSAGE);
        }

        @Test
        @DisplayName("Null query is rejected")
        void nullQuery() {
            assertThatThrownBy(() -> explainer.parse(null)).isInstanceOf(QuerySyntaxException.class);
        }

        @Test
        @DisplayName("Unbalanced parentheses are a syntax error")
        void unclosed() {
            assertThatThrownBy(() -> explainer.parse("((unclosed"))
                    .isInstanceOf(QuerySyntaxException.class)
                    .hasMessageStartingWith(DefaultQueryExplainer.INVALID_SYNTAX_PREFIX)
                    .hasMessageContaining("syntax")
                    .hasCauseInstanceOf(GrammarException.class);
        }

        @Test
        @DisplayName("Empty query never reaches the grammar parser")
        void emptyQueryShortCircuits() throws GrammarException {
            final GrammarParser grammarParser = mock(GrammarParser.class);
            final DefaultQueryExplainer stubbed = new DefaultQueryExplainer(grammarParser);

            assertThatThrownBy(() -> stubbed.parse(" ")).isInstanceOf(QuerySyntaxException.class);
            verify(grammarParser, never()).parse(anyString());
        }

        @Test
        @DisplayName("Grammar failure keeps the grammar message")
        void grammarFailure() throws GrammarException {
            final GrammarParser grammarParser = mock(GrammarParser.class);
            when(grammarParser.parse("bad")).thenThrow(new GrammarException("unexpected token"));

            assertThatThrownBy(() -> new DefaultQueryExplainer(grammarParser).parse("bad"))
                    .isInstanceOf(QuerySyntaxException.class)
                    .hasMessage("Invalid Lucene query syntax: unexpected token");
        }

        @Test
        @DisplayName("Unexpected runtime failure is reported as syntax error")
        void runtimeFailure() throws GrammarException {
            final GrammarParser grammarParser = mock(GrammarParser.class);
            when(grammarParser.parse("boom")).thenThrow(new IllegalArgumentException("broken tree"));

            assertThatThrownBy(() -> new DefaultQueryExplainer(grammarParser).parse("boom"))
                    .isInstanceOf(QuerySyntaxException.class)
                    .hasMessageContaining("broken tree")
                    .hasCauseInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("Stubbed grammar parser drives the pipeline")
    void stubbedGrammar() throws Exception {
        final GrammarParser grammarParser = mock(GrammarParser.class);
        final Node tree = new UnknownOperation(new Word("a"), new Not(new Word("b"), new Word("ignored")));
        when(grammarParser.parse("anything")).thenReturn(tree);

        final QueryResult result = new DefaultQueryExplainer(grammarParser).parse("anything");

        assertThat(result.tree()).isSameAs(tree);
        assertThat(result.deterministicText()).isEqualTo("contains \"a\" EXCLUDE items where: (contains \"b\")");
        assertThat(result.narrativeText()).isEqualTo("The term \"a\" but exclude documents where the term \"b\".");
        // The extra Not child is still exported
        assertThat(result.astJson().get("children").get(1).get("children")).hasSize(2);
    }
}
