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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DeterministicRenderer")
class DeterministicRendererTest {

    private final DeterministicRenderer renderer = new DeterministicRenderer();

    @Nested
    @DisplayName("Leaves")
    class Leaves {

        @Test
        @DisplayName("Word renders as contains")
        void word() {
            assertThat(renderer.render(new Word("test"))).isEqualTo("contains \"test\"");
        }

        @Test
        @DisplayName("Phrase renders verbatim with its quotes")
        void phrase() {
            assertThat(renderer.render(new Phrase("\"Python Programming\""))).isEqualTo("\"Python Programming\"");
        }

        @Test
        @DisplayName("Unsupported construct renders its query text")
        void unsupported() {
            assertThat(renderer.render(new Unsupported("Fuzzy", "roam~2"))).isEqualTo("roam~2");
            assertThat(renderer.render(new Unsupported("MatchAllDocs", ""))).isEqualTo("MatchAllDocs");
        }
    }

    @Nested
    @DisplayName("Boolean operations")
    class BooleanOperations {

        @Test
        @DisplayName("OR renders ANY of with semicolons")
        void or() {
            final Node node = new OrOperation(new Phrase("\"Python\""), new Phrase("\"Java\""));

            assertThat(renderer.render(node))
                    .isEqualTo("Include items that match ANY of: (\"Python\"; \"Java\")");
        }

        @Test
        @DisplayName("AND renders ALL of")
        void and() {
            final Node node = new AndOperation(new Word("a"), new Word("b"));

            assertThat(renderer.render(node))
                    .isEqualTo("Include items that match ALL of: (contains \"a\"; contains \"b\")");
        }

        @Test
        @DisplayName("NOT renders EXCLUDE")
        void not() {
            assertThat(renderer.render(new Not(new Phrase("\"C\""))))
                    .isEqualTo("EXCLUDE items where: (\"C\")");
        }

        @Test
        @DisplayName("NOT with several children renders only the first")
        void notRendersOnlyFirstChild() {
            final Node node = new Not(new Word("a"), new Word("b"), new Word("c"));

            assertThat(renderer.render(node)).isEqualTo("EXCLUDE items where: (contains \"a\")");
        }

        @Test
        @DisplayName("Implicit operation joins children with a space")
        void unknownOperation() {
            final Node node = new UnknownOperation(
                    new Group(new OrOperation(new Phrase("\"A\""), new Phrase("\"B\""))),
                    new Not(new Phrase("\"C\"")));

            assertThat(renderer.render(node))
                    .isEqualTo("Include items that match ANY of: (\"A\"; \"B\") EXCLUDE items where: (\"C\")");
        }

        @Test
        @DisplayName("Group is transparent")
        void group() {
            final Node inner = new AndOperation(new Word("x"), new Word("y"));

            assertThat(renderer.render(new Group(inner))).isEqualTo(renderer.render(inner));
        }

        @Test
        @DisplayName("Nested operations render recursively")
        void nested() {
            final Node node = new AndOperation(
                    new Group(new OrOperation(new Word("a"), new Word("b"))),
                    new Word("c"));

            assertThat(renderer.render(node)).isEqualTo(
                    "Include items that match ALL of: (Include items that match ANY of: "
                            + "(contains \"a\"; contains \"b\"); contains \"c\")");
        }
    }

    @Nested
    @DisplayName("Field scopes")
    class FieldScopes {

        @Test
        @DisplayName("Plain field prefixes the inner rendering")
        void plainField() {
            assertThat(renderer.render(new SearchField("title", new Word("a"))))
                    .isEqualTo("title: contains \"a\"");
        }

        @Test
        @DisplayName("Field group with a phrase renders EXACT PHRASE")
        void exactPhrase() {
            final Node node = new SearchField("title", new FieldGroup(new Phrase("\"x y\"")));

            assertThat(renderer.render(node)).isEqualTo("title: contains the EXACT PHRASE \"x y\"");
        }

        @Test
        @DisplayName("Field group with OR renders a bracket list")
        void anyOfList() {
            final Node node = new SearchField("title",
                    new FieldGroup(new OrOperation(new Phrase("\"Machine Learning\""), new Phrase("\"AI\""))));

            assertThat(renderer.render(node))
                    .isEqualTo("title: contains ANY of [\"Machine Learning\"; \"AI\"]");
        }

        @Test
        @DisplayName("Field group with AND quotes words in the bracket list")
        void allOfList() {
            final Node node = new SearchField("title",
                    new FieldGroup(new AndOperation(new Phrase("\"a\""), new Word("b"))));

            assertThat(renderer.render(node)).isEqualTo("title: contains ALL of [\"a\"; \"b\"]");
        }

        @Test
        @DisplayName("Other list items render recursively")
        void nestedListItem() {
            final Node node = new SearchField("title",
                    new FieldGroup(new OrOperation(new Word("a"), new Not(new Word("b")))));

            assertThat(renderer.render(node))
                    .isEqualTo("title: contains ANY of [\"a\"; EXCLUDE items where: (contains \"b\")]");
        }

        @Test
        @DisplayName("Field group with a single word falls back to the field prefix")
        void fieldGroupFallback() {
            final Node node = new SearchField("title", new FieldGroup(new Word("a")));

            assertThat(renderer.render(node)).isEqualTo("title: contains \"a\"");
        }

        @Test
        @DisplayName("Field group outside a field renders its content")
        void bareFieldGroup() {
            assertThat(renderer.render(new FieldGroup(new Word("a")))).isEqualTo("contains \"a\"");
        }
    }

    @Test
    @DisplayName("Rendering is deterministic")
    void deterministic() {
        final Node node = new UnknownOperation(new Word("a"), new SearchField("f", new Phrase("\"b\"")));

        assertThat(renderer.render(node)).isEqualTo(renderer.render(node));
    }
}
