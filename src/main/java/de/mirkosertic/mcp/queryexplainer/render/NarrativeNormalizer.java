package de.mirkosertic.mcp.queryexplainer.render;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Turns deterministic text produced by {@link DeterministicRenderer} into a natural language sentence.
 *
 * <p>The transformation is a fixed sequence of literal substitutions. Later substitutions match
 * on the output of earlier ones, so the order of {@link #SUBSTITUTIONS} must not change:</p>
 * <pre>
 * Include items that match ANY of: ("A"; "B") EXCLUDE items where: ("C")
 *   → Search for documents containing any of the following: "A", "B" but exclude documents where "C".
 * </pre>
 *
 * <p>After the substitutions every closing parenthesis is removed. The matching opening
 * parentheses were consumed together with the phrases that introduced them. Finally the text is
 * trimmed, terminated with a period and capitalized.</p>
 *
 * <p>Total over all input. Only the empty string normalizes to the empty string, any other input
 * ends with a period, even if nothing is left of it after stripping.</p>
 */
public class NarrativeNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(NarrativeNormalizer.class);

    private record Substitution(String pattern, String replacement) {
    }

    private static final List<Substitution> SUBSTITUTIONS = List.of(
            new Substitution(DeterministicRenderer.ANY_OF,
                    "Search for documents containing any of the following: "),
            new Substitution(DeterministicRenderer.ALL_OF,
                    "Search for documents that must contain all of the following: "),
            new Substitution(DeterministicRenderer.EXCLUDE,
                    "but exclude documents where "),
            // Exclusion of an OR group, only exists after the three rules above
            new Substitution("but exclude documents where Search for documents containing any of the following: ",
                    "but exclude documents containing any of: "),
            new Substitution("contains \"", "the term \""),
            new Substitution(": contains the EXACT PHRASE", " must contain the exact phrase"),
            new Substitution(": contains ANY of [", " contains any of ["),
            new Substitution(": contains ALL of [", " must contain all of ["),
            new Substitution(DeterministicRenderer.SEPARATOR, ", ")
    );

    /**
     * Normalizes deterministic text into narrative text.
     *
     * @param deterministicText the deterministic text, may be null
     * @return the narrative sentence, empty only if the input is empty
     */
    public String normalize(final @Nullable String deterministicText) {
        if (deterministicText == null || deterministicText.isEmpty()) {
            return "";
        }

        final StringBuilder narrative = new StringBuilder(deterministicText);
        for (final Substitution substitution : SUBSTITUTIONS) {
            replaceAll(narrative, substitution.pattern(), substitution.replacement());
        }
        replaceAll(narrative, ")", "");

        String result = narrative.toString().strip();
        if (!result.endsWith(".")) {
            result = result + ".";
        }
        result = capitalize(result);

        logger.debug("Normalized '{}' to '{}'", deterministicText, result);
        return result;
    }

    private static String capitalize(final String text) {
        // First code point, may upper-case to more than one char
        final int end = text.offsetByCodePoints(0, 1);
        return text.substring(0, end).toUpperCase(Locale.ROOT) + text.substring(end);
    }

    private static void replaceAll(final StringBuilder text, final String pattern, final String replacement) {
        int index = text.indexOf(pattern);
        while (index >= 0) {
            text.replace(index, index + pattern.length(), replacement);
            index = text.indexOf(pattern, index + replacement.length());
        }
    }
}
