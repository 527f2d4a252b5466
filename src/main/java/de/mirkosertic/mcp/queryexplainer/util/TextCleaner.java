package de.mirkosertic.mcp.queryexplainer.util;

import java.util.regex.Pattern;

/**
 * Removes characters that are invisible in an editor but break query parsing.
 *
 * <p>Removed are:</p>
 * <ul>
 *   <li>U+0000 and the control characters U+0001-U+001F except tab, line feed and carriage return</li>
 *   <li>U+200B-U+200D zero-width space, non-joiner and joiner</li>
 *   <li>U+FEFF byte order mark</li>
 *   <li>U+FFFD replacement character left behind by failed decoding</li>
 * </ul>
 *
 * <p>Whitespace inside the text is kept as is, it can be significant inside phrases.</p>
 */
public final class TextCleaner {

    private static final Pattern INVALID_CHARS = Pattern.compile(
        "[" +
        "\\x00-\\x08" +                 // NULL and control chars before TAB
        "\\x0B\\x0C" +                  // Control chars between LF and CR
        "\\x0E-\\x1F" +                 // Control chars after CR
        "\\u200B-\\u200D" +             // Zero-width space, non-joiner, joiner
        "\\uFEFF" +                     // Byte order mark
        "\\uFFFD" +                     // Replacement character
        "]"
    );

    private TextCleaner() {
    }

    /**
     * Removes invalid characters and strips leading and trailing whitespace.
     *
     * @param text the text to clean (may be null)
     * @return the cleaned text, or null if the input was null
     */
    public static String clean(final String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return INVALID_CHARS.matcher(text).replaceAll("").strip();
    }
}
