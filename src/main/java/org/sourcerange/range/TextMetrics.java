package org.sourcerange.range;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Character counting as the range engine needs it: lengths in code points, lines split on any
 * of the three line break conventions.
 */
public final class TextMetrics {

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\n|\\r");

    private static final List<String> MULTILINE_DELIMITERS = List.of("\"\"\"", "'''");

    private TextMetrics() {
        // Private constructor to prevent instantiation
    }

    /**
     * Splits text into lines. A trailing line break yields a trailing empty line, so the result
     * always has one more element than the text has line breaks.
     */
    public static List<String> splitLines(String text) {
        return Arrays.asList(LINE_BREAK.split(text, -1));
    }

    /**
     * Returns the length of the text in characters as an editor counts them.
     */
    public static int length(String text) {
        return text.codePointCount(0, text.length());
    }

    public static boolean isMultilineDelimiter(String delimiter) {
        return delimiter != null && MULTILINE_DELIMITERS.contains(delimiter);
    }
}
