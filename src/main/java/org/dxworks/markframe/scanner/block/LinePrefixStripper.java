package org.dxworks.markframe.scanner.block;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes container prefixes (nested quotation markers, list and task markers, indentation)
 * so block constructs are recognized inside quotes and list items.
 */
public final class LinePrefixStripper {

    private static final Pattern QUOTE_MARKER = Pattern.compile("^[ \\t]{0,3}>[ ]?");
    private static final Pattern LIST_MARKER = Pattern.compile(
            "^[ \\t]*(?:[-*+]|\\d{1,9}[.)])[ \\t]+(?:\\[[ xX]\\][ \\t]+)?");

    public record StrippedLine(String content, int prefixLength, int quoteDepth, boolean listItem) {
        public String trimmed() {
            return content.trim();
        }
    }

    private LinePrefixStripper() {
        // utility class
    }

    /**
     * Strips quote markers, one list marker and leading indentation.
     */
    public static StrippedLine strip(String line) {
        StrippedLine quoted = stripQuotes(line);
        int pos = quoted.prefixLength();

        boolean listItem = false;
        Matcher list = LIST_MARKER.matcher(line).region(pos, line.length());
        if (list.lookingAt()) {
            pos = list.end();
            listItem = true;
        }
        while (pos < line.length() && isIndent(line.charAt(pos))) {
            pos++;
        }
        return new StrippedLine(line.substring(pos), pos, quoted.quoteDepth(), listItem);
    }

    /**
     * Text after the quote and list prefixes of a nested line; top-level lines are returned unchanged
     * so that their own indentation still counts.
     */
    public static String containerContent(String line) {
        StrippedLine stripped = strip(line);
        return stripped.quoteDepth() > 0 || stripped.listItem() ? stripped.content() : line;
    }

    /**
     * Strips quote markers only; used for the body of code and math blocks where a leading
     * "- " is content.
     */
    public static StrippedLine stripQuotes(String line) {
        return stripQuotes(line, Integer.MAX_VALUE);
    }

    /**
     * Strips at most {@code maxDepth} quote markers.
     */
    public static StrippedLine stripQuotes(String line, int maxDepth) {
        int pos = 0;
        int depth = 0;
        Matcher quote = QUOTE_MARKER.matcher(line);
        while (depth < maxDepth) {
            quote.region(pos, line.length());
            if (!quote.lookingAt()) break;
            pos = quote.end();
            depth++;
        }
        return new StrippedLine(line.substring(pos), pos, depth, false);
    }

    private static boolean isIndent(char c) {
        return c == ' ' || c == '\t';
    }
}
