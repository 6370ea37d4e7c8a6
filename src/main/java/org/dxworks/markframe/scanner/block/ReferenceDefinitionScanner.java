package org.dxworks.markframe.scanner.block;

import org.dxworks.markframe.document.DocumentLine;
import org.dxworks.markframe.scanner.block.BlockMatch.ReferenceDefinitionMatch;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Link reference definitions {@code [label]: url "title"}. The title may be quoted with
 * double quotes, single quotes or parentheses; the url may be wrapped in angle brackets.
 * Definitions inside quotations and list items are recognized too.
 * Callers exclude code block lines through the scan context.
 */
public final class ReferenceDefinitionScanner implements BlockScanner<ReferenceDefinitionMatch> {

    private static final Pattern DEFINITION = Pattern.compile(
            "^[ ]{0,3}\\[([^\\]\\^][^\\]]*)\\]:[ \\t]*(<[^>]*>|\\S+)"
                    + "(?:[ \\t]+(?:\"([^\"]*)\"|'([^']*)'|\\(([^)]*)\\)))?[ \\t]*$");

    @Override
    public List<ReferenceDefinitionMatch> scan(BlockScanContext context) {
        List<ReferenceDefinitionMatch> matches = new ArrayList<>();
        for (DocumentLine line : context.lines()) {
            if (context.isExcluded(line)) {
                continue;
            }
            Matcher matcher = DEFINITION.matcher(LinePrefixStripper.containerContent(line.text));
            if (!matcher.matches()) {
                continue;
            }
            String label = matcher.group(1).trim();
            if (label.isEmpty()) {
                continue;
            }
            matches.add(new ReferenceDefinitionMatch(line.from, context.clamp(line.to), line.number, line.number,
                    label, unwrapUrl(matcher.group(2)), title(matcher)));
        }
        return matches;
    }

    private static String unwrapUrl(String url) {
        if (url.startsWith("<") && url.endsWith(">")) {
            return url.substring(1, url.length() - 1);
        }
        return url;
    }

    private static String title(Matcher matcher) {
        for (int group = 3; group <= 5; group++) {
            if (matcher.group(group) != null) {
                return matcher.group(group);
            }
        }
        return null;
    }
}
