package org.dxworks.markframe.scanner.block;

import org.dxworks.markframe.document.DocumentLine;
import org.dxworks.markframe.scanner.block.BlockMatch.FootnoteDefinitionMatch;
import org.dxworks.markframe.scanner.block.LinePrefixStripper.StrippedLine;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Footnote definitions {@code [^id]: text}, continued by indented lines.
 * Blank lines belong to the definition only when an indented line follows them.
 * Inside a quotation the continuation lines keep the header's quote depth.
 */
public final class FootnoteDefinitionScanner implements BlockScanner<FootnoteDefinitionMatch> {

    private static final Pattern HEADER = Pattern.compile("^[ ]{0,3}\\[\\^([^\\]\\s]+)\\]:[ \\t]?(.*)$");
    private static final Pattern CONTINUATION = Pattern.compile("^(?: {4}|\\t)");

    @Override
    public List<FootnoteDefinitionMatch> scan(BlockScanContext context) {
        List<FootnoteDefinitionMatch> matches = new ArrayList<>();

        int i = 0;
        while (i < context.lineCount()) {
            DocumentLine header = context.line(i);
            Matcher headerMatch = HEADER.matcher(LinePrefixStripper.containerContent(header.text));
            if (context.isExcluded(header) || !headerMatch.matches()) {
                i++;
                continue;
            }

            int quoteDepth = LinePrefixStripper.strip(header.text).quoteDepth();
            List<String> content = new ArrayList<>();
            addIfPresent(content, headerMatch.group(2));
            int last = i;
            int j = i + 1;
            while (j < context.lineCount()) {
                DocumentLine next = context.line(j);
                if (context.isExcluded(next)) break;
                StrippedLine body = LinePrefixStripper.stripQuotes(next.text, quoteDepth);
                if (body.quoteDepth() < quoteDepth) break;
                if (body.content().isBlank()) {
                    j++;
                    continue;
                }
                if (!CONTINUATION.matcher(body.content()).lookingAt()) break;
                addIfPresent(content, body.content());
                last = j;
                j++;
            }

            DocumentLine end = context.line(last);
            matches.add(new FootnoteDefinitionMatch(header.from, context.clamp(end.to), header.number, end.number,
                    headerMatch.group(1), String.join("\n", content)));
            i = last + 1;
        }
        return matches;
    }

    private static void addIfPresent(List<String> content, String text) {
        String trimmed = text.trim();
        if (!trimmed.isEmpty()) {
            content.add(trimmed);
        }
    }
}
