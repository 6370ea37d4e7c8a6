package org.dxworks.markframe.scanner.block;

import org.dxworks.markframe.document.DocumentLine;
import org.dxworks.markframe.model.ElementPayload.FoldState;
import org.dxworks.markframe.scanner.block.BlockMatch.CalloutMatch;
import org.dxworks.markframe.scanner.block.LinePrefixStripper.StrippedLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Typed block quotations:
 * <pre>
 * &gt; [!warning]- Optional title
 * &gt; body line
 * </pre>
 * A {@code -} after the type starts the callout collapsed, a {@code +} expanded.
 * Callouts are also recognized inside outer quotations and list items; body lines
 * must keep the header's quote depth.
 */
public final class CalloutScanner implements BlockScanner<CalloutMatch> {

    private static final Pattern HEADER = Pattern.compile("^\\[!([\\w-]+)\\]([-+])?\\s*(.*)$");

    private record Header(Matcher match, int quoteDepth) {
    }

    @Override
    public List<CalloutMatch> scan(BlockScanContext context) {
        List<CalloutMatch> matches = new ArrayList<>();

        int i = 0;
        while (i < context.lineCount()) {
            DocumentLine line = context.line(i);
            Header header = context.isExcluded(line) ? null : header(line.text);
            if (header == null) {
                i++;
                continue;
            }

            List<String> bodyLines = new ArrayList<>();
            int last = i;
            for (int j = i + 1; j < context.lineCount(); j++) {
                DocumentLine next = context.line(j);
                if (context.isExcluded(next) || header(next.text) != null) break;
                StrippedLine body = LinePrefixStripper.stripQuotes(next.text, header.quoteDepth());
                if (body.quoteDepth() < header.quoteDepth()) break;
                if (!body.trimmed().isEmpty()) {
                    bodyLines.add(body.trimmed());
                }
                last = j;
            }

            DocumentLine end = context.line(last);
            Matcher headerMatch = header.match();
            matches.add(new CalloutMatch(line.from, context.clamp(end.to), line.number, end.number,
                    headerMatch.group(1).toLowerCase(Locale.ROOT),
                    headerMatch.group(3).trim(),
                    bodyLines,
                    foldState(headerMatch.group(2))));
            i = last + 1;
        }
        return matches;
    }

    // a list marker may sit in front of the quote ("- > [!note]"), so quotes are stripped again after it
    private static Header header(String text) {
        StrippedLine outer = LinePrefixStripper.strip(text);
        StrippedLine inner = LinePrefixStripper.stripQuotes(outer.content());
        int depth = outer.quoteDepth() + inner.quoteDepth();
        if (depth == 0) {
            return null;
        }
        Matcher match = HEADER.matcher(inner.content());
        return match.matches() ? new Header(match, depth) : null;
    }

    private static FoldState foldState(String sign) {
        if (sign == null) return FoldState.NONE;
        return "-".equals(sign) ? FoldState.COLLAPSED : FoldState.EXPANDED;
    }
}
