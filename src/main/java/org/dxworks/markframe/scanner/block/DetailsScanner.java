package org.dxworks.markframe.scanner.block;

import org.dxworks.markframe.document.DocumentLine;
import org.dxworks.markframe.scanner.block.BlockMatch.DetailsMatch;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collapsible {@code <details>} blocks. Nested details stay part of the outermost block.
 */
public final class DetailsScanner implements BlockScanner<DetailsMatch> {

    private static final Pattern OPEN_TAG = Pattern.compile("^<details(\\s+open)?\\s*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern CLOSE_TAG = Pattern.compile("</details\\s*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUMMARY = Pattern.compile("<summary>(.*?)</summary>", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUMMARY_TAG = Pattern.compile("</?summary>", Pattern.CASE_INSENSITIVE);

    @Override
    public List<DetailsMatch> scan(BlockScanContext context) {
        List<DetailsMatch> matches = new ArrayList<>();

        int depth = 0;
        DocumentLine open = null;
        boolean isOpen = false;
        String summary = "";
        List<String> contentLines = new ArrayList<>();

        for (int i = 0; i < context.lineCount(); i++) {
            DocumentLine line = context.line(i);
            if (context.isExcluded(line)) {
                continue;
            }
            String trimmed = LinePrefixStripper.strip(line.text).trimmed();
            Matcher openTag = OPEN_TAG.matcher(trimmed);

            if (depth == 0) {
                if (!openTag.find()) continue;
                depth = 1;
                open = line;
                isOpen = openTag.group(1) != null;
                summary = "";
                contentLines.clear();
                String rest = trimmed.substring(openTag.end());
                summary = captureSummary(rest, summary);
                if (CLOSE_TAG.matcher(rest).find()) {
                    matches.add(new DetailsMatch(line.from, context.clamp(line.to), line.number, line.number,
                            summary, List.copyOf(contentLines), isOpen));
                    depth = 0;
                }
                continue;
            }

            if (openTag.find()) {
                depth++;
            }
            if (CLOSE_TAG.matcher(trimmed).find()) {
                depth--;
                if (depth == 0) {
                    matches.add(new DetailsMatch(open.from, context.clamp(line.to), open.number, line.number,
                            summary, List.copyOf(contentLines), isOpen));
                    continue;
                }
            }

            String captured = captureSummary(trimmed, null);
            if (captured != null && summary.isEmpty()) {
                summary = captured;
            } else if (captured == null && !SUMMARY_TAG.matcher(trimmed).find() && !trimmed.isEmpty()) {
                contentLines.add(trimmed);
            }
        }

        if (depth > 0) {
            System.err.println("[DetailsScanner] Warning: unterminated <details> opened at line " + open.number);
        }
        return matches;
    }

    private static String captureSummary(String text, String fallback) {
        Matcher summary = SUMMARY.matcher(text);
        return summary.find() ? summary.group(1).trim() : fallback;
    }
}
