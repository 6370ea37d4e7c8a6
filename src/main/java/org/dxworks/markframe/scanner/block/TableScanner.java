package org.dxworks.markframe.scanner.block;

import org.dxworks.markframe.document.DocumentLine;
import org.dxworks.markframe.model.ElementPayload.Alignment;
import org.dxworks.markframe.scanner.block.BlockMatch.TableMatch;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * GFM pipe tables. A table needs a header row immediately followed by a separator row
 * with the same number of cells, each matching {@code :?-{3,}:?}.
 */
public final class TableScanner implements BlockScanner<TableMatch> {

    private static final Pattern SEPARATOR_CELL = Pattern.compile(":?-{3,}:?");

    @Override
    public List<TableMatch> scan(BlockScanContext context) {
        List<TableMatch> matches = new ArrayList<>();

        int i = 0;
        while (i < context.lineCount()) {
            DocumentLine header = context.line(i);
            String headerText = rowText(context, i);
            if (headerText == null || i + 1 >= context.lineCount()) {
                i++;
                continue;
            }

            List<String> headerCells = splitCells(headerText);
            List<Alignment> alignments = parseSeparator(rowText(context, i + 1), headerCells.size());
            if (alignments == null) {
                i++;
                continue;
            }

            List<List<String>> rows = new ArrayList<>();
            rows.add(headerCells);
            int last = i + 1;
            for (int j = i + 2; j < context.lineCount(); j++) {
                String rowText = rowText(context, j);
                if (rowText == null) break;
                rows.add(splitCells(rowText));
                last = j;
            }

            DocumentLine end = context.line(last);
            matches.add(new TableMatch(header.from, context.clamp(end.to), header.number, end.number,
                    rows, alignments, true));
            i = last + 1;
        }
        return matches;
    }

    /**
     * @return the stripped row text, or null when the line cannot be part of a table
     */
    private static String rowText(BlockScanContext context, int index) {
        if (index >= context.lineCount()) return null;
        DocumentLine line = context.line(index);
        if (context.isExcluded(line)) return null;
        String trimmed = LinePrefixStripper.strip(line.text).trimmed();
        if (trimmed.isEmpty() || indexOfUnescapedPipe(trimmed, 0) < 0) return null;
        return trimmed;
    }

    private static List<Alignment> parseSeparator(String rowText, int expectedCells) {
        if (rowText == null) return null;
        List<String> cells = splitCells(rowText);
        if (cells.size() != expectedCells) return null;

        List<Alignment> alignments = new ArrayList<>(cells.size());
        for (String cell : cells) {
            if (!SEPARATOR_CELL.matcher(cell).matches()) return null;
            boolean left = cell.startsWith(":");
            boolean right = cell.endsWith(":");
            if (left && right) {
                alignments.add(Alignment.CENTER);
            } else if (left) {
                alignments.add(Alignment.LEFT);
            } else if (right) {
                alignments.add(Alignment.RIGHT);
            } else {
                alignments.add(Alignment.NONE);
            }
        }
        return alignments;
    }

    static List<String> splitCells(String row) {
        String text = row;
        if (text.startsWith("|")) {
            text = text.substring(1);
        }
        if (text.endsWith("|") && !text.endsWith("\\|")) {
            text = text.substring(0, text.length() - 1);
        }

        List<String> cells = new ArrayList<>();
        int start = 0;
        int pipe;
        while ((pipe = indexOfUnescapedPipe(text, start)) >= 0) {
            cells.add(cleanCell(text.substring(start, pipe)));
            start = pipe + 1;
        }
        cells.add(cleanCell(text.substring(start)));
        return cells;
    }

    private static String cleanCell(String raw) {
        return raw.trim().replace("\\|", "|");
    }

    private static int indexOfUnescapedPipe(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '|') {
                return i;
            }
        }
        return -1;
    }
}
