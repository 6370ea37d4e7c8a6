package org.dxworks.markframe.scanner.block;

import org.dxworks.markframe.document.DocumentLine;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Input shared by all block scanners. Lines claimed by a higher-priority scanner are
 * reported as excluded.
 */
public final class BlockScanContext {
    private final List<DocumentLine> lines;
    private final int documentLength;
    private final Set<Integer> excludedLines;

    public BlockScanContext(List<DocumentLine> lines, int documentLength, Set<Integer> excludedLines) {
        this.lines = lines;
        this.documentLength = documentLength;
        this.excludedLines = Set.copyOf(excludedLines);
    }

    public List<DocumentLine> lines() {
        return lines;
    }

    public int lineCount() {
        return lines.size();
    }

    /**
     * @param index 0-based index into the line array
     */
    public DocumentLine line(int index) {
        return lines.get(index);
    }

    public int documentLength() {
        return documentLength;
    }

    public boolean isExcluded(DocumentLine line) {
        return excludedLines.contains(line.number);
    }

    public int clamp(int offset) {
        return Math.min(offset, documentLength);
    }

    public BlockScanContext excluding(Set<Integer> moreLines) {
        if (moreLines.isEmpty()) {
            return this;
        }
        Set<Integer> union = new HashSet<>(excludedLines);
        union.addAll(moreLines);
        return new BlockScanContext(lines, documentLength, union);
    }
}
