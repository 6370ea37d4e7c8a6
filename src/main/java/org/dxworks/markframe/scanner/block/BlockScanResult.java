package org.dxworks.markframe.scanner.block;

import org.dxworks.markframe.model.Element;
import org.dxworks.markframe.model.ReferenceTable;

import java.util.List;
import java.util.Set;

/**
 * Block-level parse of one snapshot.
 */
public final class BlockScanResult {

    public static final BlockScanResult EMPTY = new BlockScanResult(List.of(), List.of(), Set.of(), ReferenceTable.EMPTY);

    private final List<BlockMatch> matches;
    private final List<Element> elements;
    private final Set<Integer> occupiedLines;
    private final ReferenceTable references;

    public BlockScanResult(List<BlockMatch> matches, List<Element> elements,
                           Set<Integer> occupiedLines, ReferenceTable references) {
        this.matches = List.copyOf(matches);
        this.elements = List.copyOf(elements);
        this.occupiedLines = Set.copyOf(occupiedLines);
        this.references = references;
    }

    public List<BlockMatch> matches() {
        return matches;
    }

    public List<Element> elements() {
        return elements;
    }

    public Set<Integer> occupiedLines() {
        return occupiedLines;
    }

    public boolean isOccupied(int lineNumber) {
        return occupiedLines.contains(lineNumber);
    }

    public ReferenceTable references() {
        return references;
    }
}
