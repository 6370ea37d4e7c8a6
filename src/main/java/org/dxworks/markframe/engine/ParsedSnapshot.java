package org.dxworks.markframe.engine;

import org.dxworks.markframe.document.DocumentSnapshot;
import org.dxworks.markframe.model.Element;
import org.dxworks.markframe.scanner.block.BlockScanResult;

import java.util.List;
import java.util.Objects;

/**
 * Parse results of one snapshot. {@code window} is null when every line was scanned for inline constructs.
 */
record ParsedSnapshot(DocumentSnapshot snapshot, Viewport window, BlockScanResult blocks, List<Element> elements) {

    boolean isFor(DocumentSnapshot other, Viewport otherWindow) {
        return snapshot.isSameState(other) && Objects.equals(window, otherWindow);
    }
}
