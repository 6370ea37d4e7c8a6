package org.dxworks.markframe.scanner.block;

import java.util.List;

/**
 * A single-pass, line-indexed state machine recognizing one block construct.
 * Implementations have no side effects besides diagnostics on standard error.
 */
public interface BlockScanner<M extends BlockMatch> {
    List<M> scan(BlockScanContext context);
}
