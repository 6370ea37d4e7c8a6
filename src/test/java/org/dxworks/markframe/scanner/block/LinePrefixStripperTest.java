package org.dxworks.markframe.scanner.block;

import org.dxworks.markframe.scanner.block.LinePrefixStripper.StrippedLine;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LinePrefixStripperTest {

    @Test
    void stripsNestedQuotesAndTaskMarker() {
        StrippedLine stripped = LinePrefixStripper.strip("> > - [x] task");

        assertEquals("task", stripped.content());
        assertEquals(2, stripped.quoteDepth());
        assertTrue(stripped.listItem());
        assertEquals(10, stripped.prefixLength());
    }

    @Test
    void stripsIndentationAndNumberedMarker() {
        StrippedLine stripped = LinePrefixStripper.strip("   12. | a | b |");

        assertEquals("| a | b |", stripped.content());
        assertTrue(stripped.listItem());
        assertEquals(0, stripped.quoteDepth());
    }

    @Test
    void quoteOnlyVariantKeepsListMarkers() {
        assertEquals("- item", LinePrefixStripper.stripQuotes("> - item").content());
        assertEquals("plain", LinePrefixStripper.stripQuotes("plain").content());
    }
}
