package org.dxworks.markframe.scanner.block;

import org.dxworks.markframe.model.ElementPayload.Alignment;
import org.dxworks.markframe.scanner.block.BlockMatch.TableMatch;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.markframe.TestUtils.blockContext;
import static org.junit.jupiter.api.Assertions.*;

class TableScannerTest {

    private final TableScanner scanner = new TableScanner();

    @Test
    void headerAndSeparatorOnly() {
        List<TableMatch> matches = scanner.scan(blockContext("| A | B |\n|---|---|"));

        assertEquals(1, matches.size());
        TableMatch table = matches.get(0);
        assertEquals(List.of(List.of("A", "B")), table.rows());
        assertTrue(table.hasHeader());
        assertEquals(List.of(Alignment.NONE, Alignment.NONE), table.alignments());
        assertEquals(1, table.startLine());
        assertEquals(2, table.endLine());
    }

    @Test
    void bodyRowsAndAlignments() {
        String text = "| L | C | R |\n|:---|:---:|---:|\n| 1 | 2 | 3 |\n| 4 | 5 | 6 |\nplain text";

        List<TableMatch> matches = scanner.scan(blockContext(text));

        assertEquals(1, matches.size());
        TableMatch table = matches.get(0);
        assertEquals(3, table.rows().size());
        assertEquals(List.of("4", "5", "6"), table.rows().get(2));
        assertEquals(List.of(Alignment.LEFT, Alignment.CENTER, Alignment.RIGHT), table.alignments());
        assertEquals(4, table.endLine());
    }

    @Test
    void separatorMustMatchHeaderShape() {
        assertTrue(scanner.scan(blockContext("| A | B |\n|---|")).isEmpty());
        assertTrue(scanner.scan(blockContext("| A | B |\n|--|--|")).isEmpty());
        assertTrue(scanner.scan(blockContext("| A | B |\nnot a separator")).isEmpty());
    }

    @Test
    void splitsOnUnescapedPipesOnly() {
        assertEquals(List.of("a | b", "c"), TableScanner.splitCells("| a \\| b | c |"));
        assertEquals(List.of("x", "y"), TableScanner.splitCells("x | y"));
    }
}
