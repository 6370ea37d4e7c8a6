package org.dxworks.markframe.scanner.block;

import org.dxworks.markframe.scanner.block.BlockMatch.ReferenceDefinitionMatch;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.markframe.TestUtils.blockContext;
import static org.junit.jupiter.api.Assertions.*;

class ReferenceDefinitionScannerTest {

    private final ReferenceDefinitionScanner scanner = new ReferenceDefinitionScanner();

    @Test
    void titleStyles() {
        String text = "[1]: http://example.com \"Title\"\n[Foo Bar]: <http://x.y> 'Single'\n[p]: /path (Paren)\n[bare]: /only";

        List<ReferenceDefinitionMatch> matches = scanner.scan(blockContext(text));

        assertEquals(4, matches.size());
        assertEquals("1", matches.get(0).label());
        assertEquals("http://example.com", matches.get(0).url());
        assertEquals("Title", matches.get(0).title());
        assertEquals("Foo Bar", matches.get(1).label());
        assertEquals("http://x.y", matches.get(1).url());
        assertEquals("Single", matches.get(1).title());
        assertEquals("Paren", matches.get(2).title());
        assertNull(matches.get(3).title());
    }

    @Test
    void ignoresFootnotesAndProse() {
        assertTrue(scanner.scan(blockContext("[^1]: a footnote")).isEmpty());
        assertTrue(scanner.scan(blockContext("[a]: one two")).isEmpty());
        assertTrue(scanner.scan(blockContext("text [a]: b")).isEmpty());
    }

    @Test
    void definitionsInsideQuotationAndListItem() {
        List<ReferenceDefinitionMatch> matches = scanner.scan(blockContext("> [quoted]: /q\n- [listed]: /l \"T\""));

        assertEquals(2, matches.size());
        assertEquals("quoted", matches.get(0).label());
        assertEquals("/q", matches.get(0).url());
        assertEquals("listed", matches.get(1).label());
        assertEquals("T", matches.get(1).title());
    }
}
