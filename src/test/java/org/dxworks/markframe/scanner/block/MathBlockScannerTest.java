package org.dxworks.markframe.scanner.block;

import org.dxworks.markframe.model.ElementPayload.MathDelimiter;
import org.dxworks.markframe.scanner.block.BlockMatch.MathBlockMatch;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.markframe.TestUtils.blockContext;
import static org.junit.jupiter.api.Assertions.*;

class MathBlockScannerTest {

    private final MathBlockScanner scanner = new MathBlockScanner();

    @Test
    void multiLineDollars() {
        List<MathBlockMatch> matches = scanner.scan(blockContext("$$\nx^2 + y^2\n$$"));

        assertEquals(1, matches.size());
        assertEquals("x^2 + y^2", matches.get(0).latex());
        assertEquals(MathDelimiter.DOLLARS, matches.get(0).delimiter());
        assertEquals(1, matches.get(0).startLine());
        assertEquals(3, matches.get(0).endLine());
    }

    @Test
    void singleLineDollars() {
        List<MathBlockMatch> matches = scanner.scan(blockContext("before\n$$a+b$$\nafter"));

        assertEquals(1, matches.size());
        assertEquals("a+b", matches.get(0).latex());
        assertEquals(MathDelimiter.SINGLE_LINE_DOLLARS, matches.get(0).delimiter());
        assertEquals(2, matches.get(0).startLine());
        assertEquals(2, matches.get(0).endLine());
    }

    @Test
    void brackets() {
        List<MathBlockMatch> matches = scanner.scan(blockContext("\\[\nE = mc^2\n\\]"));

        assertEquals(1, matches.size());
        assertEquals("E = mc^2", matches.get(0).latex());
        assertEquals(MathDelimiter.BRACKETS, matches.get(0).delimiter());
    }

    @Test
    void namedEnvironment() {
        List<MathBlockMatch> matches = scanner.scan(blockContext("\\begin{align}\na &= b\n\\end{align}"));

        assertEquals(1, matches.size());
        MathBlockMatch match = matches.get(0);
        assertEquals(MathDelimiter.ENVIRONMENT, match.delimiter());
        assertEquals("align", match.environment());
        assertEquals("\\begin{align}\na &= b\n\\end{align}", match.latex());
        assertEquals(3, match.endLine());
    }

    @Test
    void rejectsEmptyAndUndefinedBodies() {
        assertTrue(scanner.scan(blockContext("$$\nundefined\n$$")).isEmpty());
        assertTrue(scanner.scan(blockContext("$$\n\n$$")).isEmpty());
        assertTrue(scanner.scan(blockContext("$$$$")).isEmpty());
    }

    @Test
    void unterminatedBlockIsNotEmitted() {
        assertTrue(scanner.scan(blockContext("$$\nx = 1\nno end")).isEmpty());
    }
}
