package org.dxworks.markframe.scanner.inline;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EscapesTest {

    @Test
    void oddBackslashCountEscapes() {
        assertTrue(Escapes.isEscaped("\\*", 1));
        assertTrue(Escapes.isEscaped("\\\\\\*", 3));
    }

    @Test
    void evenBackslashCountDoesNotEscape() {
        assertFalse(Escapes.isEscaped("*", 0));
        assertFalse(Escapes.isEscaped("\\\\*", 2));
        assertFalse(Escapes.isEscaped("a*", 1));
    }
}
