package org.dxworks.markframe.document;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DocumentSnapshotTest {

    @Test
    void splitsLinesWithoutLineBreaks() {
        DocumentSnapshot snapshot = DocumentSnapshot.of("a\nbc\r\nd");

        assertEquals(3, snapshot.lineCount());
        assertEquals(7, snapshot.length());

        DocumentLine second = snapshot.line(2);
        assertEquals("bc", second.text);
        assertEquals(2, second.from);
        assertEquals(4, second.to);
        assertEquals(6, snapshot.line(3).from);
    }

    @Test
    void emptyAndTrailingNewlineDocuments() {
        DocumentSnapshot empty = DocumentSnapshot.of("");
        assertEquals(1, empty.lineCount());
        assertEquals("", empty.line(1).text);

        DocumentSnapshot trailing = DocumentSnapshot.of("a\n");
        assertEquals(2, trailing.lineCount());
        assertEquals(2, trailing.line(2).from);
        assertEquals(0, trailing.line(2).length());
    }

    @Test
    void lineAtFindsContainingLine() {
        DocumentSnapshot snapshot = DocumentSnapshot.of("one\ntwo\nthree");

        assertEquals(1, snapshot.lineAt(0).number);
        assertEquals(1, snapshot.lineAt(3).number);
        assertEquals(2, snapshot.lineAt(4).number);
        assertEquals(3, snapshot.lineAt(13).number);
        assertThrows(IllegalArgumentException.class, () -> snapshot.lineAt(14));
    }

    @Test
    void everySnapshotHasItsOwnIdentity() {
        DocumentSnapshot first = DocumentSnapshot.of("same");
        DocumentSnapshot second = DocumentSnapshot.of("same");

        assertNotEquals(first.identity(), second.identity());
        assertTrue(first.isSameState(first));
        assertFalse(first.isSameState(second));
        assertFalse(first.isSameState(null));
    }

    @Test
    void rejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> DocumentSnapshot.of(null));
        DocumentSnapshot snapshot = DocumentSnapshot.of("x");
        assertThrows(IllegalArgumentException.class, () -> snapshot.line(0));
        assertThrows(IllegalArgumentException.class, () -> snapshot.line(2));
    }
}
