package org.dxworks.markframe.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceTableTest {

    @Test
    void labelsAreNormalized() {
        assertEquals("foo bar", ReferenceTable.normalizeLabel("  Foo \t  BAR "));
        assertEquals("", ReferenceTable.normalizeLabel(null));
    }

    @Test
    void firstDefinitionWins() {
        ReferenceTable.Builder builder = ReferenceTable.builder();
        assertTrue(builder.define("Docs", "https://first", "First"));
        assertFalse(builder.define("docs", "https://second", null));
        assertFalse(builder.define("   ", "https://empty", null));

        ReferenceTable table = builder.build();

        assertEquals(1, table.size());
        ReferenceTable.Target target = table.resolve("DOCS").orElseThrow();
        assertEquals("https://first", target.url());
        assertEquals("First", target.title());
        assertTrue(table.resolve("missing").isEmpty());
    }

    @Test
    void signatureIgnoresDefinitionOrderButTracksContent() {
        ReferenceTable.Builder ab = ReferenceTable.builder();
        ab.define("a", "u1", null);
        ab.define("b", "u2", "t");
        ReferenceTable.Builder ba = ReferenceTable.builder();
        ba.define("b", "u2", "t");
        ba.define("a", "u1", null);
        ReferenceTable.Builder changed = ReferenceTable.builder();
        changed.define("a", "u1", null);
        changed.define("b", "u3", "t");

        assertEquals(ab.build().signature(), ba.build().signature());
        assertNotEquals(ab.build().signature(), changed.build().signature());
        assertSame(ReferenceTable.EMPTY, ReferenceTable.builder().build());
        assertEquals("", ReferenceTable.EMPTY.signature());
    }
}
