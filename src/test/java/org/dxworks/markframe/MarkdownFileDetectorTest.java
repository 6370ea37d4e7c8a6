package org.dxworks.markframe;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownFileDetectorTest {

    @Test
    void detectsByExtension() {
        assertTrue(MarkdownFileDetector.isMarkdown(Paths.get("docs/README.md")));
        assertTrue(MarkdownFileDetector.isMarkdown(Paths.get("notes.MARKDOWN")));
        assertFalse(MarkdownFileDetector.isMarkdown(Paths.get("notes.txt")));
        assertFalse(MarkdownFileDetector.isMarkdown(Paths.get("md")));
    }
}
