package org.dxworks.markframe;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.markframe.model.ElementKind;
import org.dxworks.markframe.model.MarkdownFileReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AppAnalyzeFileTest {
    private static final String SAMPLES_BASE_PATH = "src/test/resources/samples/markdown/";

    @TempDir
    Path tempDir;

    @Test
    void analyze_Basic() throws IOException {
        Path filePath = Paths.get(SAMPLES_BASE_PATH + "Basic.md");

        MarkdownFileReport report = App.analyzeFile(filePath, MarkframeConfig.defaults());

        assertEquals(20, report.lineCount);
        assertEquals(1, report.referenceCount);
        List<ElementKind> kinds = report.elements.stream().map(e -> e.kind).distinct().toList();
        assertTrue(kinds.containsAll(List.of(ElementKind.HEADING, ElementKind.INLINE_BOLD, ElementKind.INLINE_CODE,
                ElementKind.INLINE_ITALIC, ElementKind.INLINE_LINK, ElementKind.CALLOUT, ElementKind.LIST_ITEM,
                ElementKind.INLINE_TAG, ElementKind.CODE_BLOCK, ElementKind.TABLE,
                ElementKind.LINK_REFERENCE_DEFINITION)), kinds.toString());
        assertFalse(report.decorations.isEmpty());

        JsonNode json = TestUtils.APPROVAL_MAPPER.readTree(TestUtils.APPROVAL_MAPPER.writeValueAsString(report));
        assertEquals("file", json.get("kind").asText());
        assertEquals("CODE_BLOCK", findFirst(json.get("elements"), "CODE_BLOCK").get("kind").asText());
        assertEquals("CodeBlock", findFirst(json.get("elements"), "CODE_BLOCK").get("payload").get("variant").asText());
        assertTrue(json.get("decorations").get(0).has("type"));
    }

    private static JsonNode findFirst(JsonNode elements, String kind) {
        for (JsonNode element : elements) {
            if (kind.equals(element.get("kind").asText())) {
                return element;
            }
        }
        fail("no " + kind + " element");
        return null;
    }

    @Test
    void byteOrderMarkIsStripped() throws IOException {
        Path file = tempDir.resolve("bom.md");
        Files.writeString(file, "\uFEFF# Title");

        MarkdownFileReport report = App.analyzeFile(file, MarkframeConfig.defaults());

        assertEquals(ElementKind.HEADING, report.elements.get(0).kind);
        assertEquals(0, report.elements.get(0).from);
    }

    @Test
    void collectsOnlyMarkdownWithinLineLimit() throws IOException {
        Files.writeString(tempDir.resolve("b.md"), "short");
        Files.writeString(tempDir.resolve("a.markdown"), "short");
        Files.writeString(tempDir.resolve("long.md"), "1\n2\n3\n4\n");
        Files.writeString(tempDir.resolve("notes.txt"), "ignored");

        List<Path> files = App.collectMarkdownFiles(tempDir, 3);

        assertEquals(List.of(tempDir.resolve("a.markdown"), tempDir.resolve("b.md")), files);
    }

    @Test
    void countElementsByKind() throws IOException {
        Path file = tempDir.resolve("refs.md");
        Files.writeString(file, "[a]: http://a\n[b]: http://b\n");

        MarkdownFileReport report = App.analyzeFile(file, MarkframeConfig.defaults());

        assertEquals(2, App.countElements(report.elements, ElementKind.LINK_REFERENCE_DEFINITION));
        assertEquals(3, report.lineCount);
    }
}
