package org.dxworks.markframe.scanner.block;

import org.dxworks.markframe.document.DocumentSnapshot;
import org.dxworks.markframe.model.Element;
import org.dxworks.markframe.model.ElementKind;
import org.dxworks.markframe.model.ElementPayload;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.dxworks.markframe.TestUtils.ofKind;
import static org.junit.jupiter.api.Assertions.*;

class BlockScanPipelineTest {

    private final BlockScanPipeline pipeline = new BlockScanPipeline();

    @Test
    void codeBlockBecomesMultiLineElement() {
        BlockScanResult result = pipeline.scan(DocumentSnapshot.of("```js\nlet x=1;\n```"));

        assertEquals(1, result.elements().size());
        Element code = result.elements().get(0);
        assertEquals(ElementKind.CODE_BLOCK, code.kind);
        assertEquals("let x=1;", code.content);
        assertEquals(1, code.startLine);
        assertEquals(3, code.endLine);
        assertEquals(new ElementPayload.CodeBlock("js", "let x=1;"), code.payload);
        assertEquals(Set.of(1, 2, 3), result.occupiedLines());
    }

    @Test
    void codeLinesAreHiddenFromOtherScanners() {
        String text = "```\n$$\nx\n$$\n| a | b |\n|---|---|\n[ref]: http://hidden\n> [!note]\n```";

        BlockScanResult result = pipeline.scan(DocumentSnapshot.of(text));

        assertEquals(1, result.elements().size());
        assertEquals(ElementKind.CODE_BLOCK, result.elements().get(0).kind);
        assertTrue(result.references().isEmpty());
    }

    @Test
    void mathLinesAreHiddenFromTables() {
        String text = "$$\n| a | b |\n|---|---|\n$$";

        BlockScanResult result = pipeline.scan(DocumentSnapshot.of(text));

        assertEquals(1, result.elements().size());
        assertEquals(ElementKind.MATH_BLOCK, result.elements().get(0).kind);
        assertTrue(ofKind(result.elements(), ElementKind.TABLE).isEmpty());
    }

    @Test
    void buildsReferenceTableWithFirstDefinitionWinning() {
        String text = "Intro [x]\n\n[x]: http://first \"One\"\n[X]: http://second";

        BlockScanResult result = pipeline.scan(DocumentSnapshot.of(text));

        assertEquals(1, result.references().size());
        assertEquals("http://first", result.references().resolve("x").orElseThrow().url());
        List<Element> definitions = ofKind(result.elements(), ElementKind.LINK_REFERENCE_DEFINITION);
        assertEquals(2, definitions.size());
        assertEquals(Set.of(3, 4), result.occupiedLines());
        assertFalse(result.isOccupied(1));
    }

    @Test
    void elementsAreInDocumentOrder() {
        String text = "> [!tip] Hint\n> body\n\n| A | B |\n|---|---|\n| 1 | 2 |\n\n[^1]: note\n\n<details>\n<summary>S</summary>\n</details>";

        BlockScanResult result = pipeline.scan(DocumentSnapshot.of(text));

        List<ElementKind> kinds = result.elements().stream().map(e -> e.kind).toList();
        assertEquals(List.of(ElementKind.CALLOUT, ElementKind.TABLE, ElementKind.FOOTNOTE_DEFINITION, ElementKind.DETAILS), kinds);
        Element table = result.elements().get(1);
        assertEquals(4, table.startLine);
        assertEquals(6, table.endLine);
        ElementPayload.Table payload = (ElementPayload.Table) table.payload;
        assertEquals(List.of(List.of("A", "B"), List.of("1", "2")), payload.rows());
    }
}
