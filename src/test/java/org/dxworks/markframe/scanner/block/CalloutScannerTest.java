package org.dxworks.markframe.scanner.block;

import org.dxworks.markframe.model.ElementPayload.FoldState;
import org.dxworks.markframe.scanner.block.BlockMatch.CalloutMatch;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.markframe.TestUtils.blockContext;
import static org.junit.jupiter.api.Assertions.*;

class CalloutScannerTest {

    private final CalloutScanner scanner = new CalloutScanner();

    @Test
    void collapsedCalloutWithTitleAndBody() {
        String text = "> [!Warning]- Careful\n> body one\n>\n> body two\nafter";

        List<CalloutMatch> matches = scanner.scan(blockContext(text));

        assertEquals(1, matches.size());
        CalloutMatch callout = matches.get(0);
        assertEquals("warning", callout.calloutType());
        assertEquals("Careful", callout.title());
        assertEquals(List.of("body one", "body two"), callout.bodyLines());
        assertEquals(FoldState.COLLAPSED, callout.foldState());
        assertEquals(1, callout.startLine());
        assertEquals(4, callout.endLine());
    }

    @Test
    void foldSignIsOptional() {
        List<CalloutMatch> plain = scanner.scan(blockContext("> [!note]"));
        assertEquals(FoldState.NONE, plain.get(0).foldState());
        assertEquals("", plain.get(0).title());

        List<CalloutMatch> expanded = scanner.scan(blockContext("> [!tip]+ Open"));
        assertEquals(FoldState.EXPANDED, expanded.get(0).foldState());
    }

    @Test
    void newHeaderStartsNewCallout() {
        String text = "> [!note] One\n> a\n> [!info] Two\n> b";

        List<CalloutMatch> matches = scanner.scan(blockContext(text));

        assertEquals(2, matches.size());
        assertEquals(2, matches.get(0).endLine());
        assertEquals("info", matches.get(1).calloutType());
        assertEquals(List.of("b"), matches.get(1).bodyLines());
    }

    @Test
    void plainQuotationIsNotCallout() {
        assertTrue(scanner.scan(blockContext("> just a quote")).isEmpty());
    }

    @Test
    void calloutInsideListItem() {
        List<CalloutMatch> matches = scanner.scan(blockContext("- > [!note] Title\n  > body\nafter"));

        assertEquals(1, matches.size());
        assertEquals("note", matches.get(0).calloutType());
        assertEquals("Title", matches.get(0).title());
        assertEquals(List.of("body"), matches.get(0).bodyLines());
        assertEquals(2, matches.get(0).endLine());
    }

    @Test
    void calloutInsideQuotationKeepsItsDepth() {
        List<CalloutMatch> matches = scanner.scan(blockContext("> > [!note] Title\n> > body\n> outer"));

        assertEquals(1, matches.size());
        assertEquals(List.of("body"), matches.get(0).bodyLines());
        assertEquals(1, matches.get(0).startLine());
        assertEquals(2, matches.get(0).endLine());
    }
}
