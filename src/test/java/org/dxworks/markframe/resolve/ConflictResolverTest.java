package org.dxworks.markframe.resolve;

import org.dxworks.markframe.model.Element;
import org.dxworks.markframe.model.ElementKind;
import org.dxworks.markframe.model.ElementPayload;
import org.dxworks.markframe.model.ElementPayload.CodeBlock;
import org.dxworks.markframe.model.ElementPayload.FormattedText;
import org.dxworks.markframe.model.ElementPayload.InlineCode;
import org.dxworks.markframe.model.ElementPayload.InlineWidget;
import org.dxworks.markframe.model.ElementPayload.LineStyle;
import org.dxworks.markframe.model.ElementPayload.Link;
import org.dxworks.markframe.model.ElementPayload.LinkStyle;
import org.dxworks.markframe.model.ElementPayload.Tag;
import org.dxworks.markframe.model.ElementPayload.TextStyle;
import org.dxworks.markframe.model.ElementPayload.WidgetStyle;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConflictResolverTest {

    private final ConflictResolver resolver = new ConflictResolver();

    private static Element bold(int from, int to) {
        return inline(ElementKind.INLINE_BOLD, from, to, new FormattedText(TextStyle.BOLD, from + 2, to - 2));
    }

    private static Element italic(int from, int to) {
        return inline(ElementKind.INLINE_ITALIC, from, to, new FormattedText(TextStyle.ITALIC, from + 1, to - 1));
    }

    private static Element code(int from, int to) {
        return inline(ElementKind.INLINE_CODE, from, to, new InlineCode("c", from + 1, to - 1));
    }

    private static Element inline(ElementKind kind, int from, int to, ElementPayload payload) {
        return Element.onLine(kind, from, to, 1, null, payload);
    }

    @Test
    void emphasisNestsInsideEmphasis() {
        Element bold = bold(0, 21);
        Element italic = italic(7, 12);

        assertEquals(List.of(bold, italic), resolver.resolve(List.of(italic, bold)));
    }

    @Test
    void inlineCodeDropsEverythingInside() {
        Element code = code(0, 10);

        assertEquals(List.of(code), resolver.resolve(List.of(bold(2, 8), code)));
    }

    @Test
    void linkDropsContainedInlineElements() {
        Element link = inline(ElementKind.INLINE_LINK, 0, 20,
                new Link(LinkStyle.MARKDOWN, "x", "http://x", null, 1, 10));
        Element tag = inline(ElementKind.INLINE_TAG, 2, 6, new Tag("tag", 3, 6));

        assertEquals(List.of(link), resolver.resolve(List.of(link, bold(1, 9), tag)));
    }

    @Test
    void inlineWidgetReplacesWholeSpan() {
        Element kbd = inline(ElementKind.INLINE_OTHER, 0, 20, new InlineWidget(WidgetStyle.KBD, "**x**", 5, 14));

        assertEquals(List.of(kbd), resolver.resolve(List.of(kbd, bold(5, 10))));
    }

    @Test
    void partialOverlapKeepsHigherPriority() {
        Element code = code(5, 15);

        assertEquals(List.of(code), resolver.resolve(List.of(bold(0, 10), code)));
    }

    @Test
    void partialOverlapLaterHigherPriorityEvictsEarlier() {
        Element bold = bold(3, 12);

        assertEquals(List.of(bold), resolver.resolve(List.of(italic(0, 5), bold)));
    }

    @Test
    void partialOverlapBetweenEqualKindsKeepsEarlier() {
        Element first = italic(0, 5);

        assertEquals(List.of(first), resolver.resolve(List.of(italic(3, 8), first)));
    }

    @Test
    void sameSpanKeepsHigherPriority() {
        Element bold = bold(0, 6);

        assertEquals(List.of(bold), resolver.resolve(List.of(italic(0, 6), bold)));
    }

    @Test
    void multiLineBlockDropsContainedElementsButKeepsLineStyles() {
        Element block = Element.block(ElementKind.CODE_BLOCK, 0, 30, 1, 3, "x", new CodeBlock("", "x"));
        Element style = inline(ElementKind.HEADING, 4, 4, new LineStyle("cm-heading cm-heading-1", Map.of()));
        Element marker = inline(ElementKind.HEADING, 4, 6, new ElementPayload.HeadingMarker(1, "x"));

        List<Element> resolved = resolver.resolve(List.of(marker, style, block, bold(10, 16)));

        assertEquals(List.of(block, style), resolved);
    }

    @Test
    void survivorsAreDisjointOrNested() {
        List<Element> candidates = List.of(
                bold(0, 21), italic(7, 12), code(10, 18), italic(15, 25),
                inline(ElementKind.INLINE_TAG, 30, 34, new Tag("tag", 31, 34)), bold(32, 40));

        List<Element> resolved = resolver.resolve(candidates);

        for (Element a : resolved) {
            for (Element b : resolved) {
                if (a == b || a.isPoint() || b.isPoint() || !a.overlaps(b)) continue;
                assertTrue(a.contains(b) || b.contains(a), a + " partially overlaps " + b);
            }
        }
        assertTrue(resolved.stream().anyMatch(e -> e.kind == ElementKind.INLINE_CODE));
    }

    @Test
    void resultIsInDocumentOrder() {
        Element first = code(0, 3);
        Element second = bold(5, 10);

        assertEquals(List.of(first, second), resolver.resolve(List.of(second, first)));
    }

    @Test
    void dropsContainedRules() {
        Element block = Element.block(ElementKind.TABLE, 0, 30, 1, 3, null,
                new ElementPayload.Table(List.of(), List.of(), true));
        assertTrue(ConflictResolver.dropsContained(block, bold(1, 9)));
        assertTrue(ConflictResolver.dropsContained(code(0, 10), bold(1, 9)));
        assertFalse(ConflictResolver.dropsContained(bold(0, 21), italic(7, 12)));
    }

    @Test
    void rejectedCandidateDoesNotEvictEarlierSurvivor() {
        Element italic = italic(0, 20);
        Element code = code(5, 10);
        Element bold = bold(8, 25);

        assertEquals(List.of(italic, code), resolver.resolve(List.of(bold, code, italic)));
    }
}
