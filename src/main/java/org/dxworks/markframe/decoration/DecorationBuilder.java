package org.dxworks.markframe.decoration;

import org.dxworks.markframe.decoration.RenderInstruction.LineAttribute;
import org.dxworks.markframe.decoration.RenderInstruction.SpanMark;
import org.dxworks.markframe.decoration.RenderInstruction.SpanReplace;
import org.dxworks.markframe.decoration.RenderInstruction.WidgetAnchor;
import org.dxworks.markframe.document.DocumentLine;
import org.dxworks.markframe.document.DocumentSnapshot;
import org.dxworks.markframe.model.Element;
import org.dxworks.markframe.model.ElementKind;
import org.dxworks.markframe.model.ElementPayload;
import org.dxworks.markframe.model.ElementPayload.FormattedText;
import org.dxworks.markframe.model.ElementPayload.InlineWidget;
import org.dxworks.markframe.model.ElementPayload.LineStyle;
import org.dxworks.markframe.model.ElementPayload.Tag;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Maps resolved elements to render instructions.
 * <p>
 * Line styles always apply. Every other element is skipped while the reveal oracle asks for its raw syntax,
 * except multi-line blocks, which switch to an editing style on each of their lines instead.
 */
public class DecorationBuilder {

    public static final String HIDDEN_LINE_CLASS = "cm-hidden-line";
    public static final String REFERENCE_DEFINITION_CLASS = "cm-link-reference-definition";
    public static final String TAG_CLASS = "cm-tag";

    private record DecorationEntry(int priority, RenderInstruction instruction) {
    }

    private static final Comparator<DecorationEntry> ORDER = Comparator
            .comparingInt((DecorationEntry e) -> e.instruction().from())
            .thenComparingInt(e -> e.instruction().to())
            .thenComparingInt(DecorationEntry::priority)
            .thenComparing(e -> !e.instruction().isLineLevel());

    public DecorationSet build(DocumentSnapshot snapshot, List<Element> elements, RevealOracle oracle) {
        int length = snapshot.length();
        List<DecorationEntry> entries = new ArrayList<>();

        for (Element element : elements) {
            if (element.from < 0 || element.from > element.to) {
                System.err.println("[DecorationBuilder] Warning: skipping " + element.kind
                        + " with invalid range [" + element.from + ", " + element.to + "]");
                continue;
            }
            if (element.from > length) {
                System.err.println("[DecorationBuilder] Warning: skipping " + element.kind
                        + " starting past the document end (" + element.from + " > " + length + ")");
                continue;
            }
            int from = element.from;
            int to = Math.min(element.to, length);
            int priority = element.kind.rank();

            if (element.payload instanceof LineStyle style) {
                DocumentLine line = snapshot.lineAt(from);
                entries.add(new DecorationEntry(priority,
                        new LineAttribute(line.from, line.number, style.styleClass(), style.attributes())));
                continue;
            }
            if (element.kind == ElementKind.LINK_REFERENCE_DEFINITION) {
                DocumentLine line = snapshot.lineAt(from);
                entries.add(new DecorationEntry(priority,
                        new LineAttribute(line.from, line.number, REFERENCE_DEFINITION_CLASS, Map.of())));
                continue;
            }

            boolean revealed = oracle.shouldReveal(from, to, element.kind);
            if (element.kind.isMultiLineBlock()) {
                addBlock(snapshot, element, from, to, revealed, priority, entries);
                continue;
            }
            if (revealed) {
                continue;
            }
            addInline(element, from, to, priority, entries);
        }

        entries.sort(ORDER);
        List<RenderInstruction> instructions = new ArrayList<>(entries.size());
        for (DecorationEntry entry : entries) {
            instructions.add(entry.instruction());
        }
        return new DecorationSet(instructions);
    }

    private static void addBlock(DocumentSnapshot snapshot, Element element, int from, int to, boolean revealed,
                                 int priority, List<DecorationEntry> entries) {
        int firstLine = snapshot.lineAt(from).number;
        int lastLine = snapshot.lineAt(to).number;
        if (revealed) {
            String editing = "cm-" + element.kind.getId() + "-source";
            for (int n = firstLine; n <= lastLine; n++) {
                entries.add(new DecorationEntry(priority, new LineAttribute(snapshot.line(n).from, n, editing, Map.of())));
            }
            return;
        }
        Renderable widget = new Renderable(widgetType(element), element.payload);
        if (lastLine > firstLine) {
            entries.add(new DecorationEntry(priority, new WidgetAnchor(snapshot.line(firstLine).from, widget)));
            for (int n = firstLine; n <= lastLine; n++) {
                entries.add(new DecorationEntry(priority,
                        new LineAttribute(snapshot.line(n).from, n, HIDDEN_LINE_CLASS, Map.of())));
            }
        } else if (from < to) {
            entries.add(new DecorationEntry(priority, new SpanReplace(from, to, widget)));
        }
    }

    private static void addInline(Element element, int from, int to, int priority, List<DecorationEntry> entries) {
        ElementPayload payload = element.payload;
        if (payload instanceof FormattedText text) {
            int contentFrom = Math.min(text.contentFrom(), to);
            int contentTo = Math.min(text.contentTo(), to);
            hide(from, contentFrom, priority, entries);
            if (contentFrom < contentTo) {
                entries.add(new DecorationEntry(priority,
                        new SpanMark(contentFrom, contentTo, text.style().getStyleClass(), Map.of())));
            }
            hide(contentTo, to, priority, entries);
            return;
        }
        if (payload instanceof Tag tag) {
            entries.add(new DecorationEntry(priority,
                    new SpanMark(from, to, TAG_CLASS, Map.of("data-tag", tag.name()))));
            return;
        }
        if (from == to) {
            return;
        }
        WidgetType type = widgetType(element);
        Renderable renderable = type == WidgetType.HIDDEN ? Renderable.hidden() : new Renderable(type, payload);
        entries.add(new DecorationEntry(priority, new SpanReplace(from, to, renderable)));
    }

    private static void hide(int from, int to, int priority, List<DecorationEntry> entries) {
        if (from < to) {
            entries.add(new DecorationEntry(priority, new SpanReplace(from, to, Renderable.hidden())));
        }
    }

    static WidgetType widgetType(Element element) {
        if (element.payload instanceof InlineWidget widget) {
            return switch (widget.widgetStyle()) {
                case SUPERSCRIPT -> WidgetType.SUPERSCRIPT;
                case SUBSCRIPT -> WidgetType.SUBSCRIPT;
                case KBD -> WidgetType.KBD;
                case FOOTNOTE_REFERENCE -> WidgetType.FOOTNOTE_REFERENCE;
            };
        }
        return switch (element.kind) {
            case CODE_BLOCK -> WidgetType.CODE_BLOCK;
            case MATH_BLOCK -> WidgetType.MATH_BLOCK;
            case TABLE -> WidgetType.TABLE;
            case CALLOUT -> WidgetType.CALLOUT;
            case DETAILS -> WidgetType.DETAILS;
            case FOOTNOTE_DEFINITION -> WidgetType.FOOTNOTE_DEFINITION;
            case INLINE_CODE -> WidgetType.INLINE_CODE;
            case INLINE_MATH -> WidgetType.INLINE_MATH;
            case INLINE_LINK -> WidgetType.LINK;
            case INLINE_IMAGE -> WidgetType.IMAGE;
            case INLINE_EMBED -> WidgetType.EMBED;
            case LIST_ITEM -> WidgetType.LIST_MARKER;
            case HORIZONTAL_RULE -> WidgetType.HORIZONTAL_RULE;
            default -> WidgetType.HIDDEN;
        };
    }
}
