package org.dxworks.markframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Comparator;
import java.util.Objects;

/**
 * A recognized construct, produced by both the block and the inline scanners.
 * Offsets are absolute document offsets; {@code startLine}/{@code endLine} are only set
 * when the element spans more than one line.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Element {

    /** Ascending start, longer spans first, then higher priority first. */
    public static final Comparator<Element> DOCUMENT_ORDER = Comparator
            .comparingInt((Element e) -> e.from)
            .thenComparing(e -> e.to, Comparator.reverseOrder())
            .thenComparing(e -> e.kind, ElementKind.PRIORITY);

    public final ElementKind kind;
    public final int from;
    public final int to;
    public final int lineNumber;
    public final Integer startLine;
    public final Integer endLine;
    public final String content;
    public final ElementPayload payload;

    private Element(ElementKind kind, int from, int to, int lineNumber,
                    Integer startLine, Integer endLine, String content, ElementPayload payload) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.payload = Objects.requireNonNull(payload, "payload");
        if (from < 0 || from > to) {
            throw new IllegalArgumentException("Invalid element range [" + from + ", " + to + "] for " + kind);
        }
        if ((startLine == null) != (endLine == null)) {
            throw new IllegalArgumentException("startLine and endLine must be set together for " + kind);
        }
        if (startLine != null && startLine >= endLine) {
            throw new IllegalArgumentException("Line span " + startLine + ".." + endLine + " is not multi-line for " + kind);
        }
        this.from = from;
        this.to = to;
        this.lineNumber = lineNumber;
        this.startLine = startLine;
        this.endLine = endLine;
        this.content = content;
    }

    public static Element onLine(ElementKind kind, int from, int to, int lineNumber,
                                 String content, ElementPayload payload) {
        return new Element(kind, from, to, lineNumber, null, null, content, payload);
    }

    /**
     * Creates a block element; the line span is only recorded when it covers several lines.
     */
    public static Element block(ElementKind kind, int from, int to, int startLine, int endLine,
                                String content, ElementPayload payload) {
        if (endLine > startLine) {
            return new Element(kind, from, to, startLine, startLine, endLine, content, payload);
        }
        return new Element(kind, from, to, startLine, null, null, content, payload);
    }

    @JsonIgnore
    public boolean isMultiLine() {
        return startLine != null;
    }

    public int firstLine() {
        return startLine != null ? startLine : lineNumber;
    }

    public int lastLine() {
        return endLine != null ? endLine : lineNumber;
    }

    @JsonIgnore
    public boolean isPoint() {
        return from == to;
    }

    @JsonIgnore
    public boolean isLineStyle() {
        return payload instanceof ElementPayload.LineStyle;
    }

    /** Whether rendering swaps the whole syntax span for a widget. */
    public boolean replacesWholeSpan() {
        return kind.replacesWholeSpan() || payload instanceof ElementPayload.InlineWidget;
    }

    public boolean contains(Element other) {
        return from <= other.from && other.to <= to;
    }

    public boolean overlaps(Element other) {
        return from < other.to && other.from < to;
    }

    public boolean covers(int offset) {
        return from <= offset && offset <= to;
    }

    public int contentFrom() {
        return payload instanceof ElementPayload.Inline inline ? inline.contentFrom() : from;
    }

    public int contentTo() {
        return payload instanceof ElementPayload.Inline inline ? inline.contentTo() : to;
    }

    /**
     * Same element moved by {@code delta} characters; used when a line moved without changing.
     */
    public Element shift(int delta) {
        if (delta == 0) {
            return this;
        }
        ElementPayload shiftedPayload = payload instanceof ElementPayload.Inline inline
                ? inline.shift(delta)
                : payload;
        return new Element(kind, from + delta, to + delta, lineNumber, startLine, endLine, content, shiftedPayload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Element other)) return false;
        return from == other.from && to == other.to && lineNumber == other.lineNumber
                && kind == other.kind
                && Objects.equals(startLine, other.startLine)
                && Objects.equals(endLine, other.endLine)
                && Objects.equals(content, other.content)
                && payload.equals(other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, from, to, lineNumber, startLine, endLine, content, payload);
    }

    @Override
    public String toString() {
        return kind + "[" + from + "," + to + "]@" + lineNumber + " " + payload;
    }
}
