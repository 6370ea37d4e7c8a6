package org.dxworks.markframe.model;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Map;

/**
 * Construct-specific data of an {@link Element}. Each variant carries exactly what its kind needs.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "variant")
public sealed interface ElementPayload {

    /**
     * Inline variants know where their visible content sits inside the syntax span.
     */
    sealed interface Inline extends ElementPayload {
        int contentFrom();

        int contentTo();

        Inline shift(int delta);
    }

    enum MathDelimiter { DOLLARS, SINGLE_LINE_DOLLARS, BRACKETS, ENVIRONMENT }

    enum Alignment { NONE, LEFT, CENTER, RIGHT }

    enum FoldState { NONE, EXPANDED, COLLAPSED }

    enum ListType { BULLET, NUMBERED, TASK }

    enum TextStyle {
        BOLD("cm-strong"),
        ITALIC("cm-em"),
        BOLD_ITALIC("cm-strong cm-em"),
        STRIKETHROUGH("cm-strikethrough"),
        HIGHLIGHT("cm-highlight");

        private final String styleClass;

        TextStyle(String styleClass) {
            this.styleClass = styleClass;
        }

        public String getStyleClass() {
            return styleClass;
        }
    }

    enum LinkStyle { MARKDOWN, WIKI, REFERENCE, AUTOLINK, BARE_URL }

    enum WidgetStyle { SUPERSCRIPT, SUBSCRIPT, KBD, FOOTNOTE_REFERENCE }

    // ---- blocks ----

    record CodeBlock(String language, String code) implements ElementPayload {
    }

    record MathBlock(String latex, MathDelimiter delimiter, String environment) implements ElementPayload {
    }

    record Table(List<List<String>> rows, List<Alignment> alignments, boolean hasHeader) implements ElementPayload {
        public Table {
            rows = rows.stream().map(List::copyOf).toList();
            alignments = List.copyOf(alignments);
        }
    }

    record Callout(String calloutType, String title, List<String> bodyLines, FoldState foldState)
            implements ElementPayload {
        public Callout {
            bodyLines = List.copyOf(bodyLines);
        }
    }

    record Details(String summary, List<String> contentLines, boolean open) implements ElementPayload {
        public Details {
            contentLines = List.copyOf(contentLines);
        }
    }

    record FootnoteDefinition(String id, String content) implements ElementPayload {
    }

    record ReferenceDefinition(String label, String url, String title) implements ElementPayload {
    }

    // ---- line structure ----

    record LineStyle(String styleClass, Map<String, String> attributes) implements ElementPayload {
        public LineStyle {
            attributes = Map.copyOf(attributes);
        }
    }

    record HeadingMarker(int level, String text) implements ElementPayload {
    }

    record QuoteMarker(int depth) implements ElementPayload {
    }

    record ListMarker(ListType listType, String marker, boolean checked, int indent) implements ElementPayload {
    }

    record HorizontalRule() implements ElementPayload {
    }

    // ---- inline ----

    record FormattedText(TextStyle style, int contentFrom, int contentTo) implements Inline {
        @Override
        public Inline shift(int delta) {
            return new FormattedText(style, contentFrom + delta, contentTo + delta);
        }
    }

    record InlineCode(String code, int contentFrom, int contentTo) implements Inline {
        @Override
        public Inline shift(int delta) {
            return new InlineCode(code, contentFrom + delta, contentTo + delta);
        }
    }

    record InlineMath(String latex, int contentFrom, int contentTo) implements Inline {
        @Override
        public Inline shift(int delta) {
            return new InlineMath(latex, contentFrom + delta, contentTo + delta);
        }
    }

    record Link(LinkStyle linkStyle, String text, String url, String title, int contentFrom, int contentTo)
            implements Inline {
        @Override
        public Inline shift(int delta) {
            return new Link(linkStyle, text, url, title, contentFrom + delta, contentTo + delta);
        }
    }

    record Image(String alt, String url, String title, Integer width, boolean reference,
                 int contentFrom, int contentTo) implements Inline {
        @Override
        public Inline shift(int delta) {
            return new Image(alt, url, title, width, reference, contentFrom + delta, contentTo + delta);
        }
    }

    record Embed(String target, int contentFrom, int contentTo) implements Inline {
        @Override
        public Inline shift(int delta) {
            return new Embed(target, contentFrom + delta, contentTo + delta);
        }
    }

    record InlineWidget(WidgetStyle widgetStyle, String text, int contentFrom, int contentTo) implements Inline {
        @Override
        public Inline shift(int delta) {
            return new InlineWidget(widgetStyle, text, contentFrom + delta, contentTo + delta);
        }
    }

    record Tag(String name, int contentFrom, int contentTo) implements Inline {
        @Override
        public Inline shift(int delta) {
            return new Tag(name, contentFrom + delta, contentTo + delta);
        }
    }
}
