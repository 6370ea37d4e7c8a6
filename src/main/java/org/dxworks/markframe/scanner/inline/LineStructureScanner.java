package org.dxworks.markframe.scanner.inline;

import org.dxworks.markframe.document.DocumentLine;
import org.dxworks.markframe.model.Element;
import org.dxworks.markframe.model.ElementKind;
import org.dxworks.markframe.model.ElementPayload.HeadingMarker;
import org.dxworks.markframe.model.ElementPayload.HorizontalRule;
import org.dxworks.markframe.model.ElementPayload.LineStyle;
import org.dxworks.markframe.model.ElementPayload.ListMarker;
import org.dxworks.markframe.model.ElementPayload.ListType;
import org.dxworks.markframe.model.ElementPayload.QuoteMarker;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Headings, quotations, list items and horizontal rules.
 * <p>
 * Each structure yields a zero-length line style element at the line start plus a marker
 * element spanning only the syntax marker, so the marker can be revealed while the line keeps its style.
 * Quotation prefixes are consumed first; a heading or list item may follow them.
 */
public final class LineStructureScanner {

    private static final Pattern HORIZONTAL_RULE = Pattern.compile("^[ ]{0,3}(?:(?:-[ \\t]*){3,}|(?:\\*[ \\t]*){3,}|(?:_[ \\t]*){3,})$");
    private static final Pattern QUOTE_PREFIX = Pattern.compile("^(?:[ ]{0,3}>[ ]?)+");
    private static final Pattern HEADING = Pattern.compile("^(#{1,6})(?:[ \\t]+(.*?))?(?:[ \\t]+#+)?[ \\t]*$");
    private static final Pattern LIST_ITEM = Pattern.compile("^([ \\t]*)([-*+]|\\d{1,9}[.)])[ \\t]+(?:\\[([ xX])\\][ \\t]+)?");

    public record LineStructure(List<Element> elements, boolean horizontalRule) {
        public LineStructure {
            elements = List.copyOf(elements);
        }
    }

    public LineStructure scan(DocumentLine line) {
        String text = line.text;
        if (HORIZONTAL_RULE.matcher(text).matches()) {
            return new LineStructure(List.of(Element.onLine(ElementKind.HORIZONTAL_RULE, line.from, line.to,
                    line.number, null, new HorizontalRule())), true);
        }

        List<Element> elements = new ArrayList<>();
        int offset = 0;

        Matcher quote = QUOTE_PREFIX.matcher(text);
        if (quote.lookingAt()) {
            int depth = (int) quote.group().chars().filter(c -> c == '>').count();
            elements.add(lineStyle(line, ElementKind.BLOCKQUOTE, "cm-blockquote", Map.of("data-depth", String.valueOf(depth))));
            elements.add(Element.onLine(ElementKind.BLOCKQUOTE, line.from, line.from + quote.end(),
                    line.number, null, new QuoteMarker(depth)));
            offset = quote.end();
        }

        String rest = text.substring(offset);
        Matcher heading = HEADING.matcher(rest);
        if (heading.matches()) {
            int level = heading.group(1).length();
            String title = heading.group(2) == null ? "" : heading.group(2).trim();
            int markerEnd = heading.group(2) == null ? heading.end(1) : heading.start(2);
            elements.add(lineStyle(line, ElementKind.HEADING, "cm-heading cm-heading-" + level,
                    Map.of("data-level", String.valueOf(level))));
            elements.add(Element.onLine(ElementKind.HEADING, line.from + offset, line.from + offset + markerEnd,
                    line.number, title, new HeadingMarker(level, title)));
            return new LineStructure(elements, false);
        }

        Matcher list = LIST_ITEM.matcher(rest);
        if (list.lookingAt()) {
            int indent = indentWidth(list.group(1));
            String marker = list.group(2);
            String box = list.group(3);
            ListType type = box != null ? ListType.TASK
                    : Character.isDigit(marker.charAt(0)) ? ListType.NUMBERED : ListType.BULLET;
            boolean checked = box != null && box.equalsIgnoreCase("x");
            elements.add(lineStyle(line, ElementKind.LIST_ITEM,
                    "cm-list-item cm-list-" + type.name().toLowerCase(Locale.ROOT),
                    Map.of("data-indent", String.valueOf(indent))));
            elements.add(Element.onLine(ElementKind.LIST_ITEM, line.from + offset + list.start(2),
                    line.from + offset + list.end(), line.number, marker,
                    new ListMarker(type, marker, checked, indent)));
        }
        return new LineStructure(elements, false);
    }

    private static Element lineStyle(DocumentLine line, ElementKind kind, String styleClass, Map<String, String> attributes) {
        return Element.onLine(kind, line.from, line.from, line.number, null, new LineStyle(styleClass, attributes));
    }

    private static int indentWidth(String whitespace) {
        int width = 0;
        for (char c : whitespace.toCharArray()) {
            width += c == '\t' ? 4 : 1;
        }
        return width;
    }
}
