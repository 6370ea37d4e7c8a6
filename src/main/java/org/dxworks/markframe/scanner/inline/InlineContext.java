package org.dxworks.markframe.scanner.inline;

import org.dxworks.markframe.document.DocumentLine;
import org.dxworks.markframe.model.Element;
import org.dxworks.markframe.model.ElementKind;
import org.dxworks.markframe.model.ElementPayload;
import org.dxworks.markframe.model.ReferenceTable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * The line being scanned by the inline rules, with the document's reference table.
 * Rule code works with line-relative indices; {@link #element} converts them to document offsets.
 */
public final class InlineContext {

    private final DocumentLine line;
    private final ReferenceTable references;
    private List<int[]> linkSpans;

    public InlineContext(DocumentLine line, ReferenceTable references) {
        this.line = line;
        this.references = references;
    }

    public String text() {
        return line.text;
    }

    public int lineNumber() {
        return line.number;
    }

    public ReferenceTable references() {
        return references;
    }

    public Iterable<MatchResult> matches(Pattern pattern) {
        return MatchSequence.of(pattern, line.text);
    }

    /** Document offset of a line-relative index. */
    public int abs(int index) {
        return line.from + index;
    }

    public boolean isEscaped(int index) {
        return Escapes.isEscaped(line.text, index);
    }

    /**
     * Whether the opening marker (match start) or the closing marker (end of group 1) is escaped.
     */
    public boolean hasEscapedDelimiter(MatchResult match) {
        return isEscaped(match.start()) || isEscaped(match.end(1));
    }

    public char charAt(int index) {
        return index >= 0 && index < line.text.length() ? line.text.charAt(index) : '\0';
    }

    /**
     * Whether {@code [start, end)} lies inside the syntax of a markdown link, image or autolink on this line.
     */
    public boolean isInsideLinkSyntax(int start, int end) {
        if (linkSpans == null) {
            linkSpans = new ArrayList<>();
            for (Pattern pattern : InlineRules.LINK_SYNTAX) {
                for (MatchResult match : matches(pattern)) {
                    linkSpans.add(new int[]{match.start(), match.end()});
                }
            }
        }
        for (int[] span : linkSpans) {
            boolean same = span[0] == start && span[1] == end;
            if (!same && span[0] <= start && end <= span[1]) {
                return true;
            }
        }
        return false;
    }

    public Element element(ElementKind kind, int start, int end, String content, ElementPayload payload) {
        return Element.onLine(kind, abs(start), abs(end), line.number, content, payload);
    }
}
