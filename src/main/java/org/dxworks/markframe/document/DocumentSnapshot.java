package org.dxworks.markframe.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Immutable view of the editor's text at one point in time.
 * Two snapshots are the same document state only if they share the same {@link #identity()}.
 */
public final class DocumentSnapshot {

    private static final AtomicLong IDENTITIES = new AtomicLong();

    private final String text;
    private final List<DocumentLine> lines;
    private final long identity;

    private DocumentSnapshot(String text, List<DocumentLine> lines) {
        this.text = text;
        this.lines = lines;
        this.identity = IDENTITIES.incrementAndGet();
    }

    public static DocumentSnapshot of(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Document text must not be null");
        }
        return new DocumentSnapshot(text, splitLines(text));
    }

    private static List<DocumentLine> splitLines(String text) {
        List<DocumentLine> lines = new ArrayList<>();
        int start = 0;
        int number = 1;
        while (true) {
            int newline = text.indexOf('\n', start);
            if (newline < 0) {
                lines.add(new DocumentLine(number, start, text.substring(start)));
                break;
            }
            int end = newline;
            // CRLF: keep \r out of the line text so line patterns match
            if (end > start && text.charAt(end - 1) == '\r') {
                end--;
            }
            lines.add(new DocumentLine(number++, start, text.substring(start, end)));
            start = newline + 1;
        }
        return Collections.unmodifiableList(lines);
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public int lineCount() {
        return lines.size();
    }

    public long identity() {
        return identity;
    }

    public List<DocumentLine> lines() {
        return lines;
    }

    /**
     * @param number 1-based line number
     */
    public DocumentLine line(int number) {
        if (number < 1 || number > lines.size()) {
            throw new IllegalArgumentException("Line " + number + " out of range [1, " + lines.size() + "]");
        }
        return lines.get(number - 1);
    }

    public DocumentLine lineAt(int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IllegalArgumentException("Offset " + offset + " out of range [0, " + text.length() + "]");
        }
        int low = 0;
        int high = lines.size() - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lines.get(mid).from <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return lines.get(low);
    }

    public boolean isSameState(DocumentSnapshot other) {
        return other != null && other.identity == identity;
    }
}
