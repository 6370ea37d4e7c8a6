package org.dxworks.markframe.document;

/**
 * One line of a {@link DocumentSnapshot}. {@code to} excludes the line break.
 */
public final class DocumentLine {
    public final int number; // 1-based
    public final int from;
    public final int to;
    public final String text;

    public DocumentLine(int number, int from, String text) {
        this.number = number;
        this.from = from;
        this.to = from + text.length();
        this.text = text;
    }

    public int length() {
        return text.length();
    }

    @Override
    public String toString() {
        return number + "[" + from + "," + to + "]: " + text;
    }
}
