package org.dxworks.markframe.engine;

import org.dxworks.markframe.document.DocumentSnapshot;

/**
 * Visible line range of the editor, 1-based and inclusive.
 */
public record Viewport(int firstLine, int lastLine) {

    public Viewport {
        if (firstLine < 1 || lastLine < firstLine) {
            throw new IllegalArgumentException("Invalid viewport lines " + firstLine + ".." + lastLine);
        }
    }

    public static Viewport ofOffsets(DocumentSnapshot snapshot, int from, int to) {
        int clampedFrom = Math.max(0, Math.min(from, snapshot.length()));
        int clampedTo = Math.max(clampedFrom, Math.min(to, snapshot.length()));
        return new Viewport(snapshot.lineAt(clampedFrom).number, snapshot.lineAt(clampedTo).number);
    }

    public Viewport widen(int buffer, int lineCount) {
        int last = Math.max(1, Math.min(lineCount, lastLine + buffer));
        int first = Math.min(last, Math.max(1, firstLine - buffer));
        return new Viewport(first, last);
    }

    public boolean containsLine(int lineNumber) {
        return firstLine <= lineNumber && lineNumber <= lastLine;
    }
}
