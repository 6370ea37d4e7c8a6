package org.dxworks.markframe.decoration;

import org.dxworks.markframe.model.ElementKind;

import java.util.List;

/**
 * Reveals an element when any caret touches it (inclusive of both ends) or any
 * non-empty selection overlaps it.
 */
public final class SelectionRevealOracle implements RevealOracle {

    public record SelectionRange(int anchor, int head) {
        public int from() {
            return Math.min(anchor, head);
        }

        public int to() {
            return Math.max(anchor, head);
        }

        public boolean isEmpty() {
            return anchor == head;
        }
    }

    private final List<SelectionRange> ranges;

    public SelectionRevealOracle(List<SelectionRange> ranges) {
        this.ranges = List.copyOf(ranges);
    }

    public static SelectionRevealOracle caret(int position) {
        return new SelectionRevealOracle(List.of(new SelectionRange(position, position)));
    }

    public static SelectionRevealOracle of(SelectionRange... ranges) {
        return new SelectionRevealOracle(List.of(ranges));
    }

    public List<SelectionRange> ranges() {
        return ranges;
    }

    @Override
    public boolean shouldReveal(int from, int to, ElementKind kind) {
        for (SelectionRange range : ranges) {
            if (range.isEmpty()) {
                if (from <= range.from() && range.from() <= to) return true;
            } else if (range.from() < to && from < range.to()) {
                return true;
            }
        }
        return false;
    }
}
