package org.dxworks.markframe.resolve;

import org.dxworks.markframe.model.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes overlapping elements so that every surviving pair is either disjoint or cleanly nested.
 * <ul>
 *     <li>Zero-length line style elements never conflict.</li>
 *     <li>Identical spans keep the higher-priority kind.</li>
 *     <li>Nesting is kept, except inside multi-line block widgets (which drop everything they contain)
 *     and inside inline elements replaced as a whole (which drop contained inline elements).</li>
 *     <li>On partial overlap the higher-priority kind survives; between equal kinds the earlier one does.</li>
 * </ul>
 */
public class ConflictResolver {

    public List<Element> resolve(List<Element> elements) {
        List<Element> sorted = new ArrayList<>(elements);
        sorted.sort(Element.DOCUMENT_ORDER);

        List<Element> survivors = new ArrayList<>(sorted.size());
        // survivors that may still overlap later candidates
        List<Element> active = new ArrayList<>();

        for (Element candidate : sorted) {
            if (candidate.isPoint()) {
                survivors.add(candidate);
                continue;
            }
            active.removeIf(kept -> kept.to <= candidate.from);

            boolean keep = true;
            List<Element> evicted = new ArrayList<>();
            for (Element kept : active) {
                if (!kept.overlaps(candidate)) {
                    continue;
                }
                if (kept.contains(candidate)) {
                    if (isSameSpan(kept, candidate) || dropsContained(kept, candidate)) {
                        keep = false;
                        break;
                    }
                    continue;
                }
                if (candidate.kind.outranks(kept.kind)) {
                    evicted.add(kept);
                } else {
                    keep = false;
                    break;
                }
            }
            if (keep) {
                // evictions only count once the candidate is known to survive
                active.removeAll(evicted);
                survivors.removeAll(evicted);
                survivors.add(candidate);
                active.add(candidate);
            }
        }
        return List.copyOf(survivors);
    }

    private static boolean isSameSpan(Element a, Element b) {
        return a.from == b.from && a.to == b.to;
    }

    static boolean dropsContained(Element outer, Element inner) {
        if (outer.kind.isMultiLineBlock()) {
            return true;
        }
        return outer.replacesWholeSpan() && inner.kind.isInline();
    }
}
