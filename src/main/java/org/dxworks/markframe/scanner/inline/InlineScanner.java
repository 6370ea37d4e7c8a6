package org.dxworks.markframe.scanner.inline;

import org.dxworks.markframe.document.DocumentLine;
import org.dxworks.markframe.document.DocumentSnapshot;
import org.dxworks.markframe.model.Element;
import org.dxworks.markframe.model.ReferenceTable;
import org.dxworks.markframe.scanner.block.BlockScanResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Line structure and inline constructs of every line not claimed by a block.
 */
public class InlineScanner {

    private final LineStructureScanner lineStructureScanner = new LineStructureScanner();
    private final List<InlineRule> rules;
    private final LineElementCache cache;

    public InlineScanner(LineElementCache cache) {
        this(cache, InlineRules.ordered());
    }

    InlineScanner(LineElementCache cache, List<InlineRule> rules) {
        this.cache = cache;
        this.rules = List.copyOf(rules);
    }

    public List<Element> scan(DocumentSnapshot snapshot, BlockScanResult blocks) {
        return scan(snapshot, blocks, 1, snapshot.lineCount());
    }

    /**
     * Scans lines {@code firstLine..lastLine} (1-based, inclusive, clamped to the document).
     */
    public List<Element> scan(DocumentSnapshot snapshot, BlockScanResult blocks, int firstLine, int lastLine) {
        ReferenceTable references = blocks.references();
        String signature = references.signature();
        int first = Math.max(1, firstLine);
        int last = Math.min(snapshot.lineCount(), lastLine);

        List<Element> elements = new ArrayList<>();
        for (int number = first; number <= last; number++) {
            if (blocks.isOccupied(number)) {
                continue;
            }
            DocumentLine line = snapshot.line(number);
            if (line.text.isBlank()) {
                continue;
            }
            elements.addAll(cache.get(line, signature, l -> scanLine(l, references)));
        }
        return elements;
    }

    /**
     * Uncached scan of a single line, in document order.
     */
    public List<Element> scanLine(DocumentLine line, ReferenceTable references) {
        List<Element> elements = new ArrayList<>();
        LineStructureScanner.LineStructure structure = lineStructureScanner.scan(line);
        elements.addAll(structure.elements());
        if (!structure.horizontalRule()) {
            InlineContext context = new InlineContext(line, references);
            for (InlineRule rule : rules) {
                rule.collect(context, elements);
            }
        }
        elements.sort(Element.DOCUMENT_ORDER);
        return List.copyOf(elements);
    }
}
