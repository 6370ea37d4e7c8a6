package org.dxworks.markframe.scanner.block;

import org.dxworks.markframe.document.DocumentSnapshot;
import org.dxworks.markframe.model.Element;
import org.dxworks.markframe.model.ElementKind;
import org.dxworks.markframe.model.ElementPayload;
import org.dxworks.markframe.model.ReferenceTable;
import org.dxworks.markframe.scanner.block.BlockMatch.CalloutMatch;
import org.dxworks.markframe.scanner.block.BlockMatch.CodeBlockMatch;
import org.dxworks.markframe.scanner.block.BlockMatch.DetailsMatch;
import org.dxworks.markframe.scanner.block.BlockMatch.FootnoteDefinitionMatch;
import org.dxworks.markframe.scanner.block.BlockMatch.MathBlockMatch;
import org.dxworks.markframe.scanner.block.BlockMatch.ReferenceDefinitionMatch;
import org.dxworks.markframe.scanner.block.BlockMatch.TableMatch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs the block scanners over a whole snapshot.
 * Code fences are scanned first and their lines are hidden from every other scanner;
 * math blocks are hidden from tables and the remaining constructs.
 */
public class BlockScanPipeline {

    private final CodeFenceScanner codeFenceScanner = new CodeFenceScanner();
    private final MathBlockScanner mathBlockScanner = new MathBlockScanner();
    private final TableScanner tableScanner = new TableScanner();
    private final CalloutScanner calloutScanner = new CalloutScanner();
    private final DetailsScanner detailsScanner = new DetailsScanner();
    private final FootnoteDefinitionScanner footnoteDefinitionScanner = new FootnoteDefinitionScanner();
    private final ReferenceDefinitionScanner referenceDefinitionScanner = new ReferenceDefinitionScanner();

    public BlockScanResult scan(DocumentSnapshot snapshot) {
        BlockScanContext context = new BlockScanContext(snapshot.lines(), snapshot.length(), Set.of());

        List<CodeBlockMatch> codeBlocks = codeFenceScanner.scan(context);
        BlockScanContext outsideCode = context.excluding(linesOf(codeBlocks));

        List<MathBlockMatch> mathBlocks = mathBlockScanner.scan(outsideCode);
        BlockScanContext outsideOpaque = outsideCode.excluding(linesOf(mathBlocks));

        List<BlockMatch> matches = new ArrayList<>();
        matches.addAll(codeBlocks);
        matches.addAll(mathBlocks);
        matches.addAll(tableScanner.scan(outsideOpaque));
        matches.addAll(calloutScanner.scan(outsideOpaque));
        matches.addAll(detailsScanner.scan(outsideOpaque));
        matches.addAll(footnoteDefinitionScanner.scan(outsideOpaque));
        List<ReferenceDefinitionMatch> definitions = referenceDefinitionScanner.scan(outsideOpaque);
        matches.addAll(definitions);
        matches.sort(Comparator.comparingInt(BlockMatch::from).thenComparingInt(BlockMatch::startLine));

        List<Element> elements = new ArrayList<>(matches.size());
        for (BlockMatch match : matches) {
            elements.add(toElement(match));
        }
        return new BlockScanResult(matches, elements, linesOf(matches), buildReferenceTable(definitions));
    }

    static Element toElement(BlockMatch match) {
        if (match instanceof CodeBlockMatch code) {
            return Element.block(ElementKind.CODE_BLOCK, code.from(), code.to(), code.startLine(), code.endLine(),
                    code.code(), new ElementPayload.CodeBlock(code.language(), code.code()));
        }
        if (match instanceof MathBlockMatch math) {
            return Element.block(ElementKind.MATH_BLOCK, math.from(), math.to(), math.startLine(), math.endLine(),
                    math.latex(), new ElementPayload.MathBlock(math.latex(), math.delimiter(), math.environment()));
        }
        if (match instanceof TableMatch table) {
            return Element.block(ElementKind.TABLE, table.from(), table.to(), table.startLine(), table.endLine(),
                    null, new ElementPayload.Table(table.rows(), table.alignments(), table.hasHeader()));
        }
        if (match instanceof CalloutMatch callout) {
            return Element.block(ElementKind.CALLOUT, callout.from(), callout.to(),
                    callout.startLine(), callout.endLine(),
                    String.join("\n", callout.bodyLines()),
                    new ElementPayload.Callout(callout.calloutType(), callout.title(),
                            callout.bodyLines(), callout.foldState()));
        }
        if (match instanceof DetailsMatch details) {
            return Element.block(ElementKind.DETAILS, details.from(), details.to(),
                    details.startLine(), details.endLine(),
                    details.summary(),
                    new ElementPayload.Details(details.summary(), details.contentLines(), details.open()));
        }
        if (match instanceof FootnoteDefinitionMatch footnote) {
            return Element.block(ElementKind.FOOTNOTE_DEFINITION, footnote.from(), footnote.to(),
                    footnote.startLine(), footnote.endLine(),
                    footnote.content(), new ElementPayload.FootnoteDefinition(footnote.id(), footnote.content()));
        }
        ReferenceDefinitionMatch definition = (ReferenceDefinitionMatch) match;
        return Element.block(ElementKind.LINK_REFERENCE_DEFINITION, definition.from(), definition.to(),
                definition.startLine(), definition.endLine(),
                definition.label(),
                new ElementPayload.ReferenceDefinition(definition.label(), definition.url(), definition.title()));
    }

    private static ReferenceTable buildReferenceTable(List<ReferenceDefinitionMatch> definitions) {
        ReferenceTable.Builder builder = ReferenceTable.builder();
        for (ReferenceDefinitionMatch definition : definitions) {
            builder.define(definition.label(), definition.url(), definition.title());
        }
        return builder.build();
    }

    private static Set<Integer> linesOf(List<? extends BlockMatch> matches) {
        Set<Integer> lines = new HashSet<>();
        for (BlockMatch match : matches) {
            for (int line = match.startLine(); line <= match.endLine(); line++) {
                lines.add(line);
            }
        }
        return lines;
    }
}
