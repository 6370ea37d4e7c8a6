package org.dxworks.markframe.engine;

import org.dxworks.markframe.MarkframeConfig;
import org.dxworks.markframe.decoration.DecorationBuilder;
import org.dxworks.markframe.decoration.DecorationSet;
import org.dxworks.markframe.decoration.RevealOracle;
import org.dxworks.markframe.document.DocumentSnapshot;
import org.dxworks.markframe.model.Element;
import org.dxworks.markframe.resolve.ConflictResolver;
import org.dxworks.markframe.scanner.block.BlockScanPipeline;
import org.dxworks.markframe.scanner.block.BlockScanResult;
import org.dxworks.markframe.scanner.inline.InlineScanner;
import org.dxworks.markframe.scanner.inline.LineElementCache;

import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.util.ArrayList;
import java.util.List;

/**
 * Live preview analysis of one open document.
 * <p>
 * Owns the parse of the most recent snapshot and the line cache. A text change re-runs the block scan
 * and the (line-cached) inline scan; a selection-only change reuses the resolved elements and only
 * rebuilds decorations. Not thread-safe: one engine per document, driven from the editor thread.
 */
public class LivePreviewEngine {

    private final MarkframeConfig config;
    private final BlockScanPipeline blockScanPipeline = new BlockScanPipeline();
    private final LineElementCache lineCache;
    private final InlineScanner inlineScanner;
    private final ConflictResolver conflictResolver = new ConflictResolver();
    private final DecorationBuilder decorationBuilder = new DecorationBuilder();

    private ParsedSnapshot current;

    public LivePreviewEngine() {
        this(MarkframeConfig.defaults());
    }

    public LivePreviewEngine(MarkframeConfig config) {
        this.config = config;
        this.lineCache = new LineElementCache(config.getLineCacheSize());
        this.inlineScanner = new InlineScanner(lineCache);
    }

    public DecorationSet update(DocumentSnapshot snapshot, RevealOracle oracle) {
        return update(snapshot, oracle, null);
    }

    /**
     * Decorations for {@code snapshot} as seen through {@code oracle}. Never throws for document content:
     * a failing pass is reported on standard error and yields an empty set.
     *
     * @param viewport visible lines, or null when unknown
     */
    public DecorationSet update(DocumentSnapshot snapshot, RevealOracle oracle, Viewport viewport) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot must not be null");
        }
        if (oracle == null) {
            throw new IllegalArgumentException("oracle must not be null");
        }
        try {
            ParsedSnapshot parsed = parse(snapshot, viewport);
            return decorationBuilder.build(snapshot, parsed.elements(), oracle);
        } catch (RuntimeException e) {
            System.err.println("[LivePreviewEngine] Error: analysis pass failed: " + e);
            return DecorationSet.empty();
        }
    }

    /**
     * Resolved elements of {@code snapshot}, parsing it unless it is the current one.
     */
    public List<Element> elements(DocumentSnapshot snapshot) {
        return parse(snapshot, null).elements();
    }

    ParsedSnapshot parse(DocumentSnapshot snapshot, Viewport viewport) {
        Viewport window = inlineWindow(snapshot, viewport);
        ParsedSnapshot previous = current;
        if (previous != null && previous.isFor(snapshot, window)) {
            return previous;
        }

        BlockScanResult blocks = previous != null && previous.snapshot().isSameState(snapshot)
                ? previous.blocks()
                : blockScanPipeline.scan(snapshot);
        List<Element> inline = window == null
                ? inlineScanner.scan(snapshot, blocks)
                : inlineScanner.scan(snapshot, blocks, window.firstLine(), window.lastLine());

        List<Element> candidates = new ArrayList<>(blocks.elements().size() + inline.size());
        candidates.addAll(blocks.elements());
        candidates.addAll(inline);

        ParsedSnapshot parsed = new ParsedSnapshot(snapshot, window, blocks, conflictResolver.resolve(candidates));
        current = parsed;
        return parsed;
    }

    private Viewport inlineWindow(DocumentSnapshot snapshot, Viewport viewport) {
        if (!config.isViewportLimited() || viewport == null
                || snapshot.lineCount() <= config.getLargeDocumentThreshold()) {
            return null;
        }
        return viewport.widen(config.getViewportBuffer(), snapshot.lineCount());
    }

    /**
     * Resolved elements of the last pass whose span contains {@code offset} (both ends inclusive).
     */
    public List<Element> elementsAt(int offset) {
        List<Element> found = new ArrayList<>();
        for (Element element : lastElements()) {
            if (element.covers(offset)) {
                found.add(element);
            }
        }
        return found;
    }

    public List<Element> lastElements() {
        ParsedSnapshot parsed = current;
        return parsed == null ? List.of() : parsed.elements();
    }

    public LineCacheStats cacheStats() {
        CacheStats stats = lineCache.stats();
        return new LineCacheStats(lineCache.size(), lineCache.maxSize(), stats.hitCount(), stats.missCount());
    }

    public void clearCache() {
        lineCache.clear();
        current = null;
    }

    public MarkframeConfig getConfig() {
        return config;
    }
}
