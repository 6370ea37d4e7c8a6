package org.dxworks.markframe.scanner.inline;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.dxworks.markframe.document.DocumentLine;
import org.dxworks.markframe.model.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Size-bounded cache of per-line scan results, keyed by line number, line text and reference signature.
 * <p>
 * An entry remembers the line offset it was computed at. A hit at that offset returns the cached list itself;
 * a hit after the line moved returns the elements shifted to the new offset and stores them in place.
 */
public class LineElementCache {

    private record Entry(int lineFrom, List<Element> elements) {
    }

    private final Cache<String, Entry> cache;
    private final int maxSize;

    public LineElementCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .executor(Runnable::run)
                .recordStats()
                .build();
    }

    public static String key(DocumentLine line, String referenceSignature) {
        return line.number + ":" + line.text + ":" + referenceSignature;
    }

    public List<Element> get(DocumentLine line, String referenceSignature, Function<DocumentLine, List<Element>> scanner) {
        String key = key(line, referenceSignature);
        Entry cached = cache.getIfPresent(key);
        if (cached != null) {
            if (cached.lineFrom() == line.from) {
                return cached.elements();
            }
            List<Element> shifted = shift(cached.elements(), line.from - cached.lineFrom());
            cache.put(key, new Entry(line.from, shifted));
            return shifted;
        }
        List<Element> elements = List.copyOf(scanner.apply(line));
        cache.put(key, new Entry(line.from, elements));
        return elements;
    }

    private static List<Element> shift(List<Element> elements, int delta) {
        List<Element> shifted = new ArrayList<>(elements.size());
        for (Element element : elements) {
            shifted.add(element.shift(delta));
        }
        return List.copyOf(shifted);
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public int maxSize() {
        return maxSize;
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }
}
