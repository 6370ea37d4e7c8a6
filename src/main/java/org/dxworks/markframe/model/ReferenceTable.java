package org.dxworks.markframe.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Link reference definitions of one document, keyed by normalized label.
 * The first definition of a label wins.
 */
public final class ReferenceTable {

    public static final ReferenceTable EMPTY = new ReferenceTable(Map.of());

    public record Target(String url, String title) {
    }

    private final Map<String, Target> targets;
    private final String signature;

    private ReferenceTable(Map<String, Target> targets) {
        this.targets = Collections.unmodifiableMap(targets);
        this.signature = computeSignature(targets);
    }

    public static String normalizeLabel(String label) {
        if (label == null) return "";
        return label.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    public Optional<Target> resolve(String label) {
        String key = normalizeLabel(label);
        if (key.isEmpty()) return Optional.empty();
        return Optional.ofNullable(targets.get(key));
    }

    public int size() {
        return targets.size();
    }

    public boolean isEmpty() {
        return targets.isEmpty();
    }

    public Map<String, Target> asMap() {
        return targets;
    }

    /**
     * Stable summary of the table; changes exactly when a label, url or title changes.
     */
    public String signature() {
        return signature;
    }

    private static String computeSignature(Map<String, Target> targets) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Target> entry : new TreeMap<>(targets).entrySet()) {
            if (sb.length() > 0) sb.append('\u0001');
            Target target = entry.getValue();
            sb.append(entry.getKey()).append(':')
              .append(target.url()).append(':')
              .append(target.title() == null ? "" : target.title());
        }
        return sb.toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, Target> targets = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * @return false if the label was already defined (the earlier definition is kept)
         */
        public boolean define(String label, String url, String title) {
            String key = normalizeLabel(label);
            if (key.isEmpty() || targets.containsKey(key)) {
                return false;
            }
            targets.put(key, new Target(url, title));
            return true;
        }

        public ReferenceTable build() {
            return targets.isEmpty() ? EMPTY : new ReferenceTable(new LinkedHashMap<>(targets));
        }
    }
}
