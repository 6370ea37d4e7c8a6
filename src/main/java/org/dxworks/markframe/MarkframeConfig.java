package org.dxworks.markframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class MarkframeConfig {

    private static final String CONFIG_FILE_NAME = "markframe-config.yml";
    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final int DEFAULT_LINE_CACHE_SIZE = 2000;
    private static final boolean DEFAULT_VIEWPORT_LIMITED = false;
    private static final int DEFAULT_VIEWPORT_BUFFER = 100;
    private static final int DEFAULT_LARGE_DOCUMENT_THRESHOLD = 5000;

    private final int maxFileLines;
    private final int lineCacheSize;
    private final boolean viewportLimited;
    private final int viewportBuffer;
    private final int largeDocumentThreshold;

    private MarkframeConfig(int maxFileLines, int lineCacheSize, boolean viewportLimited,
                            int viewportBuffer, int largeDocumentThreshold) {
        this.maxFileLines = maxFileLines;
        this.lineCacheSize = lineCacheSize;
        this.viewportLimited = viewportLimited;
        this.viewportBuffer = viewportBuffer;
        this.largeDocumentThreshold = largeDocumentThreshold;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public int getLineCacheSize() {
        return lineCacheSize;
    }

    public boolean isViewportLimited() {
        return viewportLimited;
    }

    public int getViewportBuffer() {
        return viewportBuffer;
    }

    public int getLargeDocumentThreshold() {
        return largeDocumentThreshold;
    }

    public static MarkframeConfig defaults() {
        return new MarkframeConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_LINE_CACHE_SIZE, DEFAULT_VIEWPORT_LIMITED,
                DEFAULT_VIEWPORT_BUFFER, DEFAULT_LARGE_DOCUMENT_THRESHOLD);
    }

    public static MarkframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static MarkframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return new MarkframeConfig(
                        positiveOr(yamlConfig.maxFileLines, DEFAULT_MAX_FILE_LINES),
                        positiveOr(yamlConfig.lineCacheSize, DEFAULT_LINE_CACHE_SIZE),
                        yamlConfig.viewportLimited != null ? yamlConfig.viewportLimited : DEFAULT_VIEWPORT_LIMITED,
                        nonNegativeOr(yamlConfig.viewportBuffer, DEFAULT_VIEWPORT_BUFFER),
                        positiveOr(yamlConfig.largeDocumentThreshold, DEFAULT_LARGE_DOCUMENT_THRESHOLD));
            }
        } catch (IOException e) {
            System.err.println("[MarkframeConfig] Warning: could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static MarkframeConfig with(int maxFileLines, int lineCacheSize, boolean viewportLimited,
                                       int viewportBuffer, int largeDocumentThreshold) {
        return new MarkframeConfig(
                positiveOr(maxFileLines, DEFAULT_MAX_FILE_LINES),
                positiveOr(lineCacheSize, DEFAULT_LINE_CACHE_SIZE),
                viewportLimited,
                nonNegativeOr(viewportBuffer, DEFAULT_VIEWPORT_BUFFER),
                positiveOr(largeDocumentThreshold, DEFAULT_LARGE_DOCUMENT_THRESHOLD));
    }

    private static int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private static int nonNegativeOr(Integer value, int fallback) {
        return value != null && value >= 0 ? value : fallback;
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Integer lineCacheSize;
        public Boolean viewportLimited;
        public Integer viewportBuffer;
        public Integer largeDocumentThreshold;
    }
}
