package org.dxworks.markframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.markframe.decoration.DecorationSet;
import org.dxworks.markframe.decoration.RevealOracle;
import org.dxworks.markframe.document.DocumentSnapshot;
import org.dxworks.markframe.engine.LivePreviewEngine;
import org.dxworks.markframe.model.Element;
import org.dxworks.markframe.model.ElementKind;
import org.dxworks.markframe.model.MarkdownFileReport;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar markframe.jar <input-folder> <output-file>");
            System.err.println("  <input-folder>: Path to a markdown file or a directory of markdown files");
            System.err.println("  <output-file>:  Path to output JSONL file");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting markdown analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        MarkframeConfig config = MarkframeConfig.load();
        List<Path> files = collectMarkdownFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " markdown files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Analyzing " + file.getFileName());
                }

                try {
                    MarkdownFileReport report = analyzeFile(file, config);
                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(report));
                        writer.newLine();
                        writer.flush();
                    }
                    successCount.incrementAndGet();
                } catch (Exception e) {
                    Map<String, String> error = new HashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("error", e.getMessage());

                    try {
                        synchronized (writer) {
                            writer.write(MAPPER.writeValueAsString(error));
                            writer.newLine();
                            writer.flush();
                        }
                    } catch (IOException ioException) {
                        System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                    }

                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error analyzing " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_analyzed", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Successfully analyzed: " + successCount.get() + " files");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    static List<Path> collectMarkdownFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(MarkdownFileDetector::isMarkdown)
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (MarkdownFileDetector.isMarkdown(input) && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | UncheckedIOException e) {
            System.err.println("[App] Warning: could not count lines of " + path + ": " + e.getMessage());
            return true;
        }
    }

    /**
     * Reading-mode analysis of one file, with its own engine.
     */
    public static MarkdownFileReport analyzeFile(Path filePath, MarkframeConfig config) throws IOException {
        String text = Files.readString(filePath, StandardCharsets.UTF_8);
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }

        DocumentSnapshot snapshot = DocumentSnapshot.of(text);
        LivePreviewEngine engine = new LivePreviewEngine(config);
        DecorationSet decorations = engine.update(snapshot, RevealOracle.never());

        MarkdownFileReport report = new MarkdownFileReport();
        report.filePath = filePath.toString();
        report.lineCount = snapshot.lineCount();
        report.elements = new ArrayList<>(engine.lastElements());
        report.referenceCount = (int) countElements(report.elements, ElementKind.LINK_REFERENCE_DEFINITION);
        report.decorations = new ArrayList<>(decorations.instructions());
        return report;
    }

    public static MarkdownFileReport analyzeFile(Path filePath) throws IOException {
        return analyzeFile(filePath, MarkframeConfig.load());
    }

    static long countElements(List<Element> elements, ElementKind kind) {
        return elements.stream().filter(e -> e.kind == kind).count();
    }
}
