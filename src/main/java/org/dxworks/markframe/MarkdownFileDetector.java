package org.dxworks.markframe;

import java.nio.file.Path;
import java.util.Locale;

public class MarkdownFileDetector {

    public static boolean isMarkdown(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".md") || name.endsWith(".markdown");
    }
}
