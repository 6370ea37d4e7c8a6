package org.dxworks.markframe.model;

import org.dxworks.markframe.decoration.RenderInstruction;

import java.util.ArrayList;
import java.util.List;

/**
 * One line of the CLI output: the resolved elements and the reading-mode decorations of a markdown file.
 */
public class MarkdownFileReport {
    public String kind = "file";
    public String filePath;
    public int lineCount;
    public int referenceCount;
    public List<Element> elements = new ArrayList<>();
    public List<RenderInstruction> decorations = new ArrayList<>();
}
