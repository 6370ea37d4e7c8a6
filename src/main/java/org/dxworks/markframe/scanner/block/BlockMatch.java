package org.dxworks.markframe.scanner.block;

import org.dxworks.markframe.model.ElementPayload.Alignment;
import org.dxworks.markframe.model.ElementPayload.FoldState;
import org.dxworks.markframe.model.ElementPayload.MathDelimiter;

import java.util.List;

/**
 * Raw result of one block scanner. Offsets span from the start of the first line to the end
 * of the last line, clamped to the document length.
 */
public sealed interface BlockMatch {

    int from();

    int to();

    int startLine();

    int endLine();

    record CodeBlockMatch(int from, int to, int startLine, int endLine,
                          String language, String code, char fenceChar) implements BlockMatch {
    }

    record MathBlockMatch(int from, int to, int startLine, int endLine,
                          String latex, MathDelimiter delimiter, String environment) implements BlockMatch {
    }

    record TableMatch(int from, int to, int startLine, int endLine,
                      List<List<String>> rows, List<Alignment> alignments, boolean hasHeader) implements BlockMatch {
    }

    record CalloutMatch(int from, int to, int startLine, int endLine,
                        String calloutType, String title, List<String> bodyLines, FoldState foldState)
            implements BlockMatch {
    }

    record DetailsMatch(int from, int to, int startLine, int endLine,
                        String summary, List<String> contentLines, boolean open) implements BlockMatch {
    }

    record FootnoteDefinitionMatch(int from, int to, int startLine, int endLine,
                                   String id, String content) implements BlockMatch {
    }

    record ReferenceDefinitionMatch(int from, int to, int startLine, int endLine,
                                    String label, String url, String title) implements BlockMatch {
    }
}
