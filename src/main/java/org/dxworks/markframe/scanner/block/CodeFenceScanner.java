package org.dxworks.markframe.scanner.block;

import org.dxworks.markframe.document.DocumentLine;
import org.dxworks.markframe.scanner.block.BlockMatch.CodeBlockMatch;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fenced code blocks opened by three or more backticks or tildes.
 * The closing fence uses the same character, at least as many times, and nothing else.
 */
public final class CodeFenceScanner implements BlockScanner<CodeBlockMatch> {

    private static final Pattern OPENING_FENCE = Pattern.compile("^(`{3,}|~{3,})\\s*([^`\\s]*)[^`]*$");

    private enum State { OUTSIDE, IN_FENCE }

    @Override
    public List<CodeBlockMatch> scan(BlockScanContext context) {
        List<CodeBlockMatch> matches = new ArrayList<>();

        State state = State.OUTSIDE;
        char fenceChar = 0;
        int fenceLength = 0;
        int openIndex = -1;
        String language = "";
        List<String> body = new ArrayList<>();

        for (int i = 0; i < context.lineCount(); i++) {
            DocumentLine line = context.line(i);
            if (context.isExcluded(line)) {
                continue;
            }
            String trimmed = LinePrefixStripper.strip(line.text).trimmed();

            if (state == State.OUTSIDE) {
                Matcher opening = OPENING_FENCE.matcher(trimmed);
                if (opening.matches()) {
                    state = State.IN_FENCE;
                    fenceChar = opening.group(1).charAt(0);
                    fenceLength = opening.group(1).length();
                    language = opening.group(2);
                    openIndex = i;
                    body.clear();
                }
                continue;
            }

            if (isClosingFence(trimmed, fenceChar, fenceLength)) {
                DocumentLine open = context.line(openIndex);
                matches.add(new CodeBlockMatch(
                        open.from,
                        context.clamp(line.to),
                        open.number,
                        line.number,
                        language,
                        String.join("\n", body),
                        fenceChar));
                state = State.OUTSIDE;
            } else {
                body.add(LinePrefixStripper.stripQuotes(line.text).content());
            }
        }

        if (state == State.IN_FENCE) {
            System.err.println("[CodeFenceScanner] Warning: unterminated code fence opened at line "
                    + context.line(openIndex).number);
        }
        return matches;
    }

    private static boolean isClosingFence(String trimmed, char fenceChar, int fenceLength) {
        if (trimmed.length() < fenceLength) return false;
        for (int i = 0; i < trimmed.length(); i++) {
            if (trimmed.charAt(i) != fenceChar) return false;
        }
        return true;
    }
}
