package org.dxworks.markframe.scanner.block;

import org.dxworks.markframe.document.DocumentLine;
import org.dxworks.markframe.model.ElementPayload.MathDelimiter;
import org.dxworks.markframe.scanner.block.BlockMatch.MathBlockMatch;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Display math in four bracket styles: {@code $$...$$} over several lines, {@code $$...$$} on one
 * line, {@code \[...\]} and named LaTeX environments {@code \begin{name}...\end{name}}.
 */
public final class MathBlockScanner implements BlockScanner<MathBlockMatch> {

    private static final String DOLLARS = "$$";
    private static final String OPEN_BRACKET = "\\[";
    private static final String CLOSE_BRACKET = "\\]";
    private static final Pattern BEGIN_ENVIRONMENT = Pattern.compile("^\\\\begin\\{([A-Za-z]+\\*?)\\}");

    private enum State { OUTSIDE, IN_DOLLARS, IN_BRACKETS, IN_ENVIRONMENT }

    @Override
    public List<MathBlockMatch> scan(BlockScanContext context) {
        List<MathBlockMatch> matches = new ArrayList<>();

        State state = State.OUTSIDE;
        DocumentLine open = null;
        String environment = null;
        List<String> body = new ArrayList<>();

        for (int i = 0; i < context.lineCount(); i++) {
            DocumentLine line = context.line(i);
            if (context.isExcluded(line)) {
                continue;
            }
            String trimmed = LinePrefixStripper.strip(line.text).trimmed();

            switch (state) {
                case OUTSIDE -> {
                    if (trimmed.startsWith(DOLLARS)) {
                        String rest = trimmed.substring(DOLLARS.length());
                        if (rest.length() >= DOLLARS.length() && rest.endsWith(DOLLARS)) {
                            String latex = rest.substring(0, rest.length() - DOLLARS.length());
                            emit(matches, context, line, line, latex, MathDelimiter.SINGLE_LINE_DOLLARS, null);
                        } else {
                            state = State.IN_DOLLARS;
                            open = line;
                            body.clear();
                            addIfPresent(body, rest);
                        }
                    } else if (trimmed.startsWith(OPEN_BRACKET)) {
                        String rest = trimmed.substring(OPEN_BRACKET.length());
                        if (rest.endsWith(CLOSE_BRACKET)) {
                            String latex = rest.substring(0, rest.length() - CLOSE_BRACKET.length());
                            emit(matches, context, line, line, latex, MathDelimiter.BRACKETS, null);
                        } else {
                            state = State.IN_BRACKETS;
                            open = line;
                            body.clear();
                            addIfPresent(body, rest);
                        }
                    } else {
                        Matcher begin = BEGIN_ENVIRONMENT.matcher(trimmed);
                        if (begin.find()) {
                            environment = begin.group(1);
                            String end = endTag(environment);
                            String rest = trimmed.substring(begin.end());
                            int endIndex = rest.indexOf(end);
                            if (endIndex >= 0) {
                                emit(matches, context, line, line, rest.substring(0, endIndex),
                                        MathDelimiter.ENVIRONMENT, environment);
                            } else {
                                state = State.IN_ENVIRONMENT;
                                open = line;
                                body.clear();
                                addIfPresent(body, rest);
                            }
                        }
                    }
                }
                case IN_DOLLARS -> {
                    if (trimmed.endsWith(DOLLARS)) {
                        addIfPresent(body, trimmed.substring(0, trimmed.length() - DOLLARS.length()));
                        emit(matches, context, open, line, String.join("\n", body), MathDelimiter.DOLLARS, null);
                        state = State.OUTSIDE;
                    } else {
                        body.add(bodyLine(line));
                    }
                }
                case IN_BRACKETS -> {
                    if (trimmed.endsWith(CLOSE_BRACKET)) {
                        addIfPresent(body, trimmed.substring(0, trimmed.length() - CLOSE_BRACKET.length()));
                        emit(matches, context, open, line, String.join("\n", body), MathDelimiter.BRACKETS, null);
                        state = State.OUTSIDE;
                    } else {
                        body.add(bodyLine(line));
                    }
                }
                case IN_ENVIRONMENT -> {
                    int endIndex = trimmed.indexOf(endTag(environment));
                    if (endIndex >= 0) {
                        addIfPresent(body, trimmed.substring(0, endIndex));
                        emit(matches, context, open, line, String.join("\n", body),
                                MathDelimiter.ENVIRONMENT, environment);
                        state = State.OUTSIDE;
                    } else {
                        body.add(bodyLine(line));
                    }
                }
            }
        }

        if (state != State.OUTSIDE) {
            System.err.println("[MathBlockScanner] Warning: unterminated math block opened at line " + open.number);
        }
        return matches;
    }

    private static void emit(List<MathBlockMatch> matches, BlockScanContext context,
                             DocumentLine first, DocumentLine last,
                             String body, MathDelimiter delimiter, String environment) {
        String trimmedBody = body.trim();
        if (trimmedBody.isEmpty() || "undefined".equals(trimmedBody)) {
            System.err.println("[MathBlockScanner] Warning: skipping empty math block at line " + first.number);
            return;
        }
        String latex = environment == null
                ? trimmedBody
                : "\\begin{" + environment + "}\n" + trimmedBody + "\n" + endTag(environment);
        matches.add(new MathBlockMatch(first.from, context.clamp(last.to), first.number, last.number,
                latex, delimiter, environment));
    }

    private static String endTag(String environment) {
        return "\\end{" + environment + "}";
    }

    private static String bodyLine(DocumentLine line) {
        return LinePrefixStripper.stripQuotes(line.text).content();
    }

    private static void addIfPresent(List<String> body, String fragment) {
        if (!fragment.isBlank()) {
            body.add(fragment.trim());
        }
    }
}
