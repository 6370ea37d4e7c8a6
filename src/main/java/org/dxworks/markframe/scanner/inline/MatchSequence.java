package org.dxworks.markframe.scanner.inline;

import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Restartable match sequences. Every iteration runs a fresh matcher, so no position state
 * is shared between callers or between passes.
 */
public final class MatchSequence {

    private MatchSequence() {
    }

    public static Iterable<MatchResult> of(Pattern pattern, CharSequence text) {
        return () -> pattern.matcher(text).results().iterator();
    }
}
