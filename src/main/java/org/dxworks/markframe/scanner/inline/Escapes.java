package org.dxworks.markframe.scanner.inline;

/**
 * Backslash escape checks.
 */
public final class Escapes {

    private Escapes() {
    }

    /**
     * Whether the character at {@code index} is escaped, i.e. preceded by an odd number of backslashes.
     */
    public static boolean isEscaped(CharSequence text, int index) {
        int backslashes = 0;
        for (int i = index - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }
}
