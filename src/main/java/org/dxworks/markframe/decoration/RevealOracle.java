package org.dxworks.markframe.decoration;

import org.dxworks.markframe.model.ElementKind;

/**
 * Decides whether an element's raw syntax is shown instead of its rendered form.
 */
@FunctionalInterface
public interface RevealOracle {

    boolean shouldReveal(int from, int to, ElementKind kind);

    /** Reading mode: everything stays rendered. */
    static RevealOracle never() {
        return (from, to, kind) -> false;
    }
}
