package org.dxworks.markframe.scanner.inline;

import org.dxworks.markframe.model.Element;

import java.util.List;

/**
 * One inline matcher. Implementations add the elements they find on the context's line to {@code out}.
 */
@FunctionalInterface
public interface InlineRule {

    void collect(InlineContext context, List<Element> out);
}
