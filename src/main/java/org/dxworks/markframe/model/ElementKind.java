package org.dxworks.markframe.model;

import java.util.Comparator;

/**
 * Every construct the engine recognizes, declared in priority order.
 * A kind declared earlier outranks the ones after it when two elements partially overlap.
 */
public enum ElementKind {
    CODE_BLOCK("code-block", Category.OPAQUE_BLOCK),
    MATH_BLOCK("math-block", Category.OPAQUE_BLOCK),
    TABLE("table", Category.CONTAINER_BLOCK),
    CALLOUT("callout", Category.CONTAINER_BLOCK),
    DETAILS("details", Category.CONTAINER_BLOCK),
    HEADING("heading", Category.LINE),
    BLOCKQUOTE("blockquote", Category.LINE),
    LIST_ITEM("list-item", Category.LINE),
    HORIZONTAL_RULE("horizontal-rule", Category.LINE),
    INLINE_CODE("inline-code", Category.INLINE_LEAF),
    INLINE_MATH("inline-math", Category.INLINE_LEAF),
    INLINE_LINK("link", Category.INLINE_REPLACE),
    INLINE_IMAGE("image", Category.INLINE_REPLACE),
    INLINE_EMBED("embed", Category.INLINE_REPLACE),
    INLINE_BOLD("bold", Category.INLINE_EMPHASIS),
    INLINE_ITALIC("italic", Category.INLINE_EMPHASIS),
    INLINE_OTHER("inline-other", Category.INLINE_EMPHASIS),
    INLINE_TAG("tag", Category.INLINE_MARK),
    LINK_REFERENCE_DEFINITION("link-reference-definition", Category.DEFINITION_BLOCK),
    FOOTNOTE_DEFINITION("footnote-definition", Category.DEFINITION_BLOCK);

    /** Highest priority first. */
    public static final Comparator<ElementKind> PRIORITY = Comparator.comparingInt(ElementKind::rank);

    private enum Category {
        OPAQUE_BLOCK,
        CONTAINER_BLOCK,
        LINE,
        INLINE_LEAF,
        INLINE_REPLACE,
        INLINE_EMPHASIS,
        INLINE_MARK,
        DEFINITION_BLOCK
    }

    private final String id;
    private final Category category;

    ElementKind(String id, Category category) {
        this.id = id;
        this.category = category;
    }

    public String getId() {
        return id;
    }

    public int rank() {
        return ordinal() + 1;
    }

    public boolean outranks(ElementKind other) {
        return rank() < other.rank();
    }

    /** Kinds produced by the block scanners. */
    public boolean isBlock() {
        return category == Category.OPAQUE_BLOCK
                || category == Category.CONTAINER_BLOCK
                || category == Category.DEFINITION_BLOCK;
    }

    /** Block kinds rendered as a single widget that hides the raw lines behind it. */
    public boolean isMultiLineBlock() {
        return this == CODE_BLOCK || this == MATH_BLOCK || this == TABLE
                || this == CALLOUT || this == DETAILS || this == FOOTNOTE_DEFINITION;
    }

    public boolean isInline() {
        return category == Category.INLINE_LEAF
                || category == Category.INLINE_REPLACE
                || category == Category.INLINE_EMPHASIS
                || category == Category.INLINE_MARK;
    }

    /** Inline kinds whose content is literal text: inline code and inline math. */
    public boolean isLeaf() {
        return category == Category.INLINE_LEAF;
    }

    /**
     * Inline kinds whose whole syntax span is swapped for a widget, so nothing nested inside
     * them can be decorated separately.
     */
    public boolean replacesWholeSpan() {
        return isLeaf() || category == Category.INLINE_REPLACE;
    }
}
