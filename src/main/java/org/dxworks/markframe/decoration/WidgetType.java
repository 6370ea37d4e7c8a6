package org.dxworks.markframe.decoration;

/**
 * What the render host draws in place of a replaced span or at a widget anchor.
 * {@link #HIDDEN} draws nothing.
 */
public enum WidgetType {
    HIDDEN,
    CODE_BLOCK,
    MATH_BLOCK,
    TABLE,
    CALLOUT,
    DETAILS,
    FOOTNOTE_DEFINITION,
    INLINE_CODE,
    INLINE_MATH,
    LINK,
    IMAGE,
    EMBED,
    SUPERSCRIPT,
    SUBSCRIPT,
    KBD,
    FOOTNOTE_REFERENCE,
    LIST_MARKER,
    HORIZONTAL_RULE
}
