package org.dxworks.markframe.scanner.inline;

import org.dxworks.markframe.model.Element;
import org.dxworks.markframe.model.ElementKind;
import org.dxworks.markframe.model.ElementPayload.Embed;
import org.dxworks.markframe.model.ElementPayload.FormattedText;
import org.dxworks.markframe.model.ElementPayload.Image;
import org.dxworks.markframe.model.ElementPayload.InlineCode;
import org.dxworks.markframe.model.ElementPayload.InlineMath;
import org.dxworks.markframe.model.ElementPayload.InlineWidget;
import org.dxworks.markframe.model.ElementPayload.Link;
import org.dxworks.markframe.model.ElementPayload.LinkStyle;
import org.dxworks.markframe.model.ElementPayload.Tag;
import org.dxworks.markframe.model.ElementPayload.TextStyle;
import org.dxworks.markframe.model.ElementPayload.WidgetStyle;
import org.dxworks.markframe.model.ReferenceTable;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * The inline matchers, applied in {@link #ordered()} order.
 */
public final class InlineRules {

    private static final Pattern INLINE_MATH = Pattern.compile("(?<![\\\\$])\\$(?![\\s$])([^$]+?)(?<![\\s\\\\])\\$(?![$\\d])");
    private static final Pattern BOLD_ITALIC = Pattern.compile("(?<!\\*)\\*\\*\\*(?![\\s*])(.+?)(?<![\\s*])\\*\\*\\*(?!\\*)");
    private static final Pattern BOLD_ASTERISK = Pattern.compile("(?<!\\*)\\*\\*(?![\\s*])((?:[^*]|\\*(?!\\*))+?)(?<!\\s)\\*\\*(?!\\*)");
    private static final Pattern BOLD_UNDERSCORE = Pattern.compile("(?<![\\w_])__(?![\\s_])(.+?)(?<![\\s_])__(?![\\w_])");
    private static final Pattern ITALIC_ASTERISK = Pattern.compile("(?<!\\*)\\*(?![\\s*])([^*]+?)(?<![\\s*])\\*(?!\\*)");
    private static final Pattern ITALIC_UNDERSCORE = Pattern.compile("(?<![\\w_])_(?![\\s_])([^_]+?)(?<![\\s_])_(?![\\w_])");
    private static final Pattern STRIKETHROUGH = Pattern.compile("(?<!~)~~(?![\\s~])(.+?)(?<![\\s~])~~(?!~)");
    private static final Pattern HIGHLIGHT = Pattern.compile("(?<!=)==(?![\\s=])(.+?)(?<![\\s=])==(?!=)");
    private static final Pattern DOUBLE_BACKTICK_CODE = Pattern.compile("(?<!`)``(?!`)(.+?)(?<!`)``(?!`)");
    private static final Pattern CODE = Pattern.compile("(?<!`)`([^`]+)`(?!`)");
    private static final Pattern EMBED = Pattern.compile("!\\[\\[([^\\[\\]]+?)\\]\\]");
    private static final Pattern WIKI_LINK = Pattern.compile("(?<!!)\\[\\[([^\\[\\]|#]+)(?:#([^\\[\\]|]+))?(?:\\|([^\\[\\]]+))?\\]\\]");
    private static final Pattern IMAGE = Pattern.compile("!\\[([^\\[\\]]*)\\]\\(\\s*<?([^)\\s>]+)>?(?:\\s+\"([^\"]*)\")?\\s*\\)");
    private static final Pattern LINK = Pattern.compile("(?<![!\\[])\\[((?:[^\\[\\]]|\\[[^\\[\\]]*\\])+)\\]\\(\\s*<?([^)\\s>]+)>?(?:\\s+\"([^\"]*)\")?\\s*\\)");
    private static final Pattern REFERENCE_IMAGE = Pattern.compile("!\\[([^\\[\\]]*)\\](?:\\[([^\\[\\]]*)\\])?(?![(\\[])");
    private static final Pattern REFERENCE_LINK = Pattern.compile("(?<![!\\[\\]])\\[(?!\\^)([^\\[\\]]+)\\](?:\\[([^\\[\\]]*)\\])?");
    private static final Pattern SUPERSCRIPT = Pattern.compile("(?<![\\[^])\\^(?![\\s^])([^^\\s\\[\\]]+)\\^");
    private static final Pattern SUBSCRIPT = Pattern.compile("(?<!~)~(?![\\s~])([^~\\s]+)~(?!~)");
    private static final Pattern KBD = Pattern.compile("<kbd>(.+?)</kbd>", Pattern.CASE_INSENSITIVE);
    private static final Pattern FOOTNOTE_REFERENCE = Pattern.compile("\\[\\^([^\\]\\s]+)\\](?!:)");
    private static final Pattern HASHTAG = Pattern.compile("(?<![\\p{L}\\p{N}_#&/\\\\])#([\\p{L}\\p{N}_/-]+)");
    private static final Pattern AUTOLINK = Pattern.compile("<([A-Za-z][A-Za-z0-9+.-]{1,31}://[^<>\\s]+)>");
    private static final Pattern BARE_URL = Pattern.compile("(?<![<(\\[\\w/\"'=])(?:https?|ftp)://[^\\s<>\\[\\]()]+");
    private static final Pattern IMAGE_WIDTH = Pattern.compile("^(.*)\\|(\\d{1,5})$");

    /** Spans inside which shortcut references and bare urls are not recognized. */
    static final List<Pattern> LINK_SYNTAX = List.of(LINK, IMAGE, AUTOLINK);

    private static final String TRAILING_URL_PUNCTUATION = ".,;:!?'\"";

    private static final List<InlineRule> ORDERED = List.of(
            InlineRules::inlineMath,
            InlineRules::boldItalic,
            InlineRules::bold,
            InlineRules::italic,
            InlineRules::strikethrough,
            InlineRules::highlight,
            InlineRules::doubleBacktickCode,
            InlineRules::code,
            InlineRules::embed,
            InlineRules::wikiLink,
            InlineRules::image,
            InlineRules::link,
            InlineRules::referenceImage,
            InlineRules::referenceLink,
            InlineRules::superscript,
            InlineRules::subscript,
            InlineRules::kbd,
            InlineRules::footnoteReference,
            InlineRules::hashtag,
            InlineRules::autolink,
            InlineRules::bareUrl);

    private InlineRules() {
    }

    public static List<InlineRule> ordered() {
        return ORDERED;
    }

    static void inlineMath(InlineContext ctx, List<Element> out) {
        for (MatchResult m : ctx.matches(INLINE_MATH)) {
            if (ctx.hasEscapedDelimiter(m)) continue;
            String latex = m.group(1);
            out.add(ctx.element(ElementKind.INLINE_MATH, m.start(), m.end(), latex,
                    new InlineMath(latex, ctx.abs(m.start(1)), ctx.abs(m.end(1)))));
        }
    }

    static void boldItalic(InlineContext ctx, List<Element> out) {
        emphasis(ctx, out, BOLD_ITALIC, ElementKind.INLINE_BOLD, TextStyle.BOLD_ITALIC);
    }

    static void bold(InlineContext ctx, List<Element> out) {
        emphasis(ctx, out, BOLD_ASTERISK, ElementKind.INLINE_BOLD, TextStyle.BOLD);
        emphasis(ctx, out, BOLD_UNDERSCORE, ElementKind.INLINE_BOLD, TextStyle.BOLD);
    }

    static void italic(InlineContext ctx, List<Element> out) {
        emphasis(ctx, out, ITALIC_ASTERISK, ElementKind.INLINE_ITALIC, TextStyle.ITALIC);
        emphasis(ctx, out, ITALIC_UNDERSCORE, ElementKind.INLINE_ITALIC, TextStyle.ITALIC);
    }

    static void strikethrough(InlineContext ctx, List<Element> out) {
        emphasis(ctx, out, STRIKETHROUGH, ElementKind.INLINE_OTHER, TextStyle.STRIKETHROUGH);
    }

    static void highlight(InlineContext ctx, List<Element> out) {
        emphasis(ctx, out, HIGHLIGHT, ElementKind.INLINE_OTHER, TextStyle.HIGHLIGHT);
    }

    private static void emphasis(InlineContext ctx, List<Element> out, Pattern pattern,
                                 ElementKind kind, TextStyle style) {
        for (MatchResult m : ctx.matches(pattern)) {
            if (ctx.hasEscapedDelimiter(m)) continue;
            out.add(ctx.element(kind, m.start(), m.end(), m.group(1),
                    new FormattedText(style, ctx.abs(m.start(1)), ctx.abs(m.end(1)))));
        }
    }

    static void doubleBacktickCode(InlineContext ctx, List<Element> out) {
        for (MatchResult m : ctx.matches(DOUBLE_BACKTICK_CODE)) {
            if (ctx.isEscaped(m.start())) continue;
            String code = stripPadding(m.group(1));
            out.add(ctx.element(ElementKind.INLINE_CODE, m.start(), m.end(), code,
                    new InlineCode(code, ctx.abs(m.start(1)), ctx.abs(m.end(1)))));
        }
    }

    static void code(InlineContext ctx, List<Element> out) {
        for (MatchResult m : ctx.matches(CODE)) {
            if (ctx.isEscaped(m.start())) continue;
            String code = m.group(1);
            out.add(ctx.element(ElementKind.INLINE_CODE, m.start(), m.end(), code,
                    new InlineCode(code, ctx.abs(m.start(1)), ctx.abs(m.end(1)))));
        }
    }

    // `` `a` `` shows as `a`: one space of padding on each side is syntax
    private static String stripPadding(String code) {
        if (code.length() > 2 && code.startsWith(" ") && code.endsWith(" ") && !code.isBlank()) {
            return code.substring(1, code.length() - 1);
        }
        return code;
    }

    static void embed(InlineContext ctx, List<Element> out) {
        for (MatchResult m : ctx.matches(EMBED)) {
            if (ctx.isEscaped(m.start())) continue;
            String target = m.group(1).trim();
            out.add(ctx.element(ElementKind.INLINE_EMBED, m.start(), m.end(), target,
                    new Embed(target, ctx.abs(m.start(1)), ctx.abs(m.end(1)))));
        }
    }

    static void wikiLink(InlineContext ctx, List<Element> out) {
        for (MatchResult m : ctx.matches(WIKI_LINK)) {
            if (ctx.isEscaped(m.start())) continue;
            String target = m.group(1).trim();
            String heading = m.group(2);
            String alias = m.group(3);
            String url = heading == null ? target : target + "#" + heading.trim();
            String text = alias != null ? alias.trim() : target;
            int textGroup = alias != null ? 3 : 1;
            out.add(ctx.element(ElementKind.INLINE_LINK, m.start(), m.end(), text,
                    new Link(LinkStyle.WIKI, text, url, null,
                            ctx.abs(m.start(textGroup)), ctx.abs(m.end(textGroup)))));
        }
    }

    static void image(InlineContext ctx, List<Element> out) {
        for (MatchResult m : ctx.matches(IMAGE)) {
            if (ctx.isEscaped(m.start())) continue;
            String alt = m.group(1);
            Integer width = null;
            Matcher sized = IMAGE_WIDTH.matcher(alt);
            if (sized.matches()) {
                alt = sized.group(1);
                width = Integer.valueOf(sized.group(2));
            }
            out.add(ctx.element(ElementKind.INLINE_IMAGE, m.start(), m.end(), alt,
                    new Image(alt, m.group(2), m.group(3), width, false,
                            ctx.abs(m.start(1)), ctx.abs(m.end(1)))));
        }
    }

    static void link(InlineContext ctx, List<Element> out) {
        for (MatchResult m : ctx.matches(LINK)) {
            if (ctx.isEscaped(m.start())) continue;
            String text = m.group(1);
            out.add(ctx.element(ElementKind.INLINE_LINK, m.start(), m.end(), text,
                    new Link(LinkStyle.MARKDOWN, text, m.group(2), m.group(3),
                            ctx.abs(m.start(1)), ctx.abs(m.end(1)))));
        }
    }

    static void referenceImage(InlineContext ctx, List<Element> out) {
        for (MatchResult m : ctx.matches(REFERENCE_IMAGE)) {
            if (ctx.isEscaped(m.start())) continue;
            String alt = m.group(1);
            Optional<ReferenceTable.Target> target = ctx.references().resolve(label(m));
            if (target.isEmpty()) continue;
            out.add(ctx.element(ElementKind.INLINE_IMAGE, m.start(), m.end(), alt,
                    new Image(alt, target.get().url(), target.get().title(), null, true,
                            ctx.abs(m.start(1)), ctx.abs(m.end(1)))));
        }
    }

    static void referenceLink(InlineContext ctx, List<Element> out) {
        for (MatchResult m : ctx.matches(REFERENCE_LINK)) {
            if (ctx.isEscaped(m.start())) continue;
            if (m.group(2) == null && !isShortcutCandidate(ctx, m)) continue;
            Optional<ReferenceTable.Target> target = ctx.references().resolve(label(m));
            if (target.isEmpty()) continue;
            String text = m.group(1);
            out.add(ctx.element(ElementKind.INLINE_LINK, m.start(), m.end(), text,
                    new Link(LinkStyle.REFERENCE, text, target.get().url(), target.get().title(),
                            ctx.abs(m.start(1)), ctx.abs(m.end(1)))));
        }
    }

    // full form [text][label], collapsed [text][], shortcut [label]
    private static String label(MatchResult m) {
        String label = m.group(2);
        return label == null || label.isBlank() ? m.group(1) : label;
    }

    private static boolean isShortcutCandidate(InlineContext ctx, MatchResult m) {
        char next = ctx.charAt(m.end());
        if (next == '(' || next == '[' || next == ':') {
            return false;
        }
        return !ctx.isInsideLinkSyntax(m.start(), m.end());
    }

    static void superscript(InlineContext ctx, List<Element> out) {
        widget(ctx, out, SUPERSCRIPT, WidgetStyle.SUPERSCRIPT);
    }

    static void subscript(InlineContext ctx, List<Element> out) {
        widget(ctx, out, SUBSCRIPT, WidgetStyle.SUBSCRIPT);
    }

    static void kbd(InlineContext ctx, List<Element> out) {
        widget(ctx, out, KBD, WidgetStyle.KBD);
    }

    static void footnoteReference(InlineContext ctx, List<Element> out) {
        widget(ctx, out, FOOTNOTE_REFERENCE, WidgetStyle.FOOTNOTE_REFERENCE);
    }

    private static void widget(InlineContext ctx, List<Element> out, Pattern pattern, WidgetStyle style) {
        for (MatchResult m : ctx.matches(pattern)) {
            if (ctx.hasEscapedDelimiter(m)) continue;
            String text = m.group(1);
            out.add(ctx.element(ElementKind.INLINE_OTHER, m.start(), m.end(), text,
                    new InlineWidget(style, text, ctx.abs(m.start(1)), ctx.abs(m.end(1)))));
        }
    }

    static void hashtag(InlineContext ctx, List<Element> out) {
        for (MatchResult m : ctx.matches(HASHTAG)) {
            String name = m.group(1);
            if (name.chars().allMatch(Character::isDigit)) continue;
            out.add(ctx.element(ElementKind.INLINE_TAG, m.start(), m.end(), name,
                    new Tag(name, ctx.abs(m.start(1)), ctx.abs(m.end(1)))));
        }
    }

    static void autolink(InlineContext ctx, List<Element> out) {
        for (MatchResult m : ctx.matches(AUTOLINK)) {
            if (ctx.isEscaped(m.start())) continue;
            String url = m.group(1);
            out.add(ctx.element(ElementKind.INLINE_LINK, m.start(), m.end(), url,
                    new Link(LinkStyle.AUTOLINK, url, url, null, ctx.abs(m.start(1)), ctx.abs(m.end(1)))));
        }
    }

    static void bareUrl(InlineContext ctx, List<Element> out) {
        for (MatchResult m : ctx.matches(BARE_URL)) {
            int end = m.end();
            while (end > m.start() && TRAILING_URL_PUNCTUATION.indexOf(ctx.charAt(end - 1)) >= 0) {
                end--;
            }
            if (ctx.isInsideLinkSyntax(m.start(), end)) continue;
            String url = ctx.text().substring(m.start(), end);
            out.add(ctx.element(ElementKind.INLINE_LINK, m.start(), end, url,
                    new Link(LinkStyle.BARE_URL, url, url, null, ctx.abs(m.start()), ctx.abs(end))));
        }
    }
}
