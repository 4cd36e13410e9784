package com.dcruver.tanaimport.convert;

import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts Tana's inline HTML-like markup to Markdown.
 * Inline references are resolved first so that references wrapped in markup still resolve.
 */
@RequiredArgsConstructor
public class MarkupTranslator {

    static final Pattern INLINE_REF = Pattern.compile("<span data-inlineref-node=\"([^\"]+)\"></span>");
    private static final Pattern BOLD = Pattern.compile("<b>(.*?)</b>");
    private static final Pattern ITALIC = Pattern.compile("<i>(.*?)</i>");
    private static final Pattern STRIKE = Pattern.compile("<strike>(.*?)</strike>");
    private static final Pattern CODE = Pattern.compile("<code>(.*?)</code>");

    private final LinkResolver linkResolver;

    public String translate(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String result = INLINE_REF.matcher(text)
            .replaceAll(match -> Matcher.quoteReplacement(linkResolver.linkTo(match.group(1))));
        result = wrap(BOLD, result, "**");
        result = wrap(ITALIC, result, "*");
        result = wrap(STRIKE, result, "~~");
        return wrap(CODE, result, "`");
    }

    /**
     * Ids referenced by inline reference spans, in order of appearance.
     */
    public static List<String> inlineReferences(String text) {
        List<String> ids = new ArrayList<>();
        if (text == null) {
            return ids;
        }
        Matcher matcher = INLINE_REF.matcher(text);
        while (matcher.find()) {
            ids.add(matcher.group(1));
        }
        return ids;
    }

    private static String wrap(Pattern pattern, String text, String marker) {
        return pattern.matcher(text)
            .replaceAll(match -> Matcher.quoteReplacement(marker + match.group(1) + marker));
    }
}
