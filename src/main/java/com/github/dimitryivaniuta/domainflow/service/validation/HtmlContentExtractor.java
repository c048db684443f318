package com.github.dimitryivaniuta.domainflow.service.validation;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns fetched HTML into the plain text that keyword rules are evaluated against.
 */
public final class HtmlContentExtractor {

    private static final Pattern TITLE = Pattern.compile("<title[^>]*>(.*?)</title\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern DROPPED_BLOCKS = Pattern.compile(
            "<(script|style|noscript|head)\\b[^>]*>.*?</\\1\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern COMMENTS = Pattern.compile("<!--.*?-->", Pattern.DOTALL);
    private static final Pattern TAGS = Pattern.compile("<[^>]+>");
    private static final Pattern NUMERIC_ENTITY = Pattern.compile("&#(x?)([0-9a-fA-F]{1,6});");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<String, String> NAMED_ENTITIES = Map.of(
            "&amp;", "&",
            "&lt;", "<",
            "&gt;", ">",
            "&quot;", "\"",
            "&apos;", "'",
            "&#39;", "'",
            "&nbsp;", " "
    );

    private HtmlContentExtractor() {
    }

    /**
     * Visible text of the page body.
     *
     * @param html raw HTML, may be null
     * @return text with markup removed and whitespace collapsed
     */
    public static String extractText(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        String text = COMMENTS.matcher(html).replaceAll(" ");
        text = DROPPED_BLOCKS.matcher(text).replaceAll(" ");
        text = TAGS.matcher(text).replaceAll(" ");
        text = decodeEntities(text);
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Contents of the first {@code <title>} element.
     *
     * @param html raw HTML, may be null
     * @return decoded title, or null when absent or blank
     */
    public static String extractTitle(String html) {
        if (html == null) {
            return null;
        }
        Matcher m = TITLE.matcher(html);
        if (!m.find()) {
            return null;
        }
        String title = WHITESPACE.matcher(decodeEntities(TAGS.matcher(m.group(1)).replaceAll(" "))).replaceAll(" ").trim();
        return title.isEmpty() ? null : title;
    }

    static String decodeEntities(String text) {
        if (text.indexOf('&') < 0) {
            return text;
        }
        String out = text;
        for (Map.Entry<String, String> e : NAMED_ENTITIES.entrySet()) {
            if (!"&amp;".equals(e.getKey())) {
                out = out.replace(e.getKey(), e.getValue());
            }
        }
        Matcher m = NUMERIC_ENTITY.matcher(out);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            int radix = m.group(1).isEmpty() ? 10 : 16;
            String replacement;
            try {
                int cp = Integer.parseInt(m.group(2), radix);
                replacement = Character.isValidCodePoint(cp) ? new String(Character.toChars(cp)) : m.group();
            } catch (NumberFormatException ex) {
                replacement = m.group();
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        // last, so "&amp;lt;" decodes to "&lt;" and not "<"
        return sb.toString().replace("&amp;", "&");
    }
}
