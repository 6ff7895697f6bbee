package com.purchasingpower.compliancekb.util;

import java.util.regex.Pattern;

/**
 * Turns the HTML fragments iTop stores in descriptions and case logs into plain text with
 * paragraph breaks the chunker can split on.
 */
public final class HtmlTextNormalizer {

    private static final Pattern LINE_BREAK = Pattern.compile("(?i)<br\\s*/?>");
    private static final Pattern PARAGRAPH_END = Pattern.compile("(?i)</p>");
    private static final Pattern LIST_ITEM_END = Pattern.compile("(?i)</li>");
    private static final Pattern HEADING_END = Pattern.compile("(?i)</h[1-6]>");
    private static final Pattern ANY_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");

    private HtmlTextNormalizer() {
    }

    public static String toPlainText(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        String text = LINE_BREAK.matcher(html).replaceAll("\n");
        text = PARAGRAPH_END.matcher(text).replaceAll("\n\n");
        text = LIST_ITEM_END.matcher(text).replaceAll("\n");
        text = HEADING_END.matcher(text).replaceAll("\n\n");
        text = ANY_TAG.matcher(text).replaceAll("");
        text = text.replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                // last, so "&amp;lt;" stays "&lt;"
                .replace("&amp;", "&");
        text = EXCESS_NEWLINES.matcher(text).replaceAll("\n\n");
        return text.trim();
    }
}
