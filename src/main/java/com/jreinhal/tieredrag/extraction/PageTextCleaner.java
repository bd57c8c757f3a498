package com.jreinhal.tieredrag.extraction;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Normalises text pulled from a PDF text layer before it is scored and chunked: font glyph
 * placeholders, control and invisible characters, converter markup and words split across
 * lines or by stray spaces.
 *
 * <p>Line structure is kept so headings still mark sections. Pages that clean down to fewer
 * than {@value #MIN_PAGE_CHARS} characters become empty but keep their position, so page
 * numbers stay aligned with the source.</p>
 */
public final class PageTextCleaner {
    static final int MIN_PAGE_CHARS = 3;

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n?");
    private static final Pattern GLYPH = Pattern.compile("GLYPH(?:<[^>]*>|&lt;.*?&gt;|\\([^)]*\\))|\\(cid:\\d+\\)");
    private static final Pattern CONTROL = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern INVISIBLE = Pattern.compile("[\\uFEFF\\uFFFD\\u200B-\\u200F\\u202A-\\u202E\\u2060-\\u2064]");
    private static final Pattern HTML_COMMENT = Pattern.compile("<!--.*?-->", Pattern.DOTALL);
    private static final Pattern HYPHENATED_BREAK = Pattern.compile("(\\p{L})-[ \\t]*\\n[ \\t]*(\\p{Ll})");
    // Thai consonant, then a space, then a vowel or tone mark that must attach to it.
    private static final Pattern THAI_DETACHED_MARK =
            Pattern.compile("([\\u0E01-\\u0E2E])[ \\t]+([\\u0E31\\u0E34-\\u0E3A\\u0E47-\\u0E4E])");
    private static final Pattern THAI_DETACHED_LEADING_VOWEL = Pattern.compile("([\\u0E40-\\u0E44])[ \\t]+([\\u0E01-\\u0E2E])");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\u00A0]+");
    private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile(" ([.,;:!?])");
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");

    private PageTextCleaner() {
    }

    public static List<String> cleanPages(List<String> pages) {
        List<String> cleaned = new ArrayList<>(pages.size());
        for (String page : pages) {
            String text = clean(page);
            cleaned.add(text.length() < MIN_PAGE_CHARS ? "" : text);
        }
        return cleaned;
    }

    public static String clean(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String result = Normalizer.normalize(text, Normalizer.Form.NFC);
        result = LINE_BREAK.matcher(result).replaceAll("\n");
        result = GLYPH.matcher(result).replaceAll("");
        result = CONTROL.matcher(result).replaceAll("");
        result = INVISIBLE.matcher(result).replaceAll("");
        result = HTML_COMMENT.matcher(result).replaceAll("");
        result = HYPHENATED_BREAK.matcher(result).replaceAll("$1$2");
        result = THAI_DETACHED_MARK.matcher(result).replaceAll("$1$2");
        result = THAI_DETACHED_LEADING_VOWEL.matcher(result).replaceAll("$1$2");
        result = HORIZONTAL_SPACE.matcher(result).replaceAll(" ");
        result = SPACE_BEFORE_PUNCTUATION.matcher(result).replaceAll("$1");
        result = dropEmptyTableRows(result);
        result = EXCESS_BLANK_LINES.matcher(result).replaceAll("\n\n");
        return result.strip();
    }

    private static String dropEmptyTableRows(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (String line : text.split("\n", -1)) {
            String stripped = line.strip();
            if (!stripped.isEmpty() && stripped.length() < 5 && stripped.indexOf('|') >= 0
                    && stripped.chars().allMatch(c -> c == '|' || c == ' ')) {
                continue;
            }
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(stripped);
        }
        return out.toString();
    }
}
