package com.jreinhal.tieredrag.util;

import java.util.regex.Pattern;

/**
 * Recognises section headings in extracted text, line by line.
 *
 * <p>Accepted forms: markdown headers ({@code ## Scope}), numbered headings ({@code 2.1 Scope}),
 * keyword headings ({@code Chapter 3}, {@code Section 4}, {@code Article 12}) and short
 * all-caps lines ({@code TERMS AND CONDITIONS}).</p>
 */
public final class HeadingDetector {
    private static final Pattern MARKDOWN = Pattern.compile("^#{1,6}\\s+\\S.*");
    private static final Pattern NUMBERED = Pattern.compile("^\\d+(\\.\\d+)*\\.?\\s+\\p{Lu}.{0,80}$");
    private static final Pattern KEYWORD = Pattern.compile("^(chapter|section|article|part|appendix)\\s+[\\dIVXLC]+\\b.{0,80}$",
            Pattern.CASE_INSENSITIVE);
    private static final int MAX_CAPS_HEADING_LENGTH = 60;

    private HeadingDetector() {
    }

    public static boolean isHeading(String line) {
        if (line == null) {
            return false;
        }
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
            return false;
        }
        if (MARKDOWN.matcher(trimmed).matches() || NUMBERED.matcher(trimmed).matches()
                || KEYWORD.matcher(trimmed).matches()) {
            return true;
        }
        return isAllCaps(trimmed);
    }

    /**
     * Heading text without markdown markers, or null if {@code line} is not a heading.
     */
    public static String title(String line) {
        if (!isHeading(line)) {
            return null;
        }
        return line.strip().replaceFirst("^#{1,6}\\s+", "");
    }

    /**
     * Title of the last heading in {@code text}, or null if it has none.
     */
    public static String lastHeading(String text) {
        if (text == null) {
            return null;
        }
        String last = null;
        for (String line : text.split("\n")) {
            String title = title(line);
            if (title != null) {
                last = title;
            }
        }
        return last;
    }

    private static boolean isAllCaps(String line) {
        if (line.length() > MAX_CAPS_HEADING_LENGTH) {
            return false;
        }
        int letters = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (Character.isLetter(c)) {
                if (!Character.isUpperCase(c)) {
                    return false;
                }
                letters++;
            }
        }
        return letters >= 3;
    }
}
