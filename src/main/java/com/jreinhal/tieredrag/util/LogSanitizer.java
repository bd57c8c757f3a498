package com.jreinhal.tieredrag.util;

import java.util.regex.Pattern;

public final class LogSanitizer {
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final int MAX_VALUE_LENGTH = 256;

    private LogSanitizer() {
    }

    /**
     * Identifies a query in logs without writing its text.
     */
    public static String querySummary(String query) {
        if (query == null) {
            return "[len=0,id=none]";
        }
        return "[len=" + query.length() + ",id=" + Integer.toHexString(query.hashCode()) + "]";
    }

    /**
     * Strips control characters and line breaks so a value cannot forge log lines.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
        if (cleaned.length() > MAX_VALUE_LENGTH) {
            return cleaned.substring(0, MAX_VALUE_LENGTH) + "...";
        }
        return cleaned;
    }
}
