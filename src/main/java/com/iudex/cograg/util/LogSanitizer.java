package com.iudex.cograg.util;

import java.util.regex.Pattern;

public final class LogSanitizer {
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final int MAX_LOGGED_LENGTH = 200;

    private LogSanitizer() {
    }

    /**
     * Stand-in for a user query in log lines: length and hash, never the text itself.
     */
    public static String querySummary(String query) {
        if (query == null) {
            return "[len=0,id=none]";
        }
        return "[len=" + query.length() + ",id=" + Integer.toHexString(query.hashCode()) + "]";
    }

    /**
     * Strips control characters and folds line breaks so a value cannot forge log lines.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
        return cleaned.length() > MAX_LOGGED_LENGTH ? cleaned.substring(0, MAX_LOGGED_LENGTH) + "..." : cleaned;
    }
}
