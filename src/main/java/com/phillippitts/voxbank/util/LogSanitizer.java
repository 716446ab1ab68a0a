package com.phillippitts.voxbank.util;

/** Utility for privacy-safe logging of announcement text. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    /**
     * Describes text by shape only, e.g. {@code "chars=42, words=7"}.
     */
    public static String describe(String text) {
        if (text == null || text.isBlank()) {
            return "chars=0, words=0";
        }
        return "chars=" + text.length() + ", words=" + text.trim().split("\\s+").length;
    }
}
