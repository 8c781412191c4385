package com.keyco.assist.util;

/** Utility for privacy-safe logging of user text. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Describes user text by length only, e.g. {@code "len=42"}. Used wherever a log line needs to
     * mention input without revealing it.
     */
    public static String describe(String s) {
        return "len=" + (s == null ? 0 : s.length());
    }
}
