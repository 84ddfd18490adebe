package com.phillippitts.batchanalyzer.util;

/** Utility for bounded, single-line log previews of provider messages and descriptions. */
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
     * Collapses line breaks to spaces and truncates, so a multi-line provider message stays on
     * one log line.
     */
    public static String preview(String s, int max) {
        if (s == null) {
            return "";
        }
        return truncate(s.replaceAll("[\\r\\n]+", " ").strip(), max);
    }
}
