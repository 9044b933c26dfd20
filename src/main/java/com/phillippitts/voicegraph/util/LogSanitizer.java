package com.phillippitts.voicegraph.util;

/** Utility for privacy-safe logging of transcript and synthesis text previews. */
public final class LogSanitizer {

    /** Default preview length used by nodes when logging user text. */
    public static final int DEFAULT_PREVIEW = 40;

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
     * Truncates to {@link #DEFAULT_PREVIEW} characters.
     */
    public static String preview(String s) {
        return truncate(s, DEFAULT_PREVIEW);
    }
}
