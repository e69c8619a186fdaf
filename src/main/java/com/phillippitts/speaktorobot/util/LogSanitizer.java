package com.phillippitts.speaktorobot.util;

/** Utility for privacy-safe logging of user utterances and model output. */
public final class LogSanitizer {

    public static final int DEFAULT_PREVIEW_CHARS = 80;

    private LogSanitizer() {}

    /**
     * Single-line preview for log messages: line breaks collapsed to spaces (no log forging),
     * truncated to {@code max} characters with a trailing ellipsis when cut.
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.replaceAll("[\\r\\n\\t]+", " ").strip();
        return flat.length() <= max ? flat : flat.substring(0, max) + "...";
    }

    public static String preview(String s) {
        return preview(s, DEFAULT_PREVIEW_CHARS);
    }
}
