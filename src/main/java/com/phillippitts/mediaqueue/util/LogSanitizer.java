package com.phillippitts.mediaqueue.util;

/** Utility for bounded previews of process output and error text in logs and job records. */
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
     * Collapses line breaks so multi-line stderr stays on one log line.
     */
    public static String singleLine(String s, int max) {
        return truncate(s, max).replace('\r', ' ').replace('\n', ' ');
    }
}
