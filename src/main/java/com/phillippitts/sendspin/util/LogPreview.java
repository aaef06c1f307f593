package com.phillippitts.sendspin.util;

/** Bounded previews of wire payloads for log lines. */
public final class LogPreview {

    private LogPreview() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max) + "...(" + s.length() + " chars)";
    }
}
