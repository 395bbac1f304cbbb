package com.tasktracker.logging;

/**
 * Makes client-supplied strings safe to place in a log line.
 * <p>
 * Control characters (CR, LF, tab and the rest of the C0/C1 ranges) are replaced with
 * {@value #REPLACEMENT} so a value cannot start a forged log entry, and the result is cut
 * to {@value #MAX_LENGTH} characters. The value is wrapped in quotes so its boundaries stay
 * visible. Null renders as {@code null}.
 */
public final class LogSanitizer {

    /** Replacement for each control character. */
    public static final char REPLACEMENT = '_';

    /** Longest value written before truncation. */
    public static final int MAX_LENGTH = 100;

    private LogSanitizer() {
        // utility class
    }

    /**
     * @param value untrusted input, may be null
     * @return the quoted, single-line form of the value
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "null";
        }
        int length = Math.min(value.length(), MAX_LENGTH);
        StringBuilder result = new StringBuilder(length + 5).append('"');
        for (int i = 0; i < length; i++) {
            char c = value.charAt(i);
            result.append(Character.isISOControl(c) ? REPLACEMENT : c);
        }
        if (value.length() > MAX_LENGTH) {
            result.append("...");
        }
        return result.append('"').toString();
    }
}
