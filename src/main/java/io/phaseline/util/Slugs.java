package io.phaseline.util;

import java.util.Locale;

public final class Slugs {
    public static final int MAX_LENGTH = 50;

    private Slugs() {
    }

    /**
     * Lowercases, collapses every run of non-alphanumerics into one dash, trims dashes and caps
     * the length.
     */
    public static String slugify(String text) {
        return slugify(text, MAX_LENGTH);
    }

    public static String slugify(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(lower.length());
        boolean dash = false;
        for (int i = 0; i < lower.length(); i++) {
            char ch = lower.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z') || (ch >= '0' && ch <= '9');
            if (ok) {
                sb.append(ch);
                dash = false;
            } else if (!dash) {
                sb.append('-');
                dash = true;
            }
        }
        String value = trimDashes(sb.toString());
        if (value.length() > maxLength) {
            value = trimDashes(value.substring(0, maxLength));
        }
        return value;
    }

    private static String trimDashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '-') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '-') {
            end--;
        }
        return value.substring(start, end);
    }
}
