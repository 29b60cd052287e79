package com.example.highlight_planner.util;

public final class TitleText {

    private static final String ELLIPSIS = "...";

    private TitleText() {
    }

    /**
     * Cuts {@code text} to at most {@code maxLength} characters, ending with "..." when shortened.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= ELLIPSIS.length()) {
            return text.substring(0, cutPoint(text, maxLength));
        }
        return text.substring(0, cutPoint(text, maxLength - ELLIPSIS.length())).stripTrailing() + ELLIPSIS;
    }

    // never split a surrogate pair
    private static int cutPoint(String text, int cut) {
        return cut > 0 && Character.isHighSurrogate(text.charAt(cut - 1)) ? cut - 1 : cut;
    }
}
