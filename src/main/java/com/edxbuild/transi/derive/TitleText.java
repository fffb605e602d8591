package com.edxbuild.transi.derive;

import java.util.regex.Pattern;

/**
 * Narration fallbacks computed from a step title.
 */
public final class TitleText {

    static final String EN_DASH_SEPARATOR = " \u2013 ";
    static final String HYPHEN_SEPARATOR = " - ";

    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.?!\\s]+$");

    private TitleText() {
    }

    /**
     * Text before the first spaced en dash or spaced hyphen, whichever occurs earlier, trimmed.
     * The whole trimmed title when neither separator is present.
     */
    public static String firstHalf(String title) {
        if (title == null) {
            return "";
        }
        int enDash = title.indexOf(EN_DASH_SEPARATOR);
        int hyphen = title.indexOf(HYPHEN_SEPARATOR);
        int cut;
        if (enDash < 0) {
            cut = hyphen;
        } else if (hyphen < 0) {
            cut = enDash;
        } else {
            cut = Math.min(enDash, hyphen);
        }
        return (cut < 0 ? title : title.substring(0, cut)).trim();
    }

    /**
     * The title phrased as a question: trailing punctuation dropped, {@code ?} appended.
     */
    public static String questionize(String title) {
        String text = title == null ? "" : title.trim();
        if (text.isEmpty()) {
            return "";
        }
        return TRAILING_PUNCTUATION.matcher(text).replaceAll("") + "?";
    }
}
