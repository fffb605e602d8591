package com.edxbuild.transi.suggest;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reduces a title to comparable words: step codes, punctuation and case are removed.
 * {@code "P3: Check the  Panel [M7]"} becomes {@code "check the panel"}.
 */
public class TitleNormalizer {

    private static final Pattern LEADING_CODE = Pattern.compile("^\\s*[A-Za-z]\\d+[a-z]?\\s*[:\\-\\u2013\\u2014]\\s*");
    private static final Pattern BRACKETED_CODE = Pattern.compile("\\[[A-Za-z]\\d+[a-z]?\\]");
    private static final Pattern CODE_TOKEN = Pattern.compile("\\b[A-Za-z]\\d+[a-z]?\\b", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    public String normalize(String text) {
        if (text == null) {
            return "";
        }
        String s = LEADING_CODE.matcher(text).replaceFirst("");
        s = BRACKETED_CODE.matcher(s).replaceAll(" ");
        s = CODE_TOKEN.matcher(s).replaceAll(" ");
        s = s.replace('_', ' ').replace('-', ' ');
        s = PUNCTUATION.matcher(s).replaceAll(" ");
        return WHITESPACE.matcher(s).replaceAll(" ").trim().toLowerCase(Locale.ROOT);
    }
}
