package com.moneylens.common;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lowercasing, accent stripping and tokenization of free-text transaction descriptions.
 */
public final class TextNormalizer {

    /** Two or more word characters, Unicode aware. */
    private static final Pattern WORD = Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    /**
     * Lowercase (root locale) and strip combining marks, e.g. "Årsavgift" -> "arsavgift".
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text.toLowerCase(Locale.ROOT), Normalizer.Form.NFD);
        return DIACRITICS.matcher(decomposed).replaceAll("");
    }

    /**
     * Word tokens of the normalized text, in order of appearance (duplicates kept).
     */
    public static List<String> wordTokens(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher m = WORD.matcher(normalize(text));
        while (m.find()) {
            tokens.add(m.group());
        }
        return tokens;
    }

    /**
     * Distinct whitespace-separated lowercase tokens. Punctuation is kept, as in the raw bank text.
     */
    public static Set<String> whitespaceTokens(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        for (String part : WHITESPACE.split(text.strip().toLowerCase(Locale.ROOT))) {
            if (!part.isEmpty()) {
                tokens.add(part);
            }
        }
        return tokens;
    }
}
