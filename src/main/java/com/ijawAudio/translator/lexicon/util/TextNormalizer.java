package com.ijawAudio.translator.lexicon.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Utility class for the text normalization shared by the lexicon, the tagger and the translator.
 * All lookups go through {@link #normalize(String)} so keys compare case-insensitively.
 */
public class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern EDGE_WHITESPACE = Pattern.compile(
            "^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern EDGE_PUNCTUATION = Pattern.compile(
            "^[\\p{Punct}\\p{IsPunctuation}]+|[\\p{Punct}\\p{IsPunctuation}]+$");

    private static final Pattern NON_WORD = Pattern.compile(
            "[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);

    private TextNormalizer() {}

    /**
     * Removes leading and trailing Unicode whitespace, including no-break and ideographic spaces.
     * Null becomes the empty string.
     */
    public static String strip(String text) {
        if (text == null) {
            return "";
        }
        return EDGE_WHITESPACE.matcher(text).replaceAll("");
    }

    /**
     * Strips and lower-cases the text. Null becomes the empty string.
     *
     * @param text Raw text
     * @return Normalized lookup key
     */
    public static String normalize(String text) {
        return strip(text).toLowerCase(Locale.ROOT);
    }

    /**
     * Splits text on runs of whitespace, dropping empty tokens.
     * Casing is preserved.
     *
     * @param text Text to split (may be null)
     * @return Tokens in input order, empty for blank input
     */
    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        for (String token : WHITESPACE.split(text)) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Removes leading and trailing punctuation from a token ("river?" becomes "river").
     */
    public static String stripEdgePunctuation(String token) {
        return EDGE_PUNCTUATION.matcher(token).replaceAll("");
    }

    /**
     * Removes every non-word, non-space character, mirroring the dictionary's own key cleaning.
     */
    public static String stripPunctuation(String token) {
        return NON_WORD.matcher(token).replaceAll("");
    }
}
