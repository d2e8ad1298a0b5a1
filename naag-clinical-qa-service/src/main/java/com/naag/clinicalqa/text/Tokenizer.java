package com.naag.clinicalqa.text;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns free text into the token sets used by the index, the ranking engine and the graph.
 * - Lowercase
 * - Remove punctuation
 * - Split on whitespace
 * - Drop tokens shorter than the minimum length
 *
 * The same instance must be used for indexing and querying so both sides agree on the
 * minimum length.
 */
public final class Tokenizer {

    public static final int DEFAULT_MIN_TOKEN_LENGTH = 3;

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int minTokenLength;

    public Tokenizer() {
        this(DEFAULT_MIN_TOKEN_LENGTH);
    }

    public Tokenizer(int minTokenLength) {
        if (minTokenLength < 1) {
            throw new IllegalArgumentException("minTokenLength must be at least 1, got " + minTokenLength);
        }
        this.minTokenLength = minTokenLength;
    }

    public int getMinTokenLength() {
        return minTokenLength;
    }

    /**
     * Tokens in first-appearance order. Blank input yields an empty set.
     */
    public Set<String> normalize(String text) {
        return normalize(text, minTokenLength);
    }

    /**
     * Same rules as {@link #normalize(String)} with a stricter length floor. Lengths below the
     * configured minimum are raised to it.
     */
    public Set<String> normalize(String text, int minLength) {
        if (text == null || text.isBlank()) {
            return Collections.emptySet();
        }
        int floor = Math.max(minLength, minTokenLength);
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : WHITESPACE.split(stripPunctuation(text.toLowerCase(Locale.ROOT)))) {
            if (token.length() >= floor) {
                tokens.add(token);
            }
        }
        return Collections.unmodifiableSet(tokens);
    }

    /**
     * Normalizes a whole metadata value ("PD-L1", "Breast Cancer") into a single keyword
     * without splitting it: "pdl1", "breast cancer". Returns an empty string for blank input.
     */
    public String normalizeTerm(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(stripPunctuation(value.toLowerCase(Locale.ROOT))).replaceAll(" ").trim();
    }

    private static String stripPunctuation(String text) {
        return PUNCTUATION.matcher(text).replaceAll("");
    }
}
