package com.naag.clinicalqa.text;

import java.util.Set;

/**
 * Common English words that carry no topical signal. Used when picking graph keywords,
 * never when indexing.
 */
public final class Stopwords {

    private static final Set<String> STOPWORDS = Set.of(
            "the", "and", "for", "are", "but", "not", "you", "all",
            "can", "had", "her", "was", "one", "our", "out", "has",
            "have", "been", "were", "they", "this", "that", "with",
            "from", "will", "would", "there", "their", "what", "about",
            "which", "when", "make", "like", "time", "just", "know",
            "take", "into", "year", "your", "some", "could", "them",
            "than", "then", "now", "look", "only", "come", "its",
            "over", "also", "back", "after", "use", "two", "how",
            "first", "well", "way", "even", "new", "want", "because",
            "any", "these", "give", "most", "being", "does", "used",
            "between", "during", "where", "while", "whom", "whose",
            "should", "other", "such", "each", "more", "very"
    );

    private Stopwords() {
    }

    public static boolean isStopword(String token) {
        return STOPWORDS.contains(token);
    }
}
