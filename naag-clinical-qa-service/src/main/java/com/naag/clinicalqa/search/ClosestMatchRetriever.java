package com.naag.clinicalqa.search;

import com.naag.clinicalqa.dataset.ClinicalDocument;
import com.naag.clinicalqa.dataset.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Single best match by edit distance between the query and each prompt.
 * Kept apart from {@link RankingEngine}: it answers "which stored question is this", not
 * "which records are relevant", and its scores are not comparable with overlap scores.
 *
 * similarity(a, b) = 1 - levenshtein(a, b) / max(|a|, |b|)
 */
public class ClosestMatchRetriever {

    private static final Logger log = LoggerFactory.getLogger(ClosestMatchRetriever.class);

    public static final double DEFAULT_CUTOFF = 0.4;

    private final double cutoff;

    public ClosestMatchRetriever() {
        this(DEFAULT_CUTOFF);
    }

    public ClosestMatchRetriever(double cutoff) {
        if (cutoff < 0.0 || cutoff > 1.0) {
            throw new IllegalArgumentException("cutoff must be within [0, 1], got " + cutoff);
        }
        this.cutoff = cutoff;
    }

    public record ClosestMatch(ClinicalDocument document, double similarity) {}

    /**
     * Best prompt at or above the cutoff; ties go to the lowest document id.
     */
    public Optional<ClosestMatch> findClosest(String query, DocumentStore store) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        String normalizedQuery = query.trim().toLowerCase(Locale.ROOT);

        ClosestMatch best = null;
        for (ClinicalDocument doc : store.documents()) {
            double similarity = similarity(normalizedQuery, doc.prompt().toLowerCase(Locale.ROOT));
            if (similarity >= cutoff && (best == null || similarity > best.similarity())) {
                best = new ClosestMatch(doc, similarity);
            }
        }

        if (best == null) {
            log.debug("No prompt within cutoff {} for '{}'", cutoff, query);
        }
        return Optional.ofNullable(best);
    }

    static double similarity(String a, String b) {
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(a, b) / longest;
    }

    /**
     * Two-row dynamic programming, O(|a| * |b|) time and O(|b|) space.
     */
    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int substitution = previous[j - 1] + (a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1);
                current[j] = Math.min(substitution, Math.min(previous[j] + 1, current[j - 1] + 1));
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
