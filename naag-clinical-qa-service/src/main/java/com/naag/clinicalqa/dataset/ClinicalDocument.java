package com.naag.clinicalqa.dataset;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A validated question/answer record.
 *
 * @param id          dense index assigned in input order over accepted records
 * @param prompt      trimmed question text
 * @param completion  trimmed answer text
 * @param cancerTypes values of the comma-separated {@code cancer_type} field, as written
 * @param genes       values of the comma-separated {@code genes} field, as written
 * @param metadata    other scalar fields ({@code source}, {@code trial_id}, ...) kept for display
 */
public record ClinicalDocument(
        int id,
        String prompt,
        String completion,
        Set<String> cancerTypes,
        Set<String> genes,
        Map<String, String> metadata
) {
    public ClinicalDocument {
        // insertion order is kept, the graph builder relies on it
        cancerTypes = Collections.unmodifiableSet(new LinkedHashSet<>(cancerTypes));
        genes = Collections.unmodifiableSet(new LinkedHashSet<>(genes));
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
