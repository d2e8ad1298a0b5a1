package com.naag.clinicalqa.search;

import com.naag.clinicalqa.dataset.ClinicalDocument;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Categorical metadata dimensions usable for filtering.
 */
public enum Facet {
    CANCER_TYPE("cancer_type", ClinicalDocument::cancerTypes),
    GENE("genes", ClinicalDocument::genes);

    private final String fieldName;
    private final Function<ClinicalDocument, Set<String>> accessor;

    Facet(String fieldName, Function<ClinicalDocument, Set<String>> accessor) {
        this.fieldName = fieldName;
        this.accessor = accessor;
    }

    public String getFieldName() {
        return fieldName;
    }

    public Set<String> valuesOf(ClinicalDocument document) {
        return accessor.apply(document);
    }

    /**
     * Accepts the dataset field name ("cancer_type", "genes") or the constant name, any case.
     */
    public static Optional<Facet> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(f -> f.fieldName.equals(normalized) || f.name().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst();
    }
}
