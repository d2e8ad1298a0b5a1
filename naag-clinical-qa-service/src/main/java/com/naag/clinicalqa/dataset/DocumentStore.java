package com.naag.clinicalqa.dataset;

import java.util.List;

/**
 * Immutable, id-addressable view over the accepted records of one dataset version.
 * Document {@code i} is stored at position {@code i}.
 */
public final class DocumentStore {

    private final List<ClinicalDocument> documents;
    private final int rejectedRecords;

    public DocumentStore(List<ClinicalDocument> documents, int rejectedRecords) {
        for (int i = 0; i < documents.size(); i++) {
            if (documents.get(i).id() != i) {
                throw new IllegalArgumentException(
                        "Document ids must be dense and ordered, found id " + documents.get(i).id() + " at " + i);
            }
        }
        this.documents = List.copyOf(documents);
        this.rejectedRecords = rejectedRecords;
    }

    public ClinicalDocument get(int id) {
        return documents.get(id);
    }

    public List<ClinicalDocument> documents() {
        return documents;
    }

    public int size() {
        return documents.size();
    }

    /**
     * Records dropped by validation while loading.
     */
    public int rejectedRecords() {
        return rejectedRecords;
    }
}
