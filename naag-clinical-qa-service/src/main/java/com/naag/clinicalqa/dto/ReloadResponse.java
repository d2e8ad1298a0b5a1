package com.naag.clinicalqa.dto;

public record ReloadResponse(
        boolean success,
        int documentCount,
        int rejectedRecords,
        int vocabularySize,
        String fingerprint,
        boolean rebuilt,
        String errorMessage
) {
    public static ReloadResponse success(int documentCount, int rejectedRecords, int vocabularySize,
                                         String fingerprint, boolean rebuilt) {
        return new ReloadResponse(true, documentCount, rejectedRecords, vocabularySize, fingerprint, rebuilt, null);
    }

    public static ReloadResponse error(String errorMessage) {
        return new ReloadResponse(false, 0, 0, 0, null, false, errorMessage);
    }
}
