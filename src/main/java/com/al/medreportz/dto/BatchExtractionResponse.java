package com.al.medreportz.dto;

import com.al.medreportz.model.PatientRecord;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a batch extraction. Results and errors are ordered by document index.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchExtractionResponse {

    private int totalDocuments;

    private int successCount;

    private int failureCount;

    private List<DocumentResult> results = new ArrayList<>();

    private List<DocumentError> errors = new ArrayList<>();

    private long processingTimeMs;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DocumentResult {
        private int index;

        private PatientRecord record;

        private long processingTimeMs;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DocumentError {
        private int index;

        private String fileName;

        private String error;
    }
}
