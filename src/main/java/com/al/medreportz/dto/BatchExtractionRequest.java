package com.al.medreportz.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request for extracting several already-decoded reports in one call.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchExtractionRequest {

    @NotEmpty(message = "documents must not be empty")
    @Size(max = 100, message = "at most 100 documents per batch")
    @Valid
    private List<DocumentRequest> documents = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DocumentRequest {
        @NotBlank(message = "fileName is required")
        private String fileName;

        /** Optional language tag from an upstream detector */
        private String language;

        @NotNull(message = "text is required")
        private String text;
    }
}
