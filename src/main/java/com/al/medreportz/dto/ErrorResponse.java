package com.al.medreportz.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Error body returned by every endpoint. {@code reportId} echoes the request's
 * correlation id so a failed call can be matched to its log lines.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ErrorResponse {
    private LocalDateTime timestamp;
    private int status;
    private String error;
    private String details;
    private String path;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String reportId;
}
