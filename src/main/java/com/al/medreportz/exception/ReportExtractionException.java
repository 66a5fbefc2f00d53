package com.al.medreportz.exception;

import lombok.Getter;

/**
 * Thrown when a document could not be processed at all (worker failure or timeout),
 * as opposed to data-quality problems, which never fail an extraction.
 */
@Getter
public class ReportExtractionException extends RuntimeException {

    private final String fileName;

    public ReportExtractionException(String fileName, String message, Throwable cause) {
        super(message, cause);
        this.fileName = fileName;
    }
}
