package com.al.medreportz.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Structured result of one extraction run. Labs keep the order in which they were found.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({ "file_name", "language", "patient", "vital_signs", "labs", "raw_text" })
public class PatientRecord {
    String fileName;
    String language;
    PatientInfo patient;
    VitalSigns vitalSigns;
    @Singular
    List<ResolvedLabResult> labs;
    String rawText;
}
