package com.al.medreportz.model;

import com.al.medreportz.model.enums.Highlight;
import com.al.medreportz.model.enums.LabStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({ "test_name", "value", "unit", "normal_range", "status", "highlight", "confidence" })
public class ResolvedLabResult {
    public static final String RANGE_NOT_AVAILABLE = "Not available";
    public static final String UNIT_UNKNOWN = "Unknown";

    /** Canonical test key, null when the label was not resolved. Not part of the JSON output. */
    @JsonIgnore
    String testKey;
    String testName;
    double value;
    String unit;
    String normalRange;
    LabStatus status;
    Highlight highlight;
    double confidence;
}
