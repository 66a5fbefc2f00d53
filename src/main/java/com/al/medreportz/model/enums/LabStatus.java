package com.al.medreportz.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LabStatus {
    LOW("Low"),
    NORMAL("Normal"),
    HIGH("High"),
    UNKNOWN("Unknown");

    private final String label;

    LabStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
