package com.al.medreportz.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse display tag derived from a {@link LabStatus}.
 */
public enum Highlight {
    WARNING("warning"),
    NORMAL("normal"),
    UNKNOWN("unknown");

    private final String code;

    Highlight(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static Highlight fromStatus(LabStatus status) {
        if (status == null) {
            return UNKNOWN;
        }
        switch (status) {
            case LOW:
            case HIGH:
                return WARNING;
            case NORMAL:
                return NORMAL;
            default:
                return UNKNOWN;
        }
    }

    @Override
    public String toString() {
        return code;
    }
}
