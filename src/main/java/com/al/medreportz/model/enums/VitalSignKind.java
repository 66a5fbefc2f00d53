package com.al.medreportz.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VitalSignKind {
    BLOOD_PRESSURE("blood_pressure", "Blood Pressure", "85354-9"),
    HEART_RATE("heart_rate", "Heart Rate", "8867-4"),
    RESPIRATORY_RATE("respiratory_rate", "Respiratory Rate", "9279-1"),
    TEMPERATURE("temperature", "Temperature", "8310-5"),
    OXYGEN_SATURATION("oxygen_saturation", "Oxygen Saturation", "59408-5");

    private final String key;
    private final String displayName;
    private final String loincCode;

    VitalSignKind(String key, String displayName, String loincCode) {
        this.key = key;
        this.displayName = displayName;
        this.loincCode = loincCode;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getLoincCode() {
        return loincCode;
    }
}
