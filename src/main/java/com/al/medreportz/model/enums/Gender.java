package com.al.medreportz.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum Gender {
    MALE("Male"),
    FEMALE("Female");

    private final String label;

    Gender(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Case-insensitive lookup by label; anything outside the closed set is empty.
     */
    public static Optional<Gender> fromLabel(String text) {
        if (text == null) {
            return Optional.empty();
        }
        for (Gender gender : values()) {
            if (gender.label.equalsIgnoreCase(text.trim())) {
                return Optional.of(gender);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
