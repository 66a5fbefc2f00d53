package com.al.medreportz.model;

import com.al.medreportz.model.enums.VitalSignKind;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Vital-sign readings keyed by kind. Values keep the unit as printed, e.g. "120/80 mmHg".
 * Kinds that were not found are absent.
 */
public final class VitalSigns {

    private static final VitalSigns EMPTY = new VitalSigns(new EnumMap<>(VitalSignKind.class));

    private final Map<VitalSignKind, String> readings;

    private VitalSigns(EnumMap<VitalSignKind, String> readings) {
        this.readings = Collections.unmodifiableMap(readings);
    }

    public static VitalSigns of(Map<VitalSignKind, String> readings) {
        if (readings == null || readings.isEmpty()) {
            return EMPTY;
        }
        return new VitalSigns(new EnumMap<>(readings));
    }

    public static VitalSigns empty() {
        return EMPTY;
    }

    public Optional<String> get(VitalSignKind kind) {
        return Optional.ofNullable(readings.get(kind));
    }

    public Map<VitalSignKind, String> asMap() {
        return readings;
    }

    public boolean isEmpty() {
        return readings.isEmpty();
    }

    @JsonValue
    public Map<String, String> toJson() {
        Map<String, String> json = new LinkedHashMap<>();
        readings.forEach((kind, value) -> json.put(kind.getKey(), value));
        return json;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VitalSigns)) {
            return false;
        }
        return readings.equals(((VitalSigns) o).readings);
    }

    @Override
    public int hashCode() {
        return readings.hashCode();
    }

    @Override
    public String toString() {
        return "VitalSigns" + toJson();
    }
}
