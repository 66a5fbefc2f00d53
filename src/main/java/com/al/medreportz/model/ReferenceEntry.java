package com.al.medreportz.model;

import com.al.medreportz.util.NumberFormatUtil;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * Canonical lab test with its closed reference interval [low, high].
 */
@Value
public class ReferenceEntry {
    String key;
    String displayName;
    List<String> aliases;
    double low;
    double high;
    String unit;

    /**
     * Interval rendered as "low–high" (en-dash), numbers without trailing zeros.
     */
    @JsonProperty("range")
    public String formatRange() {
        return NumberFormatUtil.natural(low) + "–" + NumberFormatUtil.natural(high);
    }
}
