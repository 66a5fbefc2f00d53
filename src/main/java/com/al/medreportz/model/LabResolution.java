package com.al.medreportz.model;

import lombok.Value;

/**
 * Outcome of mapping a mention label to a canonical test key.
 */
@Value
public class LabResolution {
    /** Canonical test key, or null when no alias matched. */
    String canonicalKey;
    double confidence;

    public boolean isResolved() {
        return canonicalKey != null;
    }
}
