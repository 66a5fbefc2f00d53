package com.al.medreportz.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for text normalization and field extraction.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "medreportz.extraction")
public class ExtractionConfiguration {

    /**
     * Language tag used when the caller does not supply one.
     */
    private String defaultLanguage = "unknown";

    /**
     * Lab test tokens recognized when scanning report lines.
     * Matched case-insensitively on letter boundaries.
     */
    private List<String> labTokens = new ArrayList<>(List.of(
            "hemoglobin", "haemoglobin", "hgb", "hb", "hba1c",
            "rbc", "pcv", "hematocrit", "hct",
            "mcv", "mch", "mchc", "rdw",
            "wbc", "tlc",
            "platelet", "platelets", "plt",
            "glucose", "blood sugar",
            "cholesterol"));

    /**
     * Unit spellings searched for on a lab line. Longer spellings are tried first
     * so that "mg/dL" wins over "g/dL".
     */
    private List<String> units = new ArrayList<>(List.of(
            "g/dL", "mg/dL", "fL", "pg", "%",
            "cumm", "mill/cumm", "cells/mcL", "cells/cumm",
            "x10^3/µL", "x10^6/µL", "x10^9/L", "mmol/L"));

    /**
     * OCR and formatting artifacts rewritten to a canonical unit spelling.
     * Patterns run on text that has already been reduced to the safe character set
     * and whitespace-collapsed, so they must not depend on '^' or non-ASCII characters.
     */
    private List<ArtifactRepair> artifactRepairs = new ArrayList<>(List.of(
            new ArtifactRepair("(?i)x *10 *3 */ *u? *l(?![a-z])", "x10^3/µL"),
            new ArtifactRepair("(?i)x *10 *6 */ *u? *l(?![a-z])", "x10^6/µL"),
            new ArtifactRepair("(?i)x *10 *9 */ *l(?![a-z])", "x10^9/L")));

    /**
     * Worker threads used for batch extraction. 0 = number of available processors.
     */
    private int batchThreadPoolSize = 0;

    /**
     * Maximum time to wait for a whole batch. Documents still running at the
     * deadline are cancelled and reported as timed out.
     */
    private long batchTimeoutSeconds = 30;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ArtifactRepair {
        private String pattern;
        private String replacement;
    }
}
