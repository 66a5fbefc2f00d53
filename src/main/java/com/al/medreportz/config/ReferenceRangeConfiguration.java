package com.al.medreportz.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Reference intervals and alias table for lab tests.
 * Loaded from the {@code medreportz.reference} section of application.yml; the defaults below
 * are used when the section is absent.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "medreportz.reference")
public class ReferenceRangeConfiguration {

    /**
     * Confidence assigned when a label contains one of the aliases of a known test.
     */
    private double exactMatchConfidence = 0.95;

    /**
     * Confidence assigned when no alias matches.
     */
    private double unresolvedConfidence = 0.4;

    /**
     * Known tests. Declaration order is the alias matching order, so a test whose
     * aliases are contained in another test's label must come first (MCHC before MCH,
     * the red cell indices and HbA1c before hemoglobin).
     */
    private List<TestDefinition> tests = defaultTests();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TestDefinition {
        private String key;
        private String displayName;
        private List<String> aliases = new ArrayList<>();
        private double low;
        private double high;
        private String unit;
    }

    private static List<TestDefinition> defaultTests() {
        List<TestDefinition> tests = new ArrayList<>();
        tests.add(new TestDefinition("mchc", "MCHC",
                List.of("mchc", "mean corpuscular hemoglobin concentration",
                        "mean corpuscular haemoglobin concentration"), 31.5, 34.5, "g/dL"));
        tests.add(new TestDefinition("mch", "MCH",
                List.of("mch", "mean corpuscular hemoglobin", "mean corpuscular haemoglobin"), 27, 32, "pg"));
        tests.add(new TestDefinition("mcv", "MCV",
                List.of("mcv", "mean corpuscular volume"), 83, 101, "fL"));
        tests.add(new TestDefinition("rdw", "RDW",
                List.of("rdw", "red cell distribution width"), 11.6, 14.0, "%"));
        tests.add(new TestDefinition("pcv", "PCV",
                List.of("pcv", "packed cell volume", "hematocrit", "hct"), 40, 50, "%"));
        tests.add(new TestDefinition("rbc", "RBC Count",
                List.of("rbc", "red blood cell", "total rbc"), 4.5, 5.5, "mill/cumm"));
        tests.add(new TestDefinition("wbc", "WBC Count",
                List.of("wbc", "white blood cell", "tlc", "total leukocyte"), 4.0, 11.0, "x10^3/µL"));
        tests.add(new TestDefinition("platelet", "Platelet Count",
                List.of("platelet", "plt"), 150, 450, "x10^3/µL"));
        tests.add(new TestDefinition("hba1c", "HbA1c",
                List.of("hba1c", "glycated hemoglobin", "glycated haemoglobin",
                        "glycosylated hemoglobin", "glycosylated haemoglobin"), 4.0, 5.6, "%"));
        tests.add(new TestDefinition("hemoglobin", "Hemoglobin",
                List.of("hemoglobin", "haemoglobin", "hgb", "hb"), 13.0, 17.0, "g/dL"));
        tests.add(new TestDefinition("glucose", "Glucose",
                List.of("glucose", "blood sugar"), 70, 99, "mg/dL"));
        tests.add(new TestDefinition("cholesterol", "Cholesterol",
                List.of("cholesterol"), 0, 200, "mg/dL"));
        return tests;
    }
}
