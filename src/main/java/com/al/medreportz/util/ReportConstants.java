package com.al.medreportz.util;

/**
 * Shared terminology systems and fixed strings used across the extraction pipeline
 * and the FHIR export.
 */
public final class ReportConstants {

    private ReportConstants() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /** Sentinel returned by the lab text rendering when no lab was found */
    public static final String NO_LABS_DETECTED = "No lab values were detected.";

    /** LOINC system URL */
    public static final String SYSTEM_LOINC = "http://loinc.org";

    /** Observation category code system */
    public static final String SYSTEM_OBSERVATION_CATEGORY = "http://terminology.hl7.org/CodeSystem/observation-category";

    /** Observation interpretation code system (v3) */
    public static final String SYSTEM_INTERPRETATION = "http://terminology.hl7.org/CodeSystem/v3-ObservationInterpretation";

    /** Local code system for lab keys that have no LOINC mapping here */
    public static final String SYSTEM_LOCAL_LAB = "urn:medreportz:lab";

    /** Extension carrying the resolver confidence on a lab Observation */
    public static final String EXTENSION_CONFIDENCE = "urn:medreportz:extension:confidence";

    public static final String CATEGORY_LABORATORY = "laboratory";
    public static final String CATEGORY_VITAL_SIGNS = "vital-signs";
}
