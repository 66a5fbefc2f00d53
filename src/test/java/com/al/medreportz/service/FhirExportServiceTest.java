package com.al.medreportz.service;

import ca.uhn.fhir.context.FhirContext;
import com.al.medreportz.config.ReferenceRangeConfiguration;
import com.al.medreportz.model.PatientRecord;
import com.al.medreportz.model.enums.LabStatus;
import com.al.medreportz.util.ReportConstants;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.Enumerations;
import org.hl7.fhir.r4.model.Observation;
import org.hl7.fhir.r4.model.Patient;
import org.hl7.fhir.r4.model.Quantity;
import org.hl7.fhir.r4.model.StringType;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FhirExportServiceTest {

    private static final String REPORT = String.join("\n",
            "Patient Name: John Smith Age: 45 Gender: Male",
            "BP: 120/80 mmHg",
            "Hemoglobin 11.2 g/dL",
            "Glucose 105",
            "Cholesterol 150 mg/dL");

    private static FhirContext fhirContext;

    private FhirExportService exportService;
    private PatientRecord record;

    @BeforeAll
    public static void initContext() {
        fhirContext = FhirContext.forR4();
    }

    @BeforeEach
    public void setup() {
        exportService = new FhirExportService(fhirContext, new ReferenceTable(new ReferenceRangeConfiguration()));
        record = PipelineFixtures.reportExtractionService(new SimpleMeterRegistry()).extract(REPORT, "cbc.pdf", "en");
    }

    @Test
    public void testBundleStructure() {
        Bundle bundle = exportService.toBundle(record);

        assertEquals(Bundle.BundleType.COLLECTION, bundle.getType());
        assertEquals(5, bundle.getEntry().size());
        assertTrue(bundle.getEntry().get(0).getResource() instanceof Patient);
        assertTrue(bundle.getEntry().get(0).getFullUrl().startsWith("urn:uuid:"));

        Patient patient = (Patient) bundle.getEntry().get(0).getResource();
        assertEquals("John Smith", patient.getNameFirstRep().getText());
        assertEquals("Smith", patient.getNameFirstRep().getFamily());
        assertEquals(Enumerations.AdministrativeGender.MALE, patient.getGender());
    }

    @Test
    public void testVitalObservation() {
        Observation bp = observations(exportService.toBundle(record)).get(0);

        assertEquals(ReportConstants.CATEGORY_VITAL_SIGNS, bp.getCategoryFirstRep().getCodingFirstRep().getCode());
        assertEquals("85354-9", bp.getCode().getCodingFirstRep().getCode());
        assertEquals("120/80 mmHg", ((StringType) bp.getValue()).getValue());
    }

    @Test
    public void testLabObservation() {
        Observation hemoglobin = observations(exportService.toBundle(record)).get(1);

        assertEquals(ReportConstants.CATEGORY_LABORATORY, hemoglobin.getCategoryFirstRep().getCodingFirstRep().getCode());
        assertEquals("hemoglobin", hemoglobin.getCode().getCodingFirstRep().getCode());
        assertEquals("Hemoglobin", hemoglobin.getCode().getText());
        assertEquals(11.2, ((Quantity) hemoglobin.getValue()).getValue().doubleValue());
        assertEquals("g/dL", ((Quantity) hemoglobin.getValue()).getUnit());
        assertEquals(13.0, hemoglobin.getReferenceRangeFirstRep().getLow().getValue().doubleValue());
        assertEquals(17.0, hemoglobin.getReferenceRangeFirstRep().getHigh().getValue().doubleValue());
        assertEquals("L", hemoglobin.getInterpretationFirstRep().getCodingFirstRep().getCode());
        assertTrue(hemoglobin.hasExtension(ReportConstants.EXTENSION_CONFIDENCE));
    }

    @Test
    public void testMissingUnitFallsBackToReferenceUnit() {
        Observation glucose = observations(exportService.toBundle(record)).get(2);

        assertEquals("mg/dL", ((Quantity) glucose.getValue()).getUnit());
        assertEquals("H", glucose.getInterpretationFirstRep().getCodingFirstRep().getCode());
    }

    @Test
    public void testUnresolvedLabHasNoCodingOrRange() {
        PatientRecord unresolved = PatientRecord.builder()
                .fileName("x.pdf")
                .lab(RecordAssemblerTest.lab("Foobarase", 3.2, "Unknown", "Not available",
                        LabStatus.UNKNOWN))
                .build();

        Observation observation = observations(exportService.toBundle(unresolved)).get(0);

        assertFalse(observation.getCode().hasCoding());
        assertEquals("Foobarase", observation.getCode().getText());
        assertFalse(observation.hasReferenceRange());
        assertFalse(observation.hasInterpretation());
    }

    @Test
    public void testJsonEncoding() {
        String json = exportService.toFhirJson(record);

        assertTrue(json.contains("\"resourceType\": \"Bundle\""));
        assertTrue(json.contains("\"type\": \"collection\""));
        assertTrue(json.contains("Hemoglobin"));
    }

    private static List<Observation> observations(Bundle bundle) {
        return bundle.getEntry().stream()
                .map(Bundle.BundleEntryComponent::getResource)
                .filter(Observation.class::isInstance)
                .map(Observation.class::cast)
                .collect(Collectors.toList());
    }
}
