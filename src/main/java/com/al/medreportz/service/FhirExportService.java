package com.al.medreportz.service;

import ca.uhn.fhir.context.FhirContext;
import com.al.medreportz.model.PatientInfo;
import com.al.medreportz.model.PatientRecord;
import com.al.medreportz.model.ReferenceEntry;
import com.al.medreportz.model.ResolvedLabResult;
import com.al.medreportz.model.enums.Gender;
import com.al.medreportz.model.enums.LabStatus;
import com.al.medreportz.model.enums.VitalSignKind;
import com.al.medreportz.util.ReportConstants;
import lombok.extern.slf4j.Slf4j;
import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.DecimalType;
import org.hl7.fhir.r4.model.Enumerations;
import org.hl7.fhir.r4.model.HumanName;
import org.hl7.fhir.r4.model.Observation;
import org.hl7.fhir.r4.model.Patient;
import org.hl7.fhir.r4.model.Quantity;
import org.hl7.fhir.r4.model.Reference;
import org.hl7.fhir.r4.model.SimpleQuantity;
import org.hl7.fhir.r4.model.StringType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Exports an extracted record as a FHIR R4 collection Bundle: one Patient, one
 * vital-sign Observation per reading and one laboratory Observation per lab result.
 */
@Service
@Slf4j
public class FhirExportService {

    private final FhirContext fhirContext;
    private final ReferenceTable referenceTable;

    @Autowired
    public FhirExportService(FhirContext fhirContext, ReferenceTable referenceTable) {
        this.fhirContext = fhirContext;
        this.referenceTable = referenceTable;
    }

    public String toFhirJson(PatientRecord record) {
        return fhirContext.newJsonParser().setPrettyPrint(true).encodeResourceToString(toBundle(record));
    }

    public Bundle toBundle(PatientRecord record) {
        Bundle bundle = new Bundle();
        bundle.setId(UUID.randomUUID().toString());
        bundle.setType(Bundle.BundleType.COLLECTION);

        Patient patient = toPatient(record.getPatient());
        String patientUrl = "urn:uuid:" + patient.getIdElement().getIdPart();
        bundle.addEntry().setFullUrl(patientUrl).setResource(patient);

        if (record.getVitalSigns() != null) {
            for (Map.Entry<VitalSignKind, String> vital : record.getVitalSigns().asMap().entrySet()) {
                Observation observation = toVitalObservation(vital.getKey(), vital.getValue(), patientUrl);
                bundle.addEntry().setFullUrl("urn:uuid:" + observation.getIdElement().getIdPart())
                        .setResource(observation);
            }
        }

        for (ResolvedLabResult lab : record.getLabs()) {
            Observation observation = toLabObservation(lab, patientUrl);
            bundle.addEntry().setFullUrl("urn:uuid:" + observation.getIdElement().getIdPart())
                    .setResource(observation);
        }

        log.debug("Exported record {} as FHIR bundle with {} entries", record.getFileName(), bundle.getEntry().size());
        return bundle;
    }

    private Patient toPatient(PatientInfo info) {
        Patient patient = new Patient();
        patient.setId(UUID.randomUUID().toString());
        if (info == null) {
            return patient;
        }

        if (info.getName() != null) {
            HumanName name = patient.addName().setText(info.getName());
            String[] parts = info.getName().trim().split("\\s+");
            if (parts.length > 1) {
                name.setFamily(parts[parts.length - 1]);
                for (int i = 0; i < parts.length - 1; i++) {
                    name.addGiven(parts[i]);
                }
            }
        }

        if (info.getGender() == Gender.MALE) {
            patient.setGender(Enumerations.AdministrativeGender.MALE);
        } else if (info.getGender() == Gender.FEMALE) {
            patient.setGender(Enumerations.AdministrativeGender.FEMALE);
        } else {
            patient.setGender(Enumerations.AdministrativeGender.UNKNOWN);
        }
        return patient;
    }

    private Observation toVitalObservation(VitalSignKind kind, String value, String patientUrl) {
        Observation observation = new Observation();
        observation.setId(UUID.randomUUID().toString());
        observation.setStatus(Observation.ObservationStatus.FINAL);
        observation.addCategory(category(ReportConstants.CATEGORY_VITAL_SIGNS, "Vital Signs"));
        observation.getCode().addCoding()
                .setSystem(ReportConstants.SYSTEM_LOINC)
                .setCode(kind.getLoincCode())
                .setDisplay(kind.getDisplayName());
        observation.getCode().setText(kind.getDisplayName());
        observation.setSubject(new Reference(patientUrl));
        // Readings keep the printed unit ("120/80 mmHg"), so they are carried as text
        observation.setValue(new StringType(value));
        return observation;
    }

    private Observation toLabObservation(ResolvedLabResult lab, String patientUrl) {
        Observation observation = new Observation();
        observation.setId(UUID.randomUUID().toString());
        observation.setStatus(Observation.ObservationStatus.FINAL);
        observation.addCategory(category(ReportConstants.CATEGORY_LABORATORY, "Laboratory"));
        observation.setSubject(new Reference(patientUrl));

        Optional<ReferenceEntry> reference = referenceTable.find(lab.getTestKey());

        CodeableConcept code = observation.getCode();
        reference.ifPresent(entry -> code.addCoding()
                .setSystem(ReportConstants.SYSTEM_LOCAL_LAB)
                .setCode(entry.getKey())
                .setDisplay(entry.getDisplayName()));
        code.setText(lab.getTestName());

        String unit = lab.getUnit();
        if (ResolvedLabResult.UNIT_UNKNOWN.equals(unit)) {
            unit = reference.map(ReferenceEntry::getUnit).orElse(null);
        }
        Quantity quantity = new Quantity();
        quantity.setValue(BigDecimal.valueOf(lab.getValue()));
        if (unit != null) {
            quantity.setUnit(unit);
        }
        observation.setValue(quantity);

        reference.ifPresent(entry -> {
            Observation.ObservationReferenceRangeComponent range = observation.addReferenceRange();
            range.setLow((SimpleQuantity) new SimpleQuantity().setValue(entry.getLow()).setUnit(entry.getUnit()));
            range.setHigh((SimpleQuantity) new SimpleQuantity().setValue(entry.getHigh()).setUnit(entry.getUnit()));
            range.setText(lab.getNormalRange());
        });

        String interpretation = interpretationCode(lab.getStatus());
        if (interpretation != null) {
            observation.addInterpretation().addCoding()
                    .setSystem(ReportConstants.SYSTEM_INTERPRETATION)
                    .setCode(interpretation)
                    .setDisplay(lab.getStatus().getLabel());
        }

        observation.addExtension()
                .setUrl(ReportConstants.EXTENSION_CONFIDENCE)
                .setValue(new DecimalType(lab.getConfidence()));
        return observation;
    }

    private static CodeableConcept category(String code, String display) {
        CodeableConcept category = new CodeableConcept();
        category.addCoding().setSystem(ReportConstants.SYSTEM_OBSERVATION_CATEGORY).setCode(code).setDisplay(display);
        return category;
    }

    private static String interpretationCode(LabStatus status) {
        switch (status) {
            case LOW:
                return "L";
            case HIGH:
                return "H";
            case NORMAL:
                return "N";
            default:
                return null;
        }
    }
}
