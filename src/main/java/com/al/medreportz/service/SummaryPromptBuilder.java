package com.al.medreportz.service;

import com.al.medreportz.model.PatientInfo;
import com.al.medreportz.model.PatientRecord;
import com.al.medreportz.model.enums.VitalSignKind;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the prompt given to an external narrative generator. The generator itself
 * is not part of this service.
 */
@Service
public class SummaryPromptBuilder {

    private static final String RULES = String.join("\n",
            "Rules:",
            "- Write ONE short summary paragraph",
            "- Use simple, non-technical language",
            "- Do NOT diagnose diseases",
            "- Do NOT suggest treatments",
            "- Be calm and reassuring",
            "- Do NOT discuss future tests or investigations",
            "- Only describe what is present in the report, not future plans");

    static final String LABS_NOT_INTERPRETED = "Lab values were present but could not be fully interpreted.";

    private final RecordAssembler recordAssembler;

    @Autowired
    public SummaryPromptBuilder(RecordAssembler recordAssembler) {
        this.recordAssembler = recordAssembler;
    }

    public String build(PatientRecord record) {
        PatientInfo patient = record.getPatient() != null ? record.getPatient() : PatientInfo.empty();

        String greeting = patient.getName() != null ? "Hello " + patient.getName() + "," : "Hello,";

        List<String> patientContext = new ArrayList<>();
        if (patient.getAge() != null) {
            patientContext.add("Age: " + patient.getAge());
        }
        if (patient.getGender() != null) {
            patientContext.add("Gender: " + patient.getGender().getLabel());
        }

        List<String> vitalsContext = new ArrayList<>();
        if (record.getVitalSigns() != null) {
            for (VitalSignKind kind : VitalSignKind.values()) {
                record.getVitalSigns().get(kind)
                        .ifPresent(value -> vitalsContext.add(kind.getDisplayName() + ": " + value));
            }
        }

        return String.join("\n",
                greeting,
                "",
                "You are a medical assistant summarizing a health report.",
                "",
                RULES,
                "",
                "Patient Information:",
                patientContext.isEmpty() ? "Not specified" : String.join("\n", patientContext),
                "",
                "Vital Signs:",
                vitalsContext.isEmpty() ? "Not available" : String.join("\n", vitalsContext),
                "",
                "Lab Results:",
                record.getLabs() == null || record.getLabs().isEmpty()
                        ? LABS_NOT_INTERPRETED
                        : recordAssembler.renderLabsAsText(record.getLabs()),
                "",
                "Provide a friendly patient summary.");
    }
}
