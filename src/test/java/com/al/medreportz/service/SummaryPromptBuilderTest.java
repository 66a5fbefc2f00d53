package com.al.medreportz.service;

import com.al.medreportz.model.PatientInfo;
import com.al.medreportz.model.PatientRecord;
import com.al.medreportz.model.VitalSigns;
import com.al.medreportz.model.enums.Gender;
import com.al.medreportz.model.enums.LabStatus;
import com.al.medreportz.model.enums.VitalSignKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SummaryPromptBuilderTest {

    private final SummaryPromptBuilder builder = new SummaryPromptBuilder(new RecordAssembler());

    @Test
    public void testPromptWithPatientDetails() {
        PatientRecord record = PatientRecord.builder()
                .fileName("cbc.pdf")
                .patient(PatientInfo.builder().name("John Smith").age(45).gender(Gender.MALE).build())
                .vitalSigns(VitalSigns.of(Map.of(VitalSignKind.BLOOD_PRESSURE, "120/80 mmHg")))
                .lab(RecordAssemblerTest.lab("Hemoglobin", 11.2, "g/dL", "13–17", LabStatus.LOW))
                .build();

        String prompt = builder.build(record);

        assertTrue(prompt.startsWith("Hello John Smith,"));
        assertTrue(prompt.contains("Age: 45\nGender: Male"));
        assertTrue(prompt.contains("Vital Signs:\nBlood Pressure: 120/80 mmHg"));
        assertTrue(prompt.contains("Lab Results:\n- Hemoglobin: 11.2 g/dL (Normal: 13–17, Status: Low)"));
        assertTrue(prompt.contains("- Do NOT diagnose diseases"));
        assertTrue(prompt.contains("- Do NOT discuss future tests or investigations"));
        assertTrue(prompt.endsWith("Provide a friendly patient summary."));
    }

    @Test
    public void testPromptWithoutDetails() {
        PatientRecord record = PatientRecord.builder()
                .fileName("blank.pdf")
                .patient(PatientInfo.empty())
                .vitalSigns(VitalSigns.empty())
                .labs(List.of())
                .build();

        String prompt = builder.build(record);

        assertTrue(prompt.startsWith("Hello,"));
        assertTrue(prompt.contains("Patient Information:\nNot specified"));
        assertTrue(prompt.contains("Vital Signs:\nNot available"));
        assertTrue(prompt.contains("Lab Results:\nLab values were present but could not be fully interpreted."));
        assertFalse(prompt.contains("null"));
    }
}
