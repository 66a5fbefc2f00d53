package com.al.medreportz.service.extractor;

import com.al.medreportz.model.VitalSigns;
import com.al.medreportz.model.enums.VitalSignKind;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class VitalSignsExtractorTest {

    private final VitalSignsExtractor extractor = new VitalSignsExtractor();

    @Test
    public void testAllVitals() {
        VitalSigns vitals = extractor.extract(
                "BP: 120/80 mmHg\nPulse: 72 bpm\nRR: 16 breaths/min\nTemp: 98.6 F\nSpO2: 98%");

        assertEquals(Optional.of("120/80 mmHg"), vitals.get(VitalSignKind.BLOOD_PRESSURE));
        assertEquals(Optional.of("72 bpm"), vitals.get(VitalSignKind.HEART_RATE));
        assertEquals(Optional.of("16 breaths/min"), vitals.get(VitalSignKind.RESPIRATORY_RATE));
        assertEquals(Optional.of("98.6 F"), vitals.get(VitalSignKind.TEMPERATURE));
        assertEquals(Optional.of("98%"), vitals.get(VitalSignKind.OXYGEN_SATURATION));
    }

    @Test
    public void testLongLabels() {
        VitalSigns vitals = extractor.extract("Blood Pressure - 130 / 85 mmHg, Heart Rate: 88 beats/min");

        assertEquals(Optional.of("130 / 85 mmHg"), vitals.get(VitalSignKind.BLOOD_PRESSURE));
        assertEquals(Optional.of("88 beats/min"), vitals.get(VitalSignKind.HEART_RATE));
        assertEquals(2, vitals.asMap().size());
    }

    @Test
    public void testReadingWithoutUnitIsAbsent() {
        VitalSigns vitals = extractor.extract("BP: 120/80\nPulse: 72");

        assertTrue(vitals.isEmpty());
    }

    @Test
    public void testJsonKeys() {
        VitalSigns vitals = extractor.extract("BP: 110/70 mmHg");

        assertEquals("110/70 mmHg", vitals.toJson().get("blood_pressure"));
        assertEquals(1, vitals.toJson().size());
    }
}
