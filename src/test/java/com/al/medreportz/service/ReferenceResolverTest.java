package com.al.medreportz.service;

import com.al.medreportz.config.ReferenceRangeConfiguration;
import com.al.medreportz.config.ReferenceRangeConfiguration.TestDefinition;
import com.al.medreportz.model.LabResolution;
import com.al.medreportz.model.RawLabMention;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ReferenceResolverTest {

    private ReferenceResolver resolver;

    @BeforeEach
    public void setup() {
        ReferenceRangeConfiguration configuration = new ReferenceRangeConfiguration();
        resolver = new ReferenceResolver(new ReferenceTable(configuration), configuration);
    }

    @Test
    public void testResolvesAliases() {
        assertEquals("hemoglobin", resolve("Hemoglobin").getCanonicalKey());
        assertEquals("hemoglobin", resolve("Haemoglobin (Hb)").getCanonicalKey());
        assertEquals("pcv", resolve("Hematocrit").getCanonicalKey());
        assertEquals("wbc", resolve("Total Leukocyte Count (TLC)").getCanonicalKey());
        assertEquals("glucose", resolve("Fasting Blood Sugar").getCanonicalKey());
        assertEquals("platelet", resolve("PLT").getCanonicalKey());
    }

    @Test
    public void testContainedAliasesResolveToMoreSpecificTest() {
        assertEquals("mchc", resolve("MCHC").getCanonicalKey());
        assertEquals("mch", resolve("MCH").getCanonicalKey());
        assertEquals("mchc", resolve("Mean Corpuscular Hemoglobin Concentration").getCanonicalKey());
        assertEquals("mch", resolve("Mean Corpuscular Hemoglobin").getCanonicalKey());
        assertEquals("mchc", resolve("Mean Corpuscular Haemoglobin Concentration").getCanonicalKey());
        assertEquals("mch", resolve("Mean Corpuscular Haemoglobin").getCanonicalKey());
        assertEquals("hba1c", resolve("HbA1c").getCanonicalKey());
        assertEquals("hba1c", resolve("Glycated Hemoglobin").getCanonicalKey());
        assertEquals("hba1c", resolve("Glycosylated Haemoglobin (HbA1c)").getCanonicalKey());
    }

    @Test
    public void testConfidence() {
        LabResolution resolved = resolve("Glucose");
        LabResolution unresolved = resolve("Foobarase");

        assertTrue(resolved.isResolved());
        assertEquals(0.95, resolved.getConfidence());
        assertFalse(unresolved.isResolved());
        assertNull(unresolved.getCanonicalKey());
        assertEquals(0.4, unresolved.getConfidence());
        assertTrue(resolved.getConfidence() >= unresolved.getConfidence());
    }

    @Test
    public void testBlankLabelIsUnresolved() {
        assertFalse(resolve("").isResolved());
        assertFalse(resolver.resolve(new RawLabMention(null, 1.0, "Unknown")).isResolved());
    }

    @Test
    public void testDeclarationOrderBreaksTies() {
        ReferenceRangeConfiguration configuration = ReferenceTableTest.configWith(
                new TestDefinition("ldl", "LDL Cholesterol", List.of("ldl"), 0, 100, "mg/dL"),
                new TestDefinition("cholesterol", "Cholesterol", List.of("cholesterol"), 0, 200, "mg/dL"));
        ReferenceResolver custom = new ReferenceResolver(new ReferenceTable(configuration), configuration);

        assertEquals("ldl", custom.resolve(new RawLabMention("LDL Cholesterol", 90, "mg/dL")).getCanonicalKey());
        assertEquals("cholesterol", custom.resolve(new RawLabMention("Total Cholesterol", 180, "mg/dL")).getCanonicalKey());
    }

    @Test
    public void testRejectsInvertedConfidences() {
        ReferenceRangeConfiguration configuration = new ReferenceRangeConfiguration();
        configuration.setExactMatchConfidence(0.3);
        configuration.setUnresolvedConfidence(0.5);

        assertThrows(IllegalArgumentException.class,
                () -> new ReferenceResolver(new ReferenceTable(configuration), configuration));
    }

    private LabResolution resolve(String label) {
        return resolver.resolve(new RawLabMention(label, 1.0, "Unknown"));
    }
}
