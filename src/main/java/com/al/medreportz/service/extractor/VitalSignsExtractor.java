package com.al.medreportz.service.extractor;

import com.al.medreportz.model.VitalSigns;
import com.al.medreportz.model.enums.VitalSignKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Component
public class VitalSignsExtractor implements FieldExtractor<VitalSigns> {

    private static final String SEPARATOR = " *[:\\-]? *";

    private static final Map<VitalSignKind, Pattern> PATTERNS = new EnumMap<>(VitalSignKind.class);

    static {
        PATTERNS.put(VitalSignKind.BLOOD_PRESSURE, Pattern.compile(
                "\\b(?:Blood Pressure|BP)" + SEPARATOR + "(\\d+ */ *\\d+ *mmHg)\\b",
                Pattern.CASE_INSENSITIVE));
        PATTERNS.put(VitalSignKind.HEART_RATE, Pattern.compile(
                "\\b(?:Heart Rate|Pulse Rate|Pulse)" + SEPARATOR + "(\\d+ *(?:bpm|beats/min))",
                Pattern.CASE_INSENSITIVE));
        PATTERNS.put(VitalSignKind.RESPIRATORY_RATE, Pattern.compile(
                "\\b(?:Respiratory Rate|Resp Rate|RR)" + SEPARATOR + "(\\d+ *(?:breaths/min|/min|bpm))",
                Pattern.CASE_INSENSITIVE));
        PATTERNS.put(VitalSignKind.TEMPERATURE, Pattern.compile(
                "\\b(?:Temperature|Temp)" + SEPARATOR + "(\\d+(?:\\.\\d+)? *[FC])\\b",
                Pattern.CASE_INSENSITIVE));
        PATTERNS.put(VitalSignKind.OXYGEN_SATURATION, Pattern.compile(
                "\\b(?:SpO2|Oxygen Saturation|O2 Sat)" + SEPARATOR + "(\\d+(?:\\.\\d+)? *%)",
                Pattern.CASE_INSENSITIVE));
    }

    @Override
    public VitalSigns extract(String text) {
        if (text == null || text.isEmpty()) {
            return VitalSigns.empty();
        }
        Map<VitalSignKind, String> readings = new EnumMap<>(VitalSignKind.class);
        PATTERNS.forEach((kind, pattern) -> {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                readings.put(kind, matcher.group(1).strip());
            } else {
                log.debug("{} not found", kind.getDisplayName());
            }
        });
        return VitalSigns.of(readings);
    }
}
