package com.al.medreportz.service;

import com.al.medreportz.model.PatientInfo;
import com.al.medreportz.model.PatientRecord;
import com.al.medreportz.model.ResolvedLabResult;
import com.al.medreportz.model.VitalSigns;
import com.al.medreportz.model.enums.Highlight;
import com.al.medreportz.util.NumberFormatUtil;
import com.al.medreportz.util.ReportConstants;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the final {@link PatientRecord} and its plain-text lab renderings.
 * No extraction happens here.
 */
@Service
public class RecordAssembler {

    public PatientRecord assemble(String fileName, String language, String normalizedText,
            PatientInfo patient, VitalSigns vitals, List<ResolvedLabResult> labs) {
        return PatientRecord.builder()
                .fileName(fileName)
                .language(language)
                .patient(patient != null ? patient : PatientInfo.empty())
                .vitalSigns(vitals != null ? vitals : VitalSigns.empty())
                .labs(labs != null ? labs : List.of())
                .rawText(normalizedText)
                .build();
    }

    /**
     * One line per lab, in the format handed to the narrative generator:
     * {@code - Hemoglobin: 11.2 g/dL (Normal: 13–17, Status: Low)}.
     */
    public String renderLabsAsText(List<ResolvedLabResult> labs) {
        if (labs == null || labs.isEmpty()) {
            return ReportConstants.NO_LABS_DETECTED;
        }
        return labs.stream()
                .map(lab -> "- " + describe(lab))
                .collect(Collectors.joining("\n"));
    }

    /**
     * Console rendering: "[!]" for out-of-range values, "[OK]" for normal ones.
     */
    public String renderLabHighlights(List<ResolvedLabResult> labs) {
        if (labs == null || labs.isEmpty()) {
            return ReportConstants.NO_LABS_DETECTED;
        }
        return labs.stream()
                .map(lab -> tag(lab.getHighlight()) + describe(lab))
                .collect(Collectors.joining("\n"));
    }

    private static String describe(ResolvedLabResult lab) {
        return String.format("%s: %s %s (Normal: %s, Status: %s)",
                lab.getTestName(),
                NumberFormatUtil.natural(lab.getValue()),
                lab.getUnit(),
                lab.getNormalRange(),
                lab.getStatus());
    }

    private static String tag(Highlight highlight) {
        if (highlight == Highlight.WARNING) {
            return "[!] ";
        }
        if (highlight == Highlight.NORMAL) {
            return "[OK] ";
        }
        return "";
    }
}
