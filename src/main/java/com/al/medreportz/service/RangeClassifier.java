package com.al.medreportz.service;

import com.al.medreportz.model.LabResolution;
import com.al.medreportz.model.RawLabMention;
import com.al.medreportz.model.ReferenceEntry;
import com.al.medreportz.model.ResolvedLabResult;
import com.al.medreportz.model.enums.Highlight;
import com.al.medreportz.model.enums.LabStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Classifies a resolved mention against its reference interval.
 * Both bounds belong to the normal range.
 */
@Service
public class RangeClassifier {

    private final ReferenceTable referenceTable;

    @Autowired
    public RangeClassifier(ReferenceTable referenceTable) {
        this.referenceTable = referenceTable;
    }

    public ResolvedLabResult classify(RawLabMention mention, LabResolution resolution) {
        String unit = mention.getUnit() != null ? mention.getUnit() : ResolvedLabResult.UNIT_UNKNOWN;
        Optional<ReferenceEntry> reference = resolution.isResolved()
                ? referenceTable.find(resolution.getCanonicalKey())
                : Optional.empty();

        LabStatus status = reference
                .map(entry -> status(entry, mention.getValue()))
                .orElse(LabStatus.UNKNOWN);

        return ResolvedLabResult.builder()
                .testKey(reference.map(ReferenceEntry::getKey).orElse(null))
                .testName(reference.map(ReferenceEntry::getDisplayName).orElse(mention.getLabel()))
                .value(mention.getValue())
                .unit(unit)
                .normalRange(reference.map(ReferenceEntry::formatRange).orElse(ResolvedLabResult.RANGE_NOT_AVAILABLE))
                .status(status)
                .highlight(Highlight.fromStatus(status))
                .confidence(resolution.getConfidence())
                .build();
    }

    static LabStatus status(ReferenceEntry entry, double value) {
        if (value < entry.getLow()) {
            return LabStatus.LOW;
        }
        if (value > entry.getHigh()) {
            return LabStatus.HIGH;
        }
        return LabStatus.NORMAL;
    }
}
