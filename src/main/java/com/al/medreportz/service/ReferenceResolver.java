package com.al.medreportz.service;

import com.al.medreportz.config.ReferenceRangeConfiguration;
import com.al.medreportz.model.LabResolution;
import com.al.medreportz.model.RawLabMention;
import com.al.medreportz.model.ReferenceEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Maps a mention label to a canonical test key by alias containment.
 * Tests are tried in reference table order and the first one with a contained
 * alias wins.
 */
@Service
@Slf4j
public class ReferenceResolver {

    private final ReferenceTable referenceTable;
    private final double exactMatchConfidence;
    private final double unresolvedConfidence;

    @Autowired
    public ReferenceResolver(ReferenceTable referenceTable, ReferenceRangeConfiguration configuration) {
        if (configuration.getExactMatchConfidence() < configuration.getUnresolvedConfidence()) {
            throw new IllegalArgumentException("Exact match confidence must not be below unresolved confidence");
        }
        this.referenceTable = referenceTable;
        this.exactMatchConfidence = clamp(configuration.getExactMatchConfidence());
        this.unresolvedConfidence = clamp(configuration.getUnresolvedConfidence());
    }

    public LabResolution resolve(RawLabMention mention) {
        String label = mention.getLabel() == null ? "" : mention.getLabel().toLowerCase(Locale.ROOT);
        if (!label.isBlank()) {
            for (ReferenceEntry entry : referenceTable.getEntries()) {
                for (String alias : entry.getAliases()) {
                    if (label.contains(alias)) {
                        return new LabResolution(entry.getKey(), exactMatchConfidence);
                    }
                }
            }
        }
        log.debug("No alias matched lab label '{}'", mention.getLabel());
        return new LabResolution(null, unresolvedConfidence);
    }

    private static double clamp(double confidence) {
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
