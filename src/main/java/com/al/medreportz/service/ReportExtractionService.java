package com.al.medreportz.service;

import com.al.medreportz.config.ExtractionConfiguration;
import com.al.medreportz.model.LabResolution;
import com.al.medreportz.model.PatientInfo;
import com.al.medreportz.model.PatientRecord;
import com.al.medreportz.model.RawDocument;
import com.al.medreportz.model.RawLabMention;
import com.al.medreportz.model.ResolvedLabResult;
import com.al.medreportz.model.VitalSigns;
import com.al.medreportz.service.extractor.LabMentionExtractor;
import com.al.medreportz.service.extractor.PatientInfoExtractor;
import com.al.medreportz.service.extractor.VitalSignsExtractor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the extraction pipeline for one document:
 * normalize, extract fields, resolve lab aliases, classify against reference
 * ranges, assemble the record.
 *
 * <p>
 * Data-quality problems never fail a run; missing fields come back null or
 * {@code Unknown}. Only a broken input contract (no text, no file name) throws.
 */
@Service
@Slf4j
public class ReportExtractionService {

    private final TextNormalizationService normalizationService;
    private final PatientInfoExtractor patientInfoExtractor;
    private final VitalSignsExtractor vitalSignsExtractor;
    private final LabMentionExtractor labMentionExtractor;
    private final ReferenceResolver referenceResolver;
    private final RangeClassifier rangeClassifier;
    private final RecordAssembler recordAssembler;
    private final ExtractionConfiguration extractionConfiguration;
    private final MeterRegistry meterRegistry;

    @Autowired
    public ReportExtractionService(
            TextNormalizationService normalizationService,
            PatientInfoExtractor patientInfoExtractor,
            VitalSignsExtractor vitalSignsExtractor,
            LabMentionExtractor labMentionExtractor,
            ReferenceResolver referenceResolver,
            RangeClassifier rangeClassifier,
            RecordAssembler recordAssembler,
            ExtractionConfiguration extractionConfiguration,
            MeterRegistry meterRegistry) {
        this.normalizationService = normalizationService;
        this.patientInfoExtractor = patientInfoExtractor;
        this.vitalSignsExtractor = vitalSignsExtractor;
        this.labMentionExtractor = labMentionExtractor;
        this.referenceResolver = referenceResolver;
        this.rangeClassifier = rangeClassifier;
        this.recordAssembler = recordAssembler;
        this.extractionConfiguration = extractionConfiguration;
        this.meterRegistry = meterRegistry;
    }

    public PatientRecord extract(String rawText, String fileName, String language) {
        return extract(new RawDocument(rawText, fileName, language));
    }

    public PatientRecord extract(RawDocument document) {
        if (document == null || document.getText() == null) {
            meterRegistry.counter("medreportz.extraction.count", "status", "rejected").increment();
            throw new IllegalArgumentException("Report text must not be null");
        }
        if (document.getFileName() == null || document.getFileName().isBlank()) {
            meterRegistry.counter("medreportz.extraction.count", "status", "rejected").increment();
            throw new IllegalArgumentException("File name must not be blank");
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        log.info("Starting extraction for file: {}", document.getFileName());

        String text = normalizationService.normalize(document.getText());
        if (text.isEmpty()) {
            log.warn("Normalized text is empty for file: {}", document.getFileName());
        }

        PatientInfo patient = patientInfoExtractor.extract(text);
        VitalSigns vitals = vitalSignsExtractor.extract(text);
        List<RawLabMention> mentions = labMentionExtractor.extract(text);
        List<ResolvedLabResult> labs = resolveLabs(mentions);

        PatientRecord record = recordAssembler.assemble(
                baseName(document.getFileName()), languageOf(document), text, patient, vitals, labs);

        sample.stop(meterRegistry.timer("medreportz.extraction.time"));
        meterRegistry.counter("medreportz.extraction.count", "status", "success").increment();
        log.info("Extraction completed for file: {} ({} labs, {} vital signs)",
                document.getFileName(), labs.size(), vitals.asMap().size());
        return record;
    }

    /**
     * Resolves and classifies mentions, keeping their order. Unresolved mentions are
     * kept with status Unknown.
     */
    public List<ResolvedLabResult> resolveLabs(List<RawLabMention> mentions) {
        List<ResolvedLabResult> labs = new ArrayList<>(mentions.size());
        for (RawLabMention mention : mentions) {
            LabResolution resolution = referenceResolver.resolve(mention);
            ResolvedLabResult result = rangeClassifier.classify(mention, resolution);
            meterRegistry.counter("medreportz.labs.count", "status", result.getStatus().getLabel()).increment();
            labs.add(result);
        }
        return labs;
    }

    private static String baseName(String fileName) {
        int separator = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        return separator >= 0 ? fileName.substring(separator + 1) : fileName;
    }

    private String languageOf(RawDocument document) {
        String language = document.getLanguage();
        return language == null || language.isBlank() ? extractionConfiguration.getDefaultLanguage() : language;
    }
}
