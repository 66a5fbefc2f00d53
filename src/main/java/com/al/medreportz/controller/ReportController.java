package com.al.medreportz.controller;

import com.al.medreportz.dto.BatchExtractionRequest;
import com.al.medreportz.dto.BatchExtractionResponse;
import com.al.medreportz.model.PatientRecord;
import com.al.medreportz.model.RawDocument;
import com.al.medreportz.model.ReferenceEntry;
import com.al.medreportz.service.BatchExtractionService;
import com.al.medreportz.service.FhirExportService;
import com.al.medreportz.service.RecordAssembler;
import com.al.medreportz.service.ReferenceTable;
import com.al.medreportz.service.ReportExtractionService;
import com.al.medreportz.service.SummaryPromptBuilder;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/reports")
@Slf4j
@Tag(name = "Extraction", description = "Medical report text to structured record")
public class ReportController {

    private static final String TEXT_PLAIN_UTF8 = MediaType.TEXT_PLAIN_VALUE + ";charset=UTF-8";

    private final ReportExtractionService reportExtractionService;
    private final BatchExtractionService batchExtractionService;
    private final FhirExportService fhirExportService;
    private final RecordAssembler recordAssembler;
    private final SummaryPromptBuilder summaryPromptBuilder;
    private final ReferenceTable referenceTable;

    @Autowired
    public ReportController(ReportExtractionService reportExtractionService,
            BatchExtractionService batchExtractionService,
            FhirExportService fhirExportService,
            RecordAssembler recordAssembler,
            SummaryPromptBuilder summaryPromptBuilder,
            ReferenceTable referenceTable) {
        this.reportExtractionService = reportExtractionService;
        this.batchExtractionService = batchExtractionService;
        this.fhirExportService = fhirExportService;
        this.recordAssembler = recordAssembler;
        this.summaryPromptBuilder = summaryPromptBuilder;
        this.referenceTable = referenceTable;
    }

    @Operation(summary = "Extract a report", description = "Normalizes the report text and returns patient details, vital signs and classified lab results.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Record extracted"),
            @ApiResponse(responseCode = "400", description = "Missing text or file name")
    })
    @PostMapping(value = "/extract", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PatientRecord> extract(
            @Parameter(description = "Plain text of the report") @RequestBody String text,
            @Parameter(description = "Name of the source file") @RequestParam String fileName,
            @Parameter(description = "Language tag from an upstream detector") @RequestParam(required = false) String language) {
        return ResponseEntity.ok(reportExtractionService.extract(text, fileName, language));
    }

    @Operation(summary = "Extract a report as FHIR", description = "Returns the extracted record as a FHIR R4 collection Bundle.")
    @PostMapping(value = "/extract/fhir", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> extractFhir(
            @RequestBody String text,
            @RequestParam String fileName,
            @RequestParam(required = false) String language) {
        PatientRecord record = reportExtractionService.extract(text, fileName, language);
        return ResponseEntity.ok(fhirExportService.toFhirJson(record));
    }

    @Operation(summary = "Extract lab results as text", description = "One line per lab result with value, unit, normal range and status. With highlights=true, out-of-range lines are tagged [!] and normal ones [OK].")
    @PostMapping(value = "/extract/labs-text", consumes = MediaType.TEXT_PLAIN_VALUE, produces = TEXT_PLAIN_UTF8)
    public ResponseEntity<String> extractLabsText(
            @RequestBody String text,
            @RequestParam String fileName,
            @RequestParam(required = false) String language,
            @Parameter(description = "Tag each line by highlight") @RequestParam(defaultValue = "false") boolean highlights) {
        PatientRecord record = reportExtractionService.extract(text, fileName, language);
        return ResponseEntity.ok(highlights
                ? recordAssembler.renderLabHighlights(record.getLabs())
                : recordAssembler.renderLabsAsText(record.getLabs()));
    }

    @Operation(summary = "Build a summary prompt", description = "Prompt for an external narrative generator, built from the extracted record.")
    @PostMapping(value = "/extract/summary-prompt", consumes = MediaType.TEXT_PLAIN_VALUE, produces = TEXT_PLAIN_UTF8)
    public ResponseEntity<String> extractSummaryPrompt(
            @RequestBody String text,
            @RequestParam String fileName,
            @RequestParam(required = false) String language) {
        PatientRecord record = reportExtractionService.extract(text, fileName, language);
        return ResponseEntity.ok(summaryPromptBuilder.build(record));
    }

    @Operation(summary = "Extract several reports", description = "Documents are extracted in parallel. A failing document is reported in the error list.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Batch processed"),
            @ApiResponse(responseCode = "400", description = "Invalid batch request")
    })
    @PostMapping(value = "/batch", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BatchExtractionResponse> extractBatch(@Valid @RequestBody BatchExtractionRequest request) {
        log.info("Received batch extraction request with {} documents", request.getDocuments().size());
        List<RawDocument> documents = request.getDocuments().stream()
                .map(d -> new RawDocument(d.getText(), d.getFileName(), d.getLanguage()))
                .collect(Collectors.toList());
        return ResponseEntity.ok(batchExtractionService.extractBatch(documents));
    }

    @Operation(summary = "List reference ranges", description = "Active reference intervals in resolution order.")
    @Tag(name = "Reference")
    @GetMapping(value = "/reference-ranges", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<ReferenceEntry>> getReferenceRanges() {
        return ResponseEntity.ok(referenceTable.getEntries());
    }
}
