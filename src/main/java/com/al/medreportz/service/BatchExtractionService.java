package com.al.medreportz.service;

import com.al.medreportz.config.ExtractionConfiguration;
import com.al.medreportz.dto.BatchExtractionResponse;
import com.al.medreportz.dto.BatchExtractionResponse.DocumentError;
import com.al.medreportz.dto.BatchExtractionResponse.DocumentResult;
import com.al.medreportz.exception.ReportExtractionException;
import com.al.medreportz.model.PatientRecord;
import com.al.medreportz.model.RawDocument;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Extracts several documents in parallel.
 *
 * <p>
 * Each document is an independent pipeline run against the shared read-only
 * reference tables, so no coordination is needed beyond collecting results.
 * A failing document is reported in the error list and does not affect the others.
 * The configured timeout bounds the whole batch; documents not done by then are
 * interrupted and reported as timed out.
 */
@Service
@Slf4j
public class BatchExtractionService {

    private final ReportExtractionService reportExtractionService;
    private final ExecutorService executorService;
    private final long timeoutSeconds;

    @Autowired
    public BatchExtractionService(ReportExtractionService reportExtractionService,
            ExtractionConfiguration configuration) {
        this.reportExtractionService = reportExtractionService;
        int threadPoolSize = configuration.getBatchThreadPoolSize() > 0
                ? configuration.getBatchThreadPoolSize()
                : Runtime.getRuntime().availableProcessors();
        this.executorService = Executors.newFixedThreadPool(threadPoolSize);
        this.timeoutSeconds = configuration.getBatchTimeoutSeconds();
        log.info("BatchExtractionService initialized with {} threads", threadPoolSize);
    }

    public BatchExtractionResponse extractBatch(List<RawDocument> documents) {
        long startTime = System.currentTimeMillis();
        log.info("Starting batch extraction: {} documents", documents.size());

        BatchExtractionResponse response = new BatchExtractionResponse();
        response.setTotalDocuments(documents.size());

        List<Future<DocumentResult>> futures = new ArrayList<>();
        for (int i = 0; i < documents.size(); i++) {
            final int index = i;
            final RawDocument document = documents.get(i);
            futures.add(executorService.submit(() -> extractOne(index, document)));
        }

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds);
        boolean interrupted = false;
        for (int i = 0; i < futures.size(); i++) {
            Future<DocumentResult> future = futures.get(i);
            String fileName = documents.get(i).getFileName();
            if (interrupted) {
                future.cancel(true);
                addError(response, i, fileName, "Batch interrupted");
                continue;
            }
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                response.getResults().add(future.get(remaining, TimeUnit.NANOSECONDS));
                response.setSuccessCount(response.getSuccessCount() + 1);
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Extraction timed out for document {} ({})", i, fileName);
                addError(response, i, fileName, "Extraction timed out after " + timeoutSeconds + "s");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() instanceof ReportExtractionException && e.getCause().getCause() != null
                        ? e.getCause().getCause()
                        : e.getCause();
                log.warn("Extraction failed for document {} ({}): {}", i, fileName, cause.getMessage());
                addError(response, i, fileName, cause.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Batch interrupted at document {} of {}", i, futures.size());
                interrupted = true;
                future.cancel(true);
                addError(response, i, fileName, "Batch interrupted");
            }
        }

        response.setProcessingTimeMs(System.currentTimeMillis() - startTime);
        log.info("Batch extraction completed: {} success, {} failures, {}ms total",
                response.getSuccessCount(), response.getFailureCount(), response.getProcessingTimeMs());
        return response;
    }

    private DocumentResult extractOne(int index, RawDocument document) {
        long start = System.currentTimeMillis();
        try {
            PatientRecord record = reportExtractionService.extract(document);
            return new DocumentResult(index, record, System.currentTimeMillis() - start);
        } catch (RuntimeException e) {
            throw new ReportExtractionException(document.getFileName(),
                    "Extraction failed for document " + index, e);
        }
    }

    private static void addError(BatchExtractionResponse response, int index, String fileName, String message) {
        response.getErrors().add(new DocumentError(index, fileName, message));
        response.setFailureCount(response.getFailureCount() + 1);
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdown();
    }
}
