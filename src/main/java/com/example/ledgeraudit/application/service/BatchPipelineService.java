package com.example.ledgeraudit.application.service;

import com.example.ledgeraudit.application.exception.BatchRequestValidationException;
import com.example.ledgeraudit.application.port.DocumentSubmission;
import com.example.ledgeraudit.application.port.ReferenceTableSource;
import com.example.ledgeraudit.application.port.VerificationAuditLog;
import com.example.ledgeraudit.config.LedgerProperties;
import com.example.ledgeraudit.domain.model.AggregationIndex;
import com.example.ledgeraudit.domain.model.AnomalyReport;
import com.example.ledgeraudit.domain.model.CanonicalLedger;
import com.example.ledgeraudit.domain.model.Claim;
import com.example.ledgeraudit.domain.model.ControlTotalCheck;
import com.example.ledgeraudit.domain.model.DocumentError;
import com.example.ledgeraudit.domain.model.DocumentExtraction;
import com.example.ledgeraudit.domain.model.ParseFailure;
import com.example.ledgeraudit.domain.model.PipelineReport;
import com.example.ledgeraudit.domain.model.RawLine;
import com.example.ledgeraudit.domain.model.RecordIdentity;
import com.example.ledgeraudit.domain.model.ReferenceTables;
import com.example.ledgeraudit.domain.model.SourceDocument;
import com.example.ledgeraudit.domain.model.TransactionRecord;
import com.example.ledgeraudit.domain.model.ValidationRejection;
import com.example.ledgeraudit.domain.model.VerificationReport;
import com.example.ledgeraudit.domain.model.WarrantNumberGap;
import com.example.ledgeraudit.infrastructure.exception.AcquisitionException;
import com.example.ledgeraudit.infrastructure.exception.AuditLogException;
import com.example.ledgeraudit.infrastructure.json.DeterministicJsonWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a batch: documents are processed in parallel on the worker pool, then, once every document has
 * finished, the batch is reconciled, aggregated and verified in one deterministic pass.
 * A failing document is reported and left out; it never stops its siblings.
 */
@Service
public class BatchPipelineService {

    private static final Logger log = LoggerFactory.getLogger(BatchPipelineService.class);

    private final DocumentProcessor documentProcessor;
    private final ReconciliationEngine reconciliationEngine;
    private final AggregationIndexBuilder aggregationIndexBuilder;
    private final ClaimVerificationEngine verificationEngine;
    private final ControlTotalReconciler controlTotalReconciler;
    private final WarrantGapDetector warrantGapDetector;
    private final ReferenceTableSource referenceTableSource;
    private final VerificationAuditLog auditLog;
    private final DeterministicJsonWriter jsonWriter;
    private final ExecutorService workerPool;
    private final LedgerProperties properties;

    public BatchPipelineService(DocumentProcessor documentProcessor,
                                ReconciliationEngine reconciliationEngine,
                                AggregationIndexBuilder aggregationIndexBuilder,
                                ClaimVerificationEngine verificationEngine,
                                ControlTotalReconciler controlTotalReconciler,
                                WarrantGapDetector warrantGapDetector,
                                ReferenceTableSource referenceTableSource,
                                VerificationAuditLog auditLog,
                                DeterministicJsonWriter jsonWriter,
                                @Qualifier("ledgerWorkerPool") ExecutorService workerPool,
                                LedgerProperties properties) {
        this.documentProcessor = documentProcessor;
        this.reconciliationEngine = reconciliationEngine;
        this.aggregationIndexBuilder = aggregationIndexBuilder;
        this.verificationEngine = verificationEngine;
        this.controlTotalReconciler = controlTotalReconciler;
        this.warrantGapDetector = warrantGapDetector;
        this.referenceTableSource = referenceTableSource;
        this.auditLog = auditLog;
        this.jsonWriter = jsonWriter;
        this.workerPool = workerPool;
        this.properties = properties;
    }

    /**
     * Processes a batch end to end.
     *
     * @param submissions documents with their page text sources
     * @param claims      claims to verify, may be empty
     * @return ledger, verification report, control-total checks and the anomaly side channel
     * @throws BatchRequestValidationException when the batch is empty or ids repeat
     * @throws com.example.ledgeraudit.application.exception.ReferenceTablesMissingException when reference data is absent
     */
    public PipelineReport run(List<DocumentSubmission> submissions, List<Claim> claims) {
        validate(submissions, claims);
        ReferenceTables tables = referenceTableSource.load();
        log.info("Starting batch of {} documents and {} claims", submissions.size(), claims.size());

        List<CompletableFuture<DocumentExtraction>> futures = new ArrayList<>(submissions.size());
        for (DocumentSubmission submission : submissions) {
            futures.add(CompletableFuture.supplyAsync(() -> processWithRetry(submission, tables), workerPool));
        }

        // barrier: reconciliation needs every document
        List<DocumentExtraction> extractions = new ArrayList<>();
        List<DocumentError> errors = new ArrayList<>();
        Duration timeout = properties.pipeline().documentTimeout();
        for (int i = 0; i < submissions.size(); i++) {
            String documentId = submissions.get(i).document().documentId();
            CompletableFuture<DocumentExtraction> future = futures.get(i);
            try {
                extractions.add(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
            } catch (TimeoutException ex) {
                future.cancel(true);
                log.warn("Document {} timed out after {}", documentId, timeout);
                errors.add(new DocumentError(documentId, DocumentError.Kind.TIMEOUT, "processing exceeded " + timeout, 1));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                futures.forEach(pending -> pending.cancel(true));
                throw new IllegalStateException("Batch interrupted while waiting for " + documentId, ex);
            } catch (ExecutionException ex) {
                errors.add(toDocumentError(documentId, ex.getCause()));
            }
        }

        return assemble(extractions, errors, claims);
    }

    private PipelineReport assemble(List<DocumentExtraction> extractions, List<DocumentError> errors, List<Claim> claims) {
        List<TransactionRecord> candidates = new ArrayList<>();
        List<ParseFailure> parseFailures = new ArrayList<>();
        List<ValidationRejection> rejections = new ArrayList<>();
        List<SourceDocument> documents = new ArrayList<>();
        for (DocumentExtraction extraction : extractions) {
            candidates.addAll(extraction.records());
            parseFailures.addAll(extraction.parseFailures());
            rejections.addAll(extraction.rejections());
            documents.add(extraction.document());
        }

        ReconciliationResult reconciled = reconciliationEngine.reconcile(candidates);
        CanonicalLedger ledger = CanonicalLedger.of(reconciled.records());
        AggregationIndex index = aggregationIndexBuilder.build(ledger.records(), properties.aggregation().groupingRules());
        List<ControlTotalCheck> controlTotals = controlTotalReconciler.check(documents, ledger);
        List<WarrantNumberGap> gaps = warrantGapDetector.detect(ledger.records());

        Set<String> processed = new HashSet<>();
        documents.forEach(document -> processed.add(document.documentId()));
        VerificationReport verification = verificationEngine.verify(claims, index, ledger, processed);

        String fingerprint = RecordIdentity.sha256(jsonWriter.write(Map.of("claims", claims, "ledger", ledger)));
        String auditLogFailure = null;
        try {
            auditLog.append(fingerprint, verification.results());
        } catch (AuditLogException ex) {
            // the run itself is complete; the caller still gets the report
            log.warn("Verdicts of batch {} were not audited: {}", fingerprint.substring(0, 12), ex.getMessage(), ex);
            auditLogFailure = ex.getMessage();
        }

        AnomalyReport anomalies = new AnomalyReport(parseFailures, rejections, reconciled.ambiguities(), errors, gaps,
                auditLogFailure);
        log.info("Batch {} finished: {} records (net {} minor units), {} failed documents, {} unparsed rows, {} rejections",
                fingerprint.substring(0, 12), ledger.recordCount(), ledger.netTotalMinor(), errors.size(),
                parseFailures.size(), rejections.size());
        return new PipelineReport(fingerprint, extractions.size() + errors.size(), errors.size(), ledger, index,
                verification, controlTotals, anomalies);
    }

    /**
     * Acquisition is idempotent, so a failed read is simply repeated with exponential backoff.
     */
    DocumentExtraction processWithRetry(DocumentSubmission submission, ReferenceTables tables) {
        SourceDocument document = submission.document();
        int attempts = properties.pipeline().acquisitionAttempts();
        long backoff = properties.pipeline().retryBackoff().toMillis();
        for (int attempt = 1; ; attempt++) {
            try {
                List<RawLine> lines = documentProcessor.acquire(submission.textSource());
                return documentProcessor.process(document, lines, tables);
            } catch (AcquisitionException ex) {
                if (attempt >= attempts) {
                    throw new DocumentFailure(DocumentError.Kind.ACQUISITION, attempt, ex);
                }
                log.warn("Acquisition attempt {}/{} for {} failed: {}", attempt, attempts, document.documentId(), ex.getMessage());
                sleep(backoff * (1L << (attempt - 1)), document.documentId(), ex);
            } catch (RuntimeException ex) {
                throw new DocumentFailure(DocumentError.Kind.PROCESSING, attempt, ex);
            }
        }
    }

    private void sleep(long millis, String documentId, AcquisitionException cause) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new DocumentFailure(DocumentError.Kind.ACQUISITION, 0,
                    new AcquisitionException(documentId, "retry interrupted", cause));
        }
    }

    private DocumentError toDocumentError(String documentId, Throwable cause) {
        Throwable failure = cause instanceof CompletionException && cause.getCause() != null ? cause.getCause() : cause;
        if (failure instanceof DocumentFailure documentFailure) {
            log.warn("Document {} failed after {} attempt(s): {}", documentId, documentFailure.attempts,
                    documentFailure.getCause().getMessage());
            return new DocumentError(documentId, documentFailure.kind, documentFailure.getCause().getMessage(),
                    documentFailure.attempts);
        }
        log.warn("Document {} failed: {}", documentId, failure.getMessage(), failure);
        return new DocumentError(documentId, DocumentError.Kind.PROCESSING, String.valueOf(failure.getMessage()), 1);
    }

    private void validate(List<DocumentSubmission> submissions, List<Claim> claims) {
        if (submissions == null || submissions.isEmpty()) {
            throw new BatchRequestValidationException("A batch needs at least one document.");
        }
        Set<String> documentIds = new LinkedHashSet<>();
        for (DocumentSubmission submission : submissions) {
            if (!documentIds.add(submission.document().documentId())) {
                throw new BatchRequestValidationException("Duplicate document id: " + submission.document().documentId());
            }
        }
        Set<String> claimIds = new HashSet<>();
        for (Claim claim : claims) {
            if (!claimIds.add(claim.claimId())) {
                throw new BatchRequestValidationException("Duplicate claim id: " + claim.claimId());
            }
        }
    }

    /**
     * Carries the failure kind and attempt count out of a worker.
     */
    static final class DocumentFailure extends RuntimeException {
        private final DocumentError.Kind kind;
        private final int attempts;

        DocumentFailure(DocumentError.Kind kind, int attempts, Throwable cause) {
            super(cause.getMessage(), cause);
            this.kind = kind;
            this.attempts = attempts;
        }
    }
}
