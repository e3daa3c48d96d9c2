package com.example.ledgeraudit.interfaces.api.dto;

import com.example.ledgeraudit.application.exception.BatchRequestValidationException;
import com.example.ledgeraudit.application.port.DocumentSubmission;
import com.example.ledgeraudit.application.port.PageTextSource;
import com.example.ledgeraudit.config.LedgerProperties;
import com.example.ledgeraudit.domain.model.BoundingBox;
import com.example.ledgeraudit.domain.model.Claim;
import com.example.ledgeraudit.domain.model.ClaimSource;
import com.example.ledgeraudit.domain.model.DocumentType;
import com.example.ledgeraudit.domain.model.FiscalYear;
import com.example.ledgeraudit.domain.model.RawLine;
import com.example.ledgeraudit.domain.model.ReportingPeriod;
import com.example.ledgeraudit.domain.model.SourceDocument;
import com.example.ledgeraudit.domain.model.Tolerance;
import com.example.ledgeraudit.infrastructure.ocr.OcrJsonPageTextSource;
import com.example.ledgeraudit.infrastructure.text.InMemoryPageTextSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Converts request DTOs into batch submissions and domain claims.
 * Structural problems become {@link BatchRequestValidationException}; domain invariants are left to the domain types.
 */
@Component
public class BatchRequestMapper {

    private final ObjectMapper objectMapper;
    private final int fiscalYearStartMonth;
    private final Path ocrBaseDir;

    public BatchRequestMapper(ObjectMapper objectMapper, LedgerProperties properties) {
        this.objectMapper = objectMapper;
        this.fiscalYearStartMonth = properties.reference().fiscalYearStartMonth();
        this.ocrBaseDir = properties.ocr().baseDirectory();
    }

    public List<DocumentSubmission> toSubmissions(BatchRequest request) {
        if (request == null || request.documents() == null || request.documents().isEmpty()) {
            throw new BatchRequestValidationException("A batch needs at least one document.");
        }
        List<DocumentSubmission> submissions = new ArrayList<>();
        for (DocumentRequest document : request.documents()) {
            SourceDocument descriptor = toDocument(document);
            submissions.add(new DocumentSubmission(descriptor, toTextSource(descriptor.documentId(), document)));
        }
        return submissions;
    }

    public List<Claim> toClaims(BatchRequest request) {
        if (request == null || request.claims() == null) {
            return List.of();
        }
        return request.claims().stream().map(this::toClaim).toList();
    }

    /**
     * Builds a descriptor from loose metadata, e.g. multipart form fields accompanying a PDF upload.
     */
    public SourceDocument toDocument(String documentId, Integer fiscalYear, String documentType,
                                     LocalDate periodStart, LocalDate periodEnd) {
        DocumentType type = null;
        if (documentType != null && !documentType.isBlank()) {
            try {
                type = DocumentType.valueOf(documentType.strip().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new BatchRequestValidationException("Unknown document type: " + documentType);
            }
        }
        return toDocument(new DocumentRequest(documentId, fiscalYear, type, periodStart, periodEnd, null, null, null, null));
    }

    private SourceDocument toDocument(DocumentRequest request) {
        if (request == null || request.documentId() == null || request.documentId().isBlank()) {
            throw new BatchRequestValidationException("Every document needs a document_id.");
        }
        ReportingPeriod period = null;
        if (request.periodStart() != null || request.periodEnd() != null) {
            if (request.periodStart() == null || request.periodEnd() == null || request.periodEnd().isBefore(request.periodStart())) {
                throw new BatchRequestValidationException("Document " + request.documentId()
                        + " needs both period_start and period_end, in order.");
            }
            period = new ReportingPeriod(request.periodStart(), request.periodEnd());
        }
        Integer fiscalYear = request.fiscalYear();
        if (fiscalYear == null) {
            if (period == null) {
                throw new BatchRequestValidationException("Document " + request.documentId()
                        + " needs a fiscal_year or a reporting period.");
            }
            fiscalYear = FiscalYear.containing(period.start(), fiscalYearStartMonth).startYear();
        }
        Long controlTotalMinor = null;
        if (request.controlTotal() != null) {
            try {
                controlTotalMinor = request.controlTotal().movePointRight(2).longValueExact();
            } catch (ArithmeticException ex) {
                throw new BatchRequestValidationException("Document " + request.documentId()
                        + " has a control_total with fractional cents: " + request.controlTotal().toPlainString());
            }
        }
        return new SourceDocument(request.documentId().strip(), fiscalYear, period, request.documentType(),
                controlTotalMinor, request.controlItemCount());
    }

    private PageTextSource toTextSource(String documentId, DocumentRequest request) {
        if (request.lines() != null && !request.lines().isEmpty()) {
            List<RawLine> lines = new ArrayList<>();
            int position = 0;
            for (RawLineRequest line : request.lines()) {
                BoundingBox box = new BoundingBox(line.x(), line.y(),
                        line.width() != null ? line.width() : 0f,
                        line.height() != null ? line.height() : 0f);
                int lineIndex = line.line() != null ? line.line() : position;
                lines.add(new RawLine(line.page(), lineIndex, line.text(), box,
                        line.confidence() != null ? line.confidence() : 1.0));
                position++;
            }
            return new InMemoryPageTextSource(lines);
        }
        if (request.ocrPath() != null && !request.ocrPath().isBlank()) {
            return new OcrJsonPageTextSource(documentId, resolveOcrPath(documentId, request.ocrPath()), objectMapper);
        }
        throw new BatchRequestValidationException("Document " + documentId + " has neither lines nor an ocr_path.");
    }

    /**
     * Relative paths resolve against the OCR base directory; the result must stay inside it.
     */
    private Path resolveOcrPath(String documentId, String ocrPath) {
        Path resolved;
        try {
            resolved = ocrBaseDir.resolve(ocrPath.strip()).toAbsolutePath().normalize();
        } catch (InvalidPathException ex) {
            throw new BatchRequestValidationException("Document " + documentId + " has an invalid ocr_path.");
        }
        if (!resolved.startsWith(ocrBaseDir)) {
            throw new BatchRequestValidationException("Document " + documentId + " has an ocr_path outside the OCR directory.");
        }
        return resolved;
    }

    private Claim toClaim(ClaimRequest request) {
        if (request == null || request.claimId() == null || request.claimId().isBlank()) {
            throw new BatchRequestValidationException("Every claim needs a claim_id.");
        }
        // missing source fields are left for verification to report as unverifiable
        ClaimSource source;
        if (request.sourceKind() == null) {
            source = ClaimSource.unspecified();
        } else {
            source = switch (request.sourceKind()) {
                case BUCKET -> ClaimSource.bucket(request.rule(), blankToNull(request.key()), request.fiscalYear());
                case DOCUMENT -> ClaimSource.document(blankToNull(request.documentId()), request.pageIndex());
                case RECORD -> ClaimSource.record(blankToNull(request.warrantNumber()));
            };
        }
        Tolerance tolerance = null;
        if (request.tolerance() != null) {
            if (request.tolerance().signum() < 0) {
                throw new BatchRequestValidationException("Claim " + request.claimId() + " has a negative tolerance.");
            }
            tolerance = new Tolerance(request.toleranceKind(), request.tolerance());
        }
        return new Claim(request.claimId(), request.assertionText(), request.assertedValue(), request.unit(), source, tolerance);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
