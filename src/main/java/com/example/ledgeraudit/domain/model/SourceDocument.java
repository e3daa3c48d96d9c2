package com.example.ledgeraudit.domain.model;

import com.example.ledgeraudit.domain.exception.InvalidDocumentException;

/**
 * Descriptor of one input document of a batch.
 *
 * @param documentId          stable identifier used for provenance
 * @param fiscalYear          starting calendar year of the fiscal year the document covers
 * @param period              stated reporting period, {@code null} when it must be detected or defaulted
 * @param documentType        detailed register or vendor summary
 * @param controlTotalMinor   stated net total in minor units (cover letter), optional
 * @param controlItemCount    stated number of items, optional
 */
public record SourceDocument(
        String documentId,
        int fiscalYear,
        ReportingPeriod period,
        DocumentType documentType,
        Long controlTotalMinor,
        Integer controlItemCount
) {

    public SourceDocument {
        if (documentId == null || documentId.isBlank()) {
            throw new InvalidDocumentException(null, "document id is required");
        }
        if (fiscalYear < 1900 || fiscalYear > 2999) {
            throw new InvalidDocumentException(documentId, "fiscal year out of range: " + fiscalYear);
        }
        documentType = documentType == null ? DocumentType.DETAILED_REGISTER : documentType;
    }

    public static SourceDocument register(String documentId, int fiscalYear, ReportingPeriod period) {
        return new SourceDocument(documentId, fiscalYear, period, DocumentType.DETAILED_REGISTER, null, null);
    }

    public static SourceDocument summary(String documentId, int fiscalYear, ReportingPeriod period) {
        return new SourceDocument(documentId, fiscalYear, period, DocumentType.VENDOR_SUMMARY, null, null);
    }

    public SourceDocument withPeriod(ReportingPeriod resolved) {
        return new SourceDocument(documentId, fiscalYear, resolved, documentType, controlTotalMinor, controlItemCount);
    }

    public SourceDocument withControlTotals(Long totalMinor, Integer itemCount) {
        return new SourceDocument(documentId, fiscalYear, period, documentType, totalMinor, itemCount);
    }

    public FiscalYear fiscalYear(int startMonth) {
        return new FiscalYear(fiscalYear, startMonth);
    }
}
