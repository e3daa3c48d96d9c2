package com.example.ledgeraudit.domain.model;

import java.time.LocalDate;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Canonical ledger entry for one payment.
 *
 * @param recordId                 content-derived identifier, see {@link RecordIdentity}
 * @param sourceDocumentId         document that supplied the canonical copy
 * @param corroboratingDocumentIds other documents that described the same payment, sorted
 * @param aliasRecordIds           record ids of fuzzy-merged duplicates, sorted
 * @param fiscalYear               starting calendar year of the fiscal year
 * @param transactionDate          payment date
 * @param datePrecision            how the date was obtained
 * @param payeeName                payee as printed, whitespace collapsed
 * @param normalizedPayee          matching key, see {@link PayeeName#normalize(String)}
 * @param amountMinor              signed amount in cents, negative for voids and reversals
 * @param voided                   {@code true} for cancelled warrants
 * @param warrantOrCheckNumber     warrant or check number, {@code null} for summary-only sources
 * @param accountCode              fund-object code, {@code null} when absent
 * @param accountCodeKnown         {@code true} when the code exists in the reference table
 * @param accountCategory          object-code category name, {@code null} when unresolved
 * @param provenanceConfidence     confidence class derived from OCR and parser ambiguity
 * @param parseFlags               parser ambiguity markers, sorted
 * @param pageIndex                page of the canonical copy
 * @param rowIndex                 row of the canonical copy within its page
 * @param rawText                  row text as read, for triage
 */
public record TransactionRecord(
        String recordId,
        String sourceDocumentId,
        List<String> corroboratingDocumentIds,
        List<String> aliasRecordIds,
        int fiscalYear,
        LocalDate transactionDate,
        DatePrecision datePrecision,
        String payeeName,
        String normalizedPayee,
        long amountMinor,
        boolean voided,
        String warrantOrCheckNumber,
        String accountCode,
        boolean accountCodeKnown,
        String accountCategory,
        ProvenanceConfidence provenanceConfidence,
        List<ParseFlag> parseFlags,
        int pageIndex,
        int rowIndex,
        String rawText
) {

    public TransactionRecord {
        corroboratingDocumentIds = sortedDistinct(corroboratingDocumentIds);
        aliasRecordIds = sortedDistinct(aliasRecordIds);
        parseFlags = parseFlags == null ? List.of() : parseFlags.stream().distinct().sorted().toList();
    }

    public boolean lowConfidence() {
        return provenanceConfidence == ProvenanceConfidence.LOW;
    }

    /**
     * @return every document id that contributed to this record, canonical source first
     */
    public List<String> allDocumentIds() {
        TreeSet<String> others = new TreeSet<>(corroboratingDocumentIds);
        others.remove(sourceDocumentId);
        return Stream.concat(Stream.of(sourceDocumentId), others.stream()).toList();
    }

    /**
     * Returns a copy carrying additional corroborating provenance.
     */
    public TransactionRecord withProvenance(List<String> documentIds, List<String> aliases) {
        TreeSet<String> documents = new TreeSet<>(corroboratingDocumentIds);
        documents.addAll(documentIds);
        documents.remove(sourceDocumentId);
        TreeSet<String> mergedAliases = new TreeSet<>(aliasRecordIds);
        mergedAliases.addAll(aliases);
        mergedAliases.remove(recordId);
        return new TransactionRecord(recordId, sourceDocumentId, List.copyOf(documents), List.copyOf(mergedAliases),
                fiscalYear, transactionDate, datePrecision, payeeName, normalizedPayee, amountMinor, voided,
                warrantOrCheckNumber, accountCode, accountCodeKnown, accountCategory, provenanceConfidence,
                parseFlags, pageIndex, rowIndex, rawText);
    }

    public TransactionRecord withRecordId(String id) {
        return new TransactionRecord(id, sourceDocumentId, corroboratingDocumentIds, aliasRecordIds, fiscalYear,
                transactionDate, datePrecision, payeeName, normalizedPayee, amountMinor, voided, warrantOrCheckNumber,
                accountCode, accountCodeKnown, accountCategory, provenanceConfidence, parseFlags, pageIndex, rowIndex,
                rawText);
    }

    private static List<String> sortedDistinct(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return List.copyOf(new TreeSet<>(values));
    }
}
