package com.example.ledgeraudit.application.service;

import com.example.ledgeraudit.domain.model.AggregateBucket;
import com.example.ledgeraudit.domain.model.AggregationIndex;
import com.example.ledgeraudit.domain.model.BucketKey;
import com.example.ledgeraudit.domain.model.CanonicalLedger;
import com.example.ledgeraudit.domain.model.Claim;
import com.example.ledgeraudit.domain.model.ClaimResolutionGap;
import com.example.ledgeraudit.domain.model.ClaimSource;
import com.example.ledgeraudit.domain.model.GroupingRule;
import com.example.ledgeraudit.domain.model.PayeeName;
import com.example.ledgeraudit.domain.model.TransactionRecord;
import com.example.ledgeraudit.domain.model.Verdict;
import com.example.ledgeraudit.domain.model.VerificationReport;
import com.example.ledgeraudit.domain.model.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Resolves each claim's cited source against the aggregation index or the ledger and compares the
 * matched value with the asserted one. It never adjusts a claim; it only reports verdicts and evidence.
 */
@Service
public class ClaimVerificationEngine {

    private static final Logger log = LoggerFactory.getLogger(ClaimVerificationEngine.class);
    private static final Pattern PAYEE_YEAR_KEY = Pattern.compile("^(.+)\\|\\s*(\\d{4})$");

    /**
     * Verifies claims in input order.
     *
     * @param claims      claims to check
     * @param index       aggregation index of the run
     * @param ledger      canonical ledger of the run
     * @param documentIds documents that were successfully processed
     * @return one result per claim, same order
     */
    public VerificationReport verify(List<Claim> claims, AggregationIndex index, CanonicalLedger ledger, Set<String> documentIds) {
        Map<String, TransactionRecord> recordsById = ledger.records().stream()
                .collect(Collectors.toMap(TransactionRecord::recordId, Function.identity()));
        List<VerificationResult> results = new ArrayList<>(claims.size());
        for (Claim claim : claims) {
            VerificationResult result = verify(claim, index, ledger, recordsById, documentIds);
            log.debug("Claim {} -> {} (matched {}, delta {})", claim.claimId(), result.verdict(), result.matchedValue(), result.delta());
            results.add(result);
        }
        VerificationReport report = VerificationReport.of(results);
        log.info("Verified {} claims: {} verified, {} mismatch, {} unverifiable", report.summary().total(),
                report.summary().verified(), report.summary().mismatch(), report.summary().unverifiable());
        return report;
    }

    private VerificationResult verify(Claim claim,
                                      AggregationIndex index,
                                      CanonicalLedger ledger,
                                      Map<String, TransactionRecord> recordsById,
                                      Set<String> documentIds) {
        BigDecimal allowance = claim.tolerance().allowanceFor(claim.assertedValue());
        if (claim.source().kind() == null) {
            return VerificationResult.unverifiable(claim, allowance, null, ClaimResolutionGap.SOURCE_NOT_SPECIFIED);
        }
        Evidence evidence = switch (claim.source().kind()) {
            case BUCKET -> resolveBucket(claim.source(), index, recordsById);
            case DOCUMENT -> resolveDocument(claim.source(), ledger, documentIds);
            case RECORD -> resolveRecord(claim.source(), ledger);
        };
        if (evidence.gap() != null) {
            return VerificationResult.unverifiable(claim, allowance, evidence.pointer(), evidence.gap());
        }

        long totalMinor = evidence.records().stream().mapToLong(TransactionRecord::amountMinor).sum();
        BigDecimal matched = switch (claim.unit()) {
            case USD -> BigDecimal.valueOf(totalMinor, 2);
            case USD_MINOR -> BigDecimal.valueOf(totalMinor);
            case COUNT -> BigDecimal.valueOf(evidence.records().size());
        };
        BigDecimal delta = matched.subtract(claim.assertedValue());
        Verdict verdict = delta.abs().compareTo(allowance) <= 0 ? Verdict.VERIFIED : Verdict.MISMATCH;
        List<String> recordIds = evidence.records().stream().map(TransactionRecord::recordId).toList();
        return new VerificationResult(claim.claimId(), verdict, claim.unit(), claim.assertedValue(), matched, delta,
                allowance, recordIds, evidence.pointer(), null);
    }

    private Evidence resolveBucket(ClaimSource source, AggregationIndex index, Map<String, TransactionRecord> recordsById) {
        GroupingRule rule = source.rule();
        if (rule == null || source.key() == null) {
            return Evidence.gap(null, ClaimResolutionGap.BUCKET_NOT_FOUND);
        }
        String value = switch (rule) {
            case PAYEE -> PayeeName.normalize(source.key());
            case PAYEE_FISCAL_YEAR -> normalizePayeeYearKey(source.key());
            default -> source.key().strip();
        };
        // a payee claim narrowed to one fiscal year reads the payee-per-year bucket when it is indexed
        if (rule == GroupingRule.PAYEE && source.fiscalYear() != null && index.supports(GroupingRule.PAYEE_FISCAL_YEAR)) {
            rule = GroupingRule.PAYEE_FISCAL_YEAR;
            value = AggregationIndexBuilder.payeeFiscalYearKey(value, source.fiscalYear());
        }
        BucketKey key = new BucketKey(rule, value);
        if (!index.supports(rule)) {
            return Evidence.gap(key.toString(), ClaimResolutionGap.GROUPING_RULE_NOT_INDEXED);
        }
        Optional<AggregateBucket> bucket = index.find(key);
        if (bucket.isEmpty()) {
            return Evidence.gap(key.toString(), ClaimResolutionGap.BUCKET_NOT_FOUND);
        }
        List<TransactionRecord> records = bucket.get().recordIds().stream()
                .map(recordsById::get)
                .filter(Objects::nonNull)
                .filter(record -> source.fiscalYear() == null || record.fiscalYear() == source.fiscalYear())
                .toList();
        if (records.isEmpty()) {
            return Evidence.gap(key.toString(), ClaimResolutionGap.NO_RECORDS_FOR_SOURCE);
        }
        return Evidence.of(key.toString(), records);
    }

    private Evidence resolveDocument(ClaimSource source, CanonicalLedger ledger, Set<String> documentIds) {
        String documentId = source.documentId();
        String pointer = documentId == null || source.pageIndex() == null ? documentId : documentId + "#page=" + source.pageIndex();
        if (documentId == null || !documentIds.contains(documentId)) {
            return Evidence.gap(pointer, ClaimResolutionGap.DOCUMENT_NOT_FOUND);
        }
        List<TransactionRecord> records = ledger.records().stream()
                .filter(record -> source.pageIndex() == null
                        ? record.allDocumentIds().contains(documentId)
                        : record.sourceDocumentId().equals(documentId) && record.pageIndex() == source.pageIndex())
                .toList();
        if (records.isEmpty()) {
            return Evidence.gap(pointer, ClaimResolutionGap.NO_RECORDS_FOR_SOURCE);
        }
        return Evidence.of(pointer, records);
    }

    /**
     * A warrant may pay several fund-object lines; the claim is checked against their sum.
     */
    private Evidence resolveRecord(ClaimSource source, CanonicalLedger ledger) {
        String warrant = source.warrantNumber() == null ? null : source.warrantNumber().strip();
        List<TransactionRecord> records = ledger.records().stream()
                .filter(record -> warrant != null && warrant.equalsIgnoreCase(record.warrantOrCheckNumber()))
                .toList();
        if (records.isEmpty()) {
            return Evidence.gap(warrant, ClaimResolutionGap.RECORD_NOT_FOUND);
        }
        String pointer = records.size() == 1 ? records.get(0).recordId() : warrant;
        return Evidence.of(pointer, records);
    }

    private static String normalizePayeeYearKey(String key) {
        Matcher matcher = PAYEE_YEAR_KEY.matcher(key.strip());
        if (!matcher.matches()) {
            return PayeeName.normalize(key);
        }
        return AggregationIndexBuilder.payeeFiscalYearKey(PayeeName.normalize(matcher.group(1)), Integer.parseInt(matcher.group(2)));
    }

    private record Evidence(String pointer, List<TransactionRecord> records, ClaimResolutionGap gap) {

        static Evidence of(String pointer, List<TransactionRecord> records) {
            return new Evidence(pointer, records, null);
        }

        static Evidence gap(String pointer, ClaimResolutionGap gap) {
            return new Evidence(pointer, List.of(), gap);
        }
    }
}
