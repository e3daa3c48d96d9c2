package com.example.ledgeraudit.application.service;

import com.example.ledgeraudit.config.LedgerProperties;
import com.example.ledgeraudit.domain.model.ReconciliationAmbiguity;
import com.example.ledgeraudit.domain.model.RecordIdentity;
import com.example.ledgeraudit.domain.model.TransactionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Merges records that describe the same payment across documents.
 * Identical lines within one document are distinct payments and get occurrence ids first; exact
 * record-id matches across documents then merge unconditionally. Near matches merge only when each side is the other's
 * unique best candidate; ties are reported and left unmerged.
 */
@Service
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    /** Highest confidence first, then earliest document position. */
    static final Comparator<TransactionRecord> CANONICAL_ORDER = Comparator
            .comparing(TransactionRecord::provenanceConfidence)
            .thenComparing(TransactionRecord::sourceDocumentId)
            .thenComparingInt(TransactionRecord::pageIndex)
            .thenComparingInt(TransactionRecord::rowIndex)
            .thenComparing(TransactionRecord::recordId);

    private final int fuzzyWindowDays;

    public ReconciliationEngine(LedgerProperties properties) {
        this.fuzzyWindowDays = properties.reconciliation().fuzzyDateWindowDays();
    }

    /**
     * Deduplicates a batch.
     *
     * @param candidates validated records from every document of the batch, in any order
     * @return canonical records sorted by id, plus unresolved ties
     */
    public ReconciliationResult reconcile(List<TransactionRecord> candidates) {
        Map<String, List<TransactionRecord>> byId = new TreeMap<>();
        for (TransactionRecord record : separateRepeatedLines(candidates)) {
            byId.computeIfAbsent(record.recordId(), id -> new ArrayList<>()).add(record);
        }

        int exactMerges = 0;
        List<TransactionRecord> exact = new ArrayList<>(byId.size());
        for (List<TransactionRecord> group : byId.values()) {
            exactMerges += group.size() - 1;
            exact.add(mergeGroup(group));
        }

        FuzzyPass pass = fuzzyMerge(exact);
        List<TransactionRecord> records = pass.records.stream()
                .sorted(Comparator.comparing(TransactionRecord::recordId))
                .toList();
        log.info("Reconciled {} candidates into {} records ({} exact merges, {} fuzzy merges, {} ties)",
                candidates.size(), records.size(), exactMerges, pass.merges, pass.ambiguities.size());
        return new ReconciliationResult(records, pass.ambiguities, exactMerges, pass.merges);
    }

    /**
     * Gives the second and later copies of identical content within one document their own ids, ordered by
     * position. The n-th copy in one document still matches the n-th copy in another.
     */
    private List<TransactionRecord> separateRepeatedLines(List<TransactionRecord> candidates) {
        Map<String, List<TransactionRecord>> byDocumentAndId = new TreeMap<>();
        for (TransactionRecord record : candidates) {
            byDocumentAndId.computeIfAbsent(record.sourceDocumentId() + "|" + record.recordId(), key -> new ArrayList<>())
                    .add(record);
        }
        List<TransactionRecord> separated = new ArrayList<>(candidates.size());
        for (List<TransactionRecord> copies : byDocumentAndId.values()) {
            List<TransactionRecord> ordered = copies.stream()
                    .sorted(Comparator.comparingInt(TransactionRecord::pageIndex)
                            .thenComparingInt(TransactionRecord::rowIndex))
                    .toList();
            for (int occurrence = 0; occurrence < ordered.size(); occurrence++) {
                TransactionRecord record = ordered.get(occurrence);
                separated.add(record.withRecordId(RecordIdentity.occurrence(record.recordId(), occurrence)));
            }
            if (ordered.size() > 1) {
                log.debug("Document {} lists {} identical lines for {}; kept as separate records",
                        ordered.get(0).sourceDocumentId(), ordered.size(), ordered.get(0).recordId());
            }
        }
        return separated;
    }

    private TransactionRecord mergeGroup(List<TransactionRecord> group) {
        List<TransactionRecord> ordered = group.stream().sorted(CANONICAL_ORDER).toList();
        TransactionRecord canonical = ordered.get(0);
        if (ordered.size() == 1) {
            return canonical;
        }
        List<String> documents = ordered.stream().flatMap(record -> record.allDocumentIds().stream()).toList();
        return canonical.withProvenance(documents, List.of());
    }

    private FuzzyPass fuzzyMerge(List<TransactionRecord> records) {
        DuplicateScorer scorer = new DuplicateScorer(fuzzyWindowDays);
        Map<String, List<TransactionRecord>> byKey = new TreeMap<>();
        for (TransactionRecord record : records) {
            byKey.computeIfAbsent(record.normalizedPayee() + "|" + record.amountMinor(), key -> new ArrayList<>()).add(record);
        }

        Map<String, Set<String>> bestMatches = new HashMap<>();
        Map<String, TransactionRecord> byId = new HashMap<>();
        for (List<TransactionRecord> bucket : byKey.values()) {
            for (TransactionRecord record : bucket) {
                byId.put(record.recordId(), record);
                int best = 0;
                Set<String> bestIds = new HashSet<>();
                for (TransactionRecord other : bucket) {
                    OptionalInt score = scorer.score(record, other);
                    if (score.isEmpty()) {
                        continue;
                    }
                    if (score.getAsInt() > best) {
                        best = score.getAsInt();
                        bestIds = new HashSet<>();
                    }
                    if (score.getAsInt() == best) {
                        bestIds.add(other.recordId());
                    }
                }
                if (!bestIds.isEmpty()) {
                    bestMatches.put(record.recordId(), bestIds);
                }
            }
        }

        FuzzyPass pass = new FuzzyPass();
        Set<String> absorbed = new HashSet<>();
        for (TransactionRecord record : records) {
            Set<String> best = bestMatches.get(record.recordId());
            if (best == null || absorbed.contains(record.recordId())) {
                continue;
            }
            if (best.size() > 1) {
                pass.ambiguities.add(ambiguity(record, best, byId));
                continue;
            }
            String partnerId = best.iterator().next();
            Set<String> partnerBest = bestMatches.get(partnerId);
            if (partnerBest == null || partnerBest.size() != 1 || !partnerBest.contains(record.recordId())) {
                continue;
            }
            TransactionRecord partner = byId.get(partnerId);
            TransactionRecord canonical = Stream.of(record, partner).min(CANONICAL_ORDER).orElseThrow();
            TransactionRecord alias = canonical == record ? partner : record;
            List<String> aliases = new ArrayList<>(alias.aliasRecordIds());
            aliases.add(alias.recordId());
            pass.merged.put(canonical.recordId(), canonical.withProvenance(alias.allDocumentIds(), aliases));
            absorbed.add(record.recordId());
            absorbed.add(partnerId);
            pass.merges++;
            log.debug("Fuzzy-merged {} into {}", alias.recordId(), canonical.recordId());
        }

        for (TransactionRecord record : records) {
            TransactionRecord merged = pass.merged.get(record.recordId());
            if (merged != null) {
                pass.records.add(merged);
            } else if (!absorbed.contains(record.recordId())) {
                pass.records.add(record);
            }
        }
        pass.ambiguities.sort(Comparator.comparing(ReconciliationAmbiguity::recordId));
        return pass;
    }

    private ReconciliationAmbiguity ambiguity(TransactionRecord record, Set<String> candidates, Map<String, TransactionRecord> byId) {
        List<String> documents = new ArrayList<>(record.allDocumentIds());
        candidates.forEach(id -> documents.addAll(byId.get(id).allDocumentIds()));
        log.warn("Unresolved duplicate tie for {} ({} {}): {} equally good candidates", record.recordId(),
                record.normalizedPayee(), record.amountMinor(), candidates.size());
        return new ReconciliationAmbiguity(record.recordId(), List.copyOf(candidates), record.normalizedPayee(),
                record.amountMinor(), documents);
    }

    private static final class FuzzyPass {
        private final List<TransactionRecord> records = new ArrayList<>();
        private final Map<String, TransactionRecord> merged = new HashMap<>();
        private final List<ReconciliationAmbiguity> ambiguities = new ArrayList<>();
        private int merges;
    }
}
