package com.example.ledgeraudit.application.service;

import com.example.ledgeraudit.domain.exception.LedgerInvariantException;
import com.example.ledgeraudit.domain.model.AggregateBucket;
import com.example.ledgeraudit.domain.model.AggregationIndex;
import com.example.ledgeraudit.domain.model.BucketKey;
import com.example.ledgeraudit.domain.model.GroupingRule;
import com.example.ledgeraudit.domain.model.TransactionRecord;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Pure rollup of the canonical record set into buckets. Every call recomputes from scratch; nothing
 * is carried between runs, so identical records always yield an identical index.
 */
@Service
public class AggregationIndexBuilder {

    static final String UNCATEGORIZED = "UNCATEGORIZED";
    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM");

    /**
     * @param records canonical records
     * @param rules   grouping rules to materialize
     * @return immutable index ordered by bucket key
     */
    public AggregationIndex build(List<TransactionRecord> records, List<GroupingRule> rules) {
        Map<BucketKey, Accumulator> accumulators = new TreeMap<>();
        for (TransactionRecord record : records) {
            for (GroupingRule rule : rules) {
                BucketKey key = new BucketKey(rule, keyOf(rule, record));
                accumulators.computeIfAbsent(key, Accumulator::new).add(record);
            }
        }
        SortedMap<BucketKey, AggregateBucket> buckets = new TreeMap<>();
        accumulators.forEach((key, accumulator) -> buckets.put(key, accumulator.toBucket()));
        return new AggregationIndex(rules, buckets);
    }

    /**
     * Bucket value of a record under a rule.
     */
    public static String keyOf(GroupingRule rule, TransactionRecord record) {
        return switch (rule) {
            case PAYEE -> record.normalizedPayee();
            case PAYEE_FISCAL_YEAR -> payeeFiscalYearKey(record.normalizedPayee(), record.fiscalYear());
            case ACCOUNT_CATEGORY -> record.accountCategory() != null ? record.accountCategory() : UNCATEGORIZED;
            case FISCAL_YEAR -> String.valueOf(record.fiscalYear());
            case FISCAL_MONTH -> record.transactionDate().format(MONTH);
        };
    }

    public static String payeeFiscalYearKey(String normalizedPayee, int fiscalYear) {
        return normalizedPayee + "|" + fiscalYear;
    }

    private static final class Accumulator {
        private final BucketKey key;
        private final List<String> recordIds = new ArrayList<>();
        private long total;
        private long lowConfidenceTotal;
        private int lowConfidenceCount;
        private LocalDate minDate;
        private LocalDate maxDate;

        private Accumulator(BucketKey key) {
            this.key = key;
        }

        void add(TransactionRecord record) {
            recordIds.add(record.recordId());
            try {
                total = Math.addExact(total, record.amountMinor());
                if (record.lowConfidence()) {
                    lowConfidenceTotal = Math.addExact(lowConfidenceTotal, record.amountMinor());
                    lowConfidenceCount++;
                }
            } catch (ArithmeticException ex) {
                throw new LedgerInvariantException("Bucket " + key + " total exceeds the representable range", ex);
            }
            LocalDate date = record.transactionDate();
            if (minDate == null || date.isBefore(minDate)) {
                minDate = date;
            }
            if (maxDate == null || date.isAfter(maxDate)) {
                maxDate = date;
            }
        }

        AggregateBucket toBucket() {
            return new AggregateBucket(key, total, recordIds.size(), recordIds, minDate, maxDate,
                    lowConfidenceTotal, lowConfidenceCount);
        }
    }
}
