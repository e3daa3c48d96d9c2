package com.example.ledgeraudit.domain.model;

import com.example.ledgeraudit.domain.exception.LedgerInvariantException;

import java.time.LocalDate;
import java.util.List;

/**
 * Rollup over the records sharing one bucket key. Low-confidence records are part of {@code totalMinor}
 * and are also reported separately so every aggregate stays auditable.
 *
 * @param key                    bucket key
 * @param totalMinor             sum of contributing amounts in cents
 * @param recordCount            number of contributing records
 * @param recordIds              contributing record ids, sorted
 * @param minDate                earliest transaction date
 * @param maxDate                latest transaction date
 * @param lowConfidenceTotalMinor sum of the low-confidence contributors
 * @param lowConfidenceCount     number of low-confidence contributors
 */
public record AggregateBucket(
        BucketKey key,
        long totalMinor,
        int recordCount,
        List<String> recordIds,
        LocalDate minDate,
        LocalDate maxDate,
        long lowConfidenceTotalMinor,
        int lowConfidenceCount
) {

    public AggregateBucket {
        recordIds = recordIds.stream().sorted().toList();
        if (recordCount != recordIds.size() || lowConfidenceCount > recordCount) {
            throw new LedgerInvariantException("Bucket " + key + " counts " + recordCount + " records but lists "
                    + recordIds.size());
        }
    }
}
