package com.example.ledgeraudit.domain.model;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable, ordered map of bucket key to aggregate. Built fresh for every run.
 */
public record AggregationIndex(List<GroupingRule> rules, SortedMap<BucketKey, AggregateBucket> buckets) {

    public AggregationIndex {
        rules = List.copyOf(rules);
        buckets = Collections.unmodifiableSortedMap(new TreeMap<>(buckets));
    }

    public Optional<AggregateBucket> find(BucketKey key) {
        return Optional.ofNullable(buckets.get(key));
    }

    public boolean supports(GroupingRule rule) {
        return rules.contains(rule);
    }

    public List<AggregateBucket> bucketsFor(GroupingRule rule) {
        return buckets.values().stream()
                .filter(bucket -> bucket.key().rule() == rule)
                .toList();
    }
}
