package com.example.ledgeraudit.domain.model;

import java.util.Comparator;

/**
 * Key of an aggregate bucket: grouping rule plus the group value.
 */
public record BucketKey(GroupingRule rule, String value) implements Comparable<BucketKey> {

    private static final Comparator<BucketKey> ORDER = Comparator
            .comparing(BucketKey::rule)
            .thenComparing(BucketKey::value);

    public BucketKey {
        if (rule == null || value == null) {
            throw new IllegalArgumentException("bucket rule and value are required");
        }
    }

    @Override
    public int compareTo(BucketKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return rule.name() + ":" + value;
    }
}
