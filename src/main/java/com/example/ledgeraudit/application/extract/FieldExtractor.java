package com.example.ledgeraudit.application.extract;

import java.util.Set;

/**
 * One field-extraction strategy. Strategies run in a fixed order; each sees which tokens the earlier
 * ones already claimed and must not claim them again.
 *
 * @param <T> extracted value type
 */
@FunctionalInterface
public interface FieldExtractor<T> {

    FieldExtraction<T> extract(RowContext context, Set<Integer> consumed);
}
