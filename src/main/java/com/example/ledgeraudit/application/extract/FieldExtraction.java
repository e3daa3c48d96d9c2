package com.example.ledgeraudit.application.extract;

import com.example.ledgeraudit.domain.model.ParseFailure;
import com.example.ledgeraudit.domain.model.ParseFlag;

import java.util.Optional;
import java.util.Set;

/**
 * Typed result of one extractor: an optional value, the confidence of the pick, the tokens it claimed,
 * and the ambiguity flags or failure it raised. Failures stay attributable to the field that produced them.
 *
 * @param value      extracted value, {@code null} when absent or failed
 * @param confidence confidence of this field in {@code [0, 1]}
 * @param consumed   indices of the tokens claimed by this field
 * @param flags      ambiguity markers
 * @param failure    hard failure, only raised by mandatory fields
 * @param <T>        value type
 */
public record FieldExtraction<T>(
        T value,
        double confidence,
        Set<Integer> consumed,
        Set<ParseFlag> flags,
        ParseFailure.Reason failure
) {

    public FieldExtraction {
        consumed = consumed == null ? Set.of() : Set.copyOf(consumed);
        flags = flags == null ? Set.of() : Set.copyOf(flags);
    }

    public static <T> FieldExtraction<T> found(T value, double confidence, Set<Integer> consumed, Set<ParseFlag> flags) {
        return new FieldExtraction<>(value, confidence, consumed, flags, null);
    }

    public static <T> FieldExtraction<T> found(T value, Set<Integer> consumed) {
        return found(value, 1.0, consumed, Set.of());
    }

    public static <T> FieldExtraction<T> absent() {
        return new FieldExtraction<>(null, 1.0, Set.of(), Set.of(), null);
    }

    public static <T> FieldExtraction<T> failed(ParseFailure.Reason reason) {
        return new FieldExtraction<>(null, 0.0, Set.of(), Set.of(), reason);
    }

    public Optional<T> optional() {
        return Optional.ofNullable(value);
    }

    public boolean failed() {
        return failure != null;
    }
}
