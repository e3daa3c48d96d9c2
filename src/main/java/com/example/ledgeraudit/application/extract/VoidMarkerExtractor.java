package com.example.ledgeraudit.application.extract;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Detects cancelled or voided warrants by keyword, e.g. a {@code CANCELLED} marker in the fund-object column.
 */
public class VoidMarkerExtractor implements FieldExtractor<Boolean> {

    private final Set<String> keywords;

    public VoidMarkerExtractor(List<String> keywords) {
        this.keywords = new HashSet<>();
        keywords.forEach(keyword -> this.keywords.add(keyword.toUpperCase(Locale.ROOT)));
    }

    @Override
    public FieldExtraction<Boolean> extract(RowContext context, Set<Integer> consumed) {
        Set<Integer> claimed = new HashSet<>();
        for (Token token : context.tokens()) {
            if (consumed.contains(token.index())) {
                continue;
            }
            String word = token.upper().replaceAll("[^A-Z]", "");
            if (keywords.contains(word)) {
                claimed.add(token.index());
            }
        }
        return claimed.isEmpty() ? FieldExtraction.absent() : FieldExtraction.found(Boolean.TRUE, claimed);
    }
}
