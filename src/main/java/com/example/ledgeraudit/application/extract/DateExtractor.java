package com.example.ledgeraudit.application.extract;

import com.example.ledgeraudit.domain.model.ParseFlag;

import java.time.LocalDate;
import java.util.Optional;
import java.util.Set;

/**
 * Takes the leftmost date-shaped token. A second, different date on the row is flagged.
 */
public class DateExtractor implements FieldExtractor<LocalDate> {

    static final double COMPETING_DATE_CONFIDENCE = 0.85;

    @Override
    public FieldExtraction<LocalDate> extract(RowContext context, Set<Integer> consumed) {
        LocalDate chosen = null;
        int chosenIndex = -1;
        boolean competing = false;
        for (Token token : context.tokens()) {
            if (consumed.contains(token.index())) {
                continue;
            }
            Optional<LocalDate> date = TokenShapes.date(token.text());
            if (date.isEmpty()) {
                continue;
            }
            if (chosen == null) {
                chosen = date.get();
                chosenIndex = token.index();
            } else if (!chosen.equals(date.get())) {
                competing = true;
            }
        }
        if (chosen == null) {
            return FieldExtraction.absent();
        }
        if (competing) {
            return FieldExtraction.found(chosen, COMPETING_DATE_CONFIDENCE, Set.of(chosenIndex), Set.of(ParseFlag.MULTIPLE_DATE_CANDIDATES));
        }
        return FieldExtraction.found(chosen, Set.of(chosenIndex));
    }
}
