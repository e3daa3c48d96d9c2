package com.example.ledgeraudit.application.extract;

import com.example.ledgeraudit.domain.model.ParseFlag;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Finds the fund-object account code. Codes missing from the reference table are kept and flagged.
 */
public class AccountCodeExtractor implements FieldExtractor<String> {

    private final Pattern pattern;

    public AccountCodeExtractor(Pattern pattern) {
        this.pattern = pattern;
    }

    @Override
    public FieldExtraction<String> extract(RowContext context, Set<Integer> consumed) {
        for (Token token : context.tokens()) {
            if (consumed.contains(token.index()) || !pattern.matcher(token.text()).matches()) {
                continue;
            }
            String code = token.text();
            if (context.referenceTables().knowsAccountCode(code)) {
                return FieldExtraction.found(code, Set.of(token.index()));
            }
            return FieldExtraction.found(code, 1.0, Set.of(token.index()), Set.of(ParseFlag.UNKNOWN_ACCOUNT_CODE));
        }
        return FieldExtraction.absent();
    }
}
