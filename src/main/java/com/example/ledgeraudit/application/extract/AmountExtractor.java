package com.example.ledgeraudit.application.extract;

import com.example.ledgeraudit.domain.model.ParseFailure;
import com.example.ledgeraudit.domain.model.ParseFlag;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Picks the rightmost currency-shaped token. Competing candidates with a different value in the same
 * column make the row ambiguous; candidates in other columns only lower confidence.
 */
public class AmountExtractor implements FieldExtractor<TokenShapes.CurrencyToken> {

    static final double COMPETING_COLUMN_CONFIDENCE = 0.8;

    @Override
    public FieldExtraction<TokenShapes.CurrencyToken> extract(RowContext context, Set<Integer> consumed) {
        List<Token> tokens = context.tokens();
        List<Integer> candidates = new ArrayList<>();
        for (Token token : tokens) {
            if (!consumed.contains(token.index()) && TokenShapes.isCurrency(token.text())) {
                candidates.add(token.index());
            }
        }
        if (candidates.isEmpty()) {
            return FieldExtraction.failed(ParseFailure.Reason.NO_AMOUNT);
        }

        Token chosen = tokens.get(candidates.get(candidates.size() - 1));
        TokenShapes.CurrencyToken amount = TokenShapes.currency(chosen.text()).orElseThrow();
        Set<Integer> claimed = new HashSet<>();
        claimed.add(chosen.index());

        boolean competingColumn = false;
        for (int i = 0; i < candidates.size() - 1; i++) {
            Token other = tokens.get(candidates.get(i));
            String otherPlain = TokenShapes.currency(other.text()).orElseThrow().plain();
            if (otherPlain.equals(amount.plain())) {
                // the same figure printed twice (line and check amount columns)
                claimed.add(other.index());
            } else if (context.singleColumn() || other.column() == chosen.column()) {
                return FieldExtraction.failed(ParseFailure.Reason.AMBIGUOUS_AMOUNT);
            } else {
                competingColumn = true;
            }
        }

        boolean negative = amount.negative() || dashPrecedes(tokens, chosen.index(), claimed);
        TokenShapes.CurrencyToken resolved = new TokenShapes.CurrencyToken(amount.plain(), negative);
        if (competingColumn) {
            return FieldExtraction.found(resolved, COMPETING_COLUMN_CONFIDENCE, claimed, Set.of(ParseFlag.MULTIPLE_AMOUNT_CANDIDATES));
        }
        return FieldExtraction.found(resolved, claimed);
    }

    /**
     * Summary lines print reversals as {@code $ - 1,234.56}.
     */
    private boolean dashPrecedes(List<Token> tokens, int index, Set<Integer> claimed) {
        if (index == 0) {
            return false;
        }
        Token previous = tokens.get(index - 1);
        if (previous.text().equals("-") || previous.text().equals("$-")) {
            claimed.add(previous.index());
            return true;
        }
        return false;
    }
}
