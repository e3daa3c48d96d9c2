package com.example.ledgeraudit.application.extract;

import com.example.ledgeraudit.domain.model.ParseFlag;
import com.example.ledgeraudit.domain.model.PayeeName;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the payee from the leading run of unclaimed words, plus any continuation lines.
 * The run ends at the first claimed token or, when the page has columns, at a column change.
 */
public class PayeeExtractor implements FieldExtractor<String> {

    @Override
    public FieldExtraction<String> extract(RowContext context, Set<Integer> consumed) {
        List<String> words = new ArrayList<>();
        Set<Integer> claimed = new HashSet<>();
        Integer column = null;
        for (Token token : context.tokens()) {
            boolean taken = consumed.contains(token.index());
            if (!words.isEmpty() && (taken || (!context.singleColumn() && column != null && token.column() != column))) {
                break;
            }
            if (taken || !isWordy(token.text())) {
                continue;
            }
            column = token.column();
            words.add(token.text());
            claimed.add(token.index());
        }

        List<String> continuation = context.continuationTokens().stream()
                .map(Token::text)
                .filter(PayeeExtractor::isWordy)
                .toList();
        words.addAll(continuation);

        String display = PayeeName.display(String.join(" ", words));
        if (display.isEmpty()) {
            return FieldExtraction.absent();
        }
        Set<ParseFlag> flags = continuation.isEmpty() ? Set.of() : Set.of(ParseFlag.CONTINUATION_MERGED);
        return FieldExtraction.found(display, 1.0, claimed, flags);
    }

    private static boolean isWordy(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isLetterOrDigit(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
