package com.example.ledgeraudit.application.extract;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the warrant or check number. OCR often splits electronic payment numbers ({@code DDP - 00000046})
 * or drops their zero padding ({@code DDP-46}); both are repaired before matching.
 */
public class WarrantNumberExtractor implements FieldExtractor<String> {

    private static final Pattern DDP = Pattern.compile("^DDP-?(\\d{1,8})$");
    private static final int MAX_JOINED_TOKENS = 3;

    private final Pattern pattern;

    public WarrantNumberExtractor(Pattern pattern) {
        this.pattern = pattern;
    }

    /**
     * Located warrant number.
     *
     * @param number normalized number
     * @param first  index of the first token
     * @param count  number of joined tokens
     */
    public record Match(String number, int first, int count) {
    }

    @Override
    public FieldExtraction<String> extract(RowContext context, Set<Integer> consumed) {
        List<String> words = context.tokens().stream().map(Token::text).toList();
        return find(words, consumed)
                .map(match -> {
                    Set<Integer> claimed = new HashSet<>();
                    for (int i = match.first(); i < match.first() + match.count(); i++) {
                        claimed.add(i);
                    }
                    return FieldExtraction.found(match.number(), claimed);
                })
                .orElseGet(FieldExtraction::absent);
    }

    public Optional<Match> find(List<String> words, Set<Integer> consumed) {
        for (int first = 0; first < words.size(); first++) {
            StringBuilder joined = new StringBuilder();
            for (int count = 1; count <= MAX_JOINED_TOKENS && first + count <= words.size(); count++) {
                int index = first + count - 1;
                if (consumed.contains(index)) {
                    break;
                }
                joined.append(words.get(index));
                String candidate = normalize(joined.toString());
                if (pattern.matcher(candidate).matches()) {
                    return Optional.of(new Match(candidate, first, count));
                }
            }
        }
        return Optional.empty();
    }

    static String normalize(String raw) {
        String upper = raw.toUpperCase(Locale.ROOT);
        Matcher ddp = DDP.matcher(upper);
        if (ddp.matches()) {
            return "DDP-" + "0".repeat(8 - ddp.group(1).length()) + ddp.group(1);
        }
        return upper;
    }
}
