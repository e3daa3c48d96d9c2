package com.example.ledgeraudit.application.extract;

import com.example.ledgeraudit.config.LedgerProperties;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Cheap line-level tests shared by the segmenter and the parser: does a line carry a record anchor
 * (amount, date, warrant number or account code), and is it register boilerplate.
 */
public class RowClassifier {

    private static final Pattern PAGE_FOOTER = Pattern.compile("(?i)\\bpage\\s+\\d+\\s+of\\s+\\d+\\b");
    private static final Pattern CANCELLATION_DETAIL = Pattern.compile("(?i)^cancell?ed\\s+on\\b.*");

    private final List<String> boilerplate;
    private final WarrantNumberExtractor warrantNumbers;
    private final Pattern accountCode;

    public RowClassifier(LedgerProperties.Parsing parsing) {
        this.boilerplate = Stream.concat(parsing.headerKeywords().stream(), parsing.footerKeywords().stream())
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .toList();
        this.warrantNumbers = new WarrantNumberExtractor(parsing.warrantNumberRegex());
        this.accountCode = parsing.accountCodeRegex();
    }

    /**
     * @param text line text
     * @return {@code true} for column headers, page footers, report banners and cancellation detail lines
     */
    public boolean isBoilerplate(String text) {
        String stripped = text.strip();
        if (PAGE_FOOTER.matcher(stripped).find() || CANCELLATION_DETAIL.matcher(stripped).matches()) {
            return true;
        }
        String lower = stripped.toLowerCase(Locale.ROOT);
        return boilerplate.stream().anyMatch(lower::contains);
    }

    public boolean hasAmountOrDate(List<String> words) {
        return words.stream().anyMatch(word -> TokenShapes.isCurrency(word) || TokenShapes.isDate(word));
    }

    public boolean hasAnchor(List<String> words) {
        if (hasAmountOrDate(words)) {
            return true;
        }
        if (words.stream().anyMatch(word -> accountCode.matcher(word).matches())) {
            return true;
        }
        return warrantNumbers.find(words, Set.of()).isPresent();
    }

    public static List<String> words(String text) {
        return Arrays.stream(text.strip().split("\\s+"))
                .map(TokenCleaner::clean)
                .filter(word -> !word.isEmpty())
                .toList();
    }
}
