package com.example.ledgeraudit.domain.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Payee string normalization shared by the ledger and by claim resolution.
 */
public final class PayeeName {

    private static final Set<String> CORPORATE_SUFFIXES = Set.of(
            "INC", "INCORPORATED", "LLC", "CORP", "CORPORATION", "PBC", "LP", "LLP", "HOLDINGS", "CO", "LTD", "COMPANY");

    private PayeeName() {
    }

    /**
     * Collapses whitespace while keeping the printed spelling.
     *
     * @param raw payee text as read
     * @return display form, empty when the input is blank
     */
    public static String display(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.strip().replaceAll("\\s+", " ");
    }

    /**
     * Builds the matching key: upper case, apostrophes and periods removed, other punctuation folded to
     * spaces, trailing corporate suffixes stripped. {@code "Zum Services, Inc."} and {@code "ZUM SERVICES INC"}
     * both normalize to {@code "ZUM SERVICES"}.
     *
     * @param raw payee text as read
     * @return normalized key, empty when nothing alphanumeric remains
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String folded = raw.toUpperCase(Locale.ROOT)
                .replace("&", " AND ")
                .replaceAll("['’.]", "")
                .replaceAll("[^A-Z0-9]+", " ")
                .strip();
        if (folded.isEmpty()) {
            return "";
        }
        List<String> words = new ArrayList<>(Arrays.asList(folded.split(" ")));
        while (words.size() > 1 && CORPORATE_SUFFIXES.contains(words.get(words.size() - 1))) {
            words.remove(words.size() - 1);
        }
        return String.join(" ", words);
    }
}
