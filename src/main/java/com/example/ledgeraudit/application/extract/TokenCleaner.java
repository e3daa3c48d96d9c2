package com.example.ledgeraudit.application.extract;

import java.util.regex.Pattern;

/**
 * Removes scanner artifacts from OCR words: zebra-stripe glyphs picked up at the start of a cell,
 * and stray braces and tildes.
 */
public final class TokenCleaner {

    private static final Pattern LEADING_STRIPE = Pattern.compile("^[=:+~}{|]+");
    private static final Pattern DIGIT_THEN_STRIPE = Pattern.compile("^\\d[=:+~}{|]+");
    private static final Pattern STRAY_GLYPHS = Pattern.compile("[{}~]");
    private static final Pattern NOISE_ONLY = Pattern.compile("^[=:+~}{|_\\-.,'\"`]*$");

    private TokenCleaner() {
    }

    /**
     * @param word raw word
     * @return cleaned word, empty when nothing meaningful remains
     */
    public static String clean(String word) {
        if (word == null) {
            return "";
        }
        String cleaned = word.strip();
        cleaned = DIGIT_THEN_STRIPE.matcher(cleaned).replaceFirst("");
        cleaned = LEADING_STRIPE.matcher(cleaned).replaceFirst("");
        cleaned = STRAY_GLYPHS.matcher(cleaned).replaceAll("");
        // a lone dash is kept: it can mark a negative summary amount or join a split warrant number
        if (cleaned.equals("-")) {
            return cleaned;
        }
        return NOISE_ONLY.matcher(cleaned).matches() ? "" : cleaned;
    }

    /**
     * @return {@code true} when the whole line is table-stripe noise
     */
    public static boolean isNoiseLine(String text) {
        if (text == null || text.isBlank()) {
            return true;
        }
        for (String word : text.strip().split("\\s+")) {
            String cleaned = clean(word);
            if (!cleaned.isEmpty() && !cleaned.equals("-")) {
                return false;
            }
        }
        return true;
    }
}
