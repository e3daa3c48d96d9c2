package com.example.ledgeraudit.application.extract;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shape tests for amount and date tokens.
 */
public final class TokenShapes {

    /** Digits with optional thousands separators and exactly two decimals, optionally parenthesized or signed. */
    private static final Pattern CURRENCY = Pattern.compile(
            "^(\\()?(-)?\\$?(-)?((?:\\d{1,3}(?:,\\d{3})+)|\\d+)\\.(\\d{2})(\\))?(-)?$");
    /** {@code MM/DD/YYYY}, {@code M/D/YY} and {@code MM-DD-YYYY}. */
    private static final Pattern US_DATE = Pattern.compile("^(\\d{1,2})([/-])(\\d{1,2})\\2(\\d{4}|\\d{2})$");
    private static final Pattern ISO_DATE = Pattern.compile("^(\\d{4})-(\\d{2})-(\\d{2})$");

    private TokenShapes() {
    }

    /**
     * Parsed currency token.
     *
     * @param plain    unsigned value with two decimals and no separators, e.g. {@code 1234.56}
     * @param negative {@code true} for parenthesized, leading-minus or trailing-minus forms
     */
    public record CurrencyToken(String plain, boolean negative) {

        public String signed() {
            return negative ? "-" + plain : plain;
        }

        public long minorUnits() {
            return new BigDecimal(signed()).movePointRight(2).longValueExact();
        }
    }

    public static Optional<CurrencyToken> currency(String text) {
        Matcher matcher = CURRENCY.matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        boolean open = matcher.group(1) != null;
        boolean close = matcher.group(6) != null;
        if (open != close) {
            return Optional.empty();
        }
        boolean negative = open || matcher.group(2) != null || matcher.group(3) != null || matcher.group(7) != null;
        String plain = matcher.group(4).replace(",", "") + "." + matcher.group(5);
        return Optional.of(new CurrencyToken(plain, negative));
    }

    public static boolean isCurrency(String text) {
        return currency(text).isPresent();
    }

    public static Optional<LocalDate> date(String text) {
        Matcher iso = ISO_DATE.matcher(text);
        if (iso.matches()) {
            return toDate(Integer.parseInt(iso.group(1)), Integer.parseInt(iso.group(2)), Integer.parseInt(iso.group(3)));
        }
        Matcher us = US_DATE.matcher(text);
        if (!us.matches()) {
            return Optional.empty();
        }
        // two-digit years are 20xx
        int year = us.group(4).length() == 2 ? 2000 + Integer.parseInt(us.group(4)) : Integer.parseInt(us.group(4));
        if (us.group(2).equals("-") && us.group(4).length() == 2) {
            return Optional.empty();
        }
        return toDate(year, Integer.parseInt(us.group(1)), Integer.parseInt(us.group(3)));
    }

    private static Optional<LocalDate> toDate(int year, int month, int day) {
        if (year < 1900 || month < 1 || month > 12 || day < 1) {
            return Optional.empty();
        }
        if (day > YearMonth.of(year, month).lengthOfMonth()) {
            return Optional.empty();
        }
        return Optional.of(LocalDate.of(year, month, day));
    }

    public static boolean isDate(String text) {
        return date(text).isPresent();
    }

    public static boolean hasDigit(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isDigit(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
