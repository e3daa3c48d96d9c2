package com.example.ledgeraudit.domain.model;

import java.time.LocalDate;

/**
 * Twelve-month accounting window of the issuing institution, July 1 to June 30 by default.
 *
 * @param startYear  calendar year in which the fiscal year starts
 * @param startMonth first month of the fiscal year (1-12)
 */
public record FiscalYear(int startYear, int startMonth) implements Comparable<FiscalYear> {

    public static final int DEFAULT_START_MONTH = 7;

    public FiscalYear {
        if (startMonth < 1 || startMonth > 12) {
            throw new IllegalArgumentException("startMonth must be between 1 and 12: " + startMonth);
        }
    }

    public static FiscalYear of(int startYear) {
        return new FiscalYear(startYear, DEFAULT_START_MONTH);
    }

    public static FiscalYear containing(LocalDate date, int startMonth) {
        int year = date.getMonthValue() >= startMonth ? date.getYear() : date.getYear() - 1;
        return new FiscalYear(year, startMonth);
    }

    public LocalDate startDate() {
        return LocalDate.of(startYear, startMonth, 1);
    }

    public LocalDate endDate() {
        return startDate().plusYears(1).minusDays(1);
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(startDate()) && !date.isAfter(endDate());
    }

    /**
     * @return label such as {@code FY2025-26}
     */
    public String label() {
        if (startMonth == 1) {
            return "FY" + startYear;
        }
        return String.format("FY%d-%02d", startYear, (startYear + 1) % 100);
    }

    @Override
    public int compareTo(FiscalYear other) {
        return startDate().compareTo(other.startDate());
    }
}
