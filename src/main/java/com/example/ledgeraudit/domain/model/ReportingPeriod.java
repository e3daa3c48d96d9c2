package com.example.ledgeraudit.domain.model;

import java.time.LocalDate;

/**
 * Inclusive date range a source document claims to cover.
 */
public record ReportingPeriod(LocalDate start, LocalDate end) {

    public ReportingPeriod {
        if (start == null || end == null) {
            throw new IllegalArgumentException("reporting period bounds are required");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("reporting period ends before it starts: " + start + " > " + end);
        }
    }

    public static ReportingPeriod of(FiscalYear fiscalYear) {
        return new ReportingPeriod(fiscalYear.startDate(), fiscalYear.endDate());
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(start) && !date.isAfter(end);
    }
}
