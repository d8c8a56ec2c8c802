package com.taxledger.common;

import java.time.LocalDate;

/**
 * Calendar tax year with its inclusive boundary dates.
 */
public record TaxYear(int year, LocalDate start, LocalDate end) {

    public static final int MIN_YEAR = 1900;
    public static final int MAX_YEAR = 9999;

    /**
     * Builds the boundaries Jan 1 .. Dec 31. Rejects years that cannot form a valid boundary.
     */
    public static TaxYear of(int year) {
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new IllegalArgumentException("Tax year out of range: " + year);
        }
        return new TaxYear(year, LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
    }

    public boolean isBeforeStart(LocalDate date) {
        return date.isBefore(start);
    }

    public boolean isAfterEnd(LocalDate date) {
        return date.isAfter(end);
    }

    /** Dec 31 of the previous year; the acquisition date of synthetic start-of-year lots. */
    public LocalDate priorYearEnd() {
        return start.minusDays(1);
    }
}
