package es.gestorfiscal.common.util;

import es.gestorfiscal.common.exception.ValidationException;

import java.time.LocalDate;

/**
 * Calendar quarters of a fiscal year. The issue date decides the period.
 *
 * Q1: January-March, Q2: April-June, Q3: July-September, Q4: October-December.
 */
public final class FiscalPeriod {

    public static final int QUARTERS = 4;

    private FiscalPeriod() {
        // Utility class - no instantiation
    }

    public static int quarterOf(LocalDate date) {
        return (date.getMonthValue() - 1) / 3 + 1;
    }

    public static boolean isInYear(LocalDate date, int year) {
        return date != null && date.getYear() == year;
    }

    /**
     * @param quarter 1..4, or null for the whole year
     */
    public static boolean isInPeriod(LocalDate date, int year, Integer quarter) {
        if (!isInYear(date, year)) {
            return false;
        }
        return quarter == null || quarterOf(date) == quarter;
    }

    /**
     * Reject quarters outside 1..4. Null (whole year) is accepted.
     */
    public static Integer requireValidQuarter(Integer quarter) {
        if (quarter != null && (quarter < 1 || quarter > QUARTERS)) {
            throw new ValidationException("quarter", "Quarter must be between 1 and 4, got " + quarter);
        }
        return quarter;
    }
}
