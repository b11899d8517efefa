package es.gestorfiscal.common.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for date parsing and formatting.
 * Handles the formats found in Spanish invoices and spreadsheets, including Excel serial numbers.
 */
public final class DateUtils {

    private static final DateTimeFormatter ISO_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy");
    private static final Pattern DMY_PATTERN = Pattern.compile("^(\\d{1,2})[/.-](\\d{1,2})[/.-](\\d{4})$");
    private static final Pattern YMD_PATTERN = Pattern.compile("^(\\d{4})-(\\d{1,2})-(\\d{1,2})(?:T.*)?$");

    // Excel day 0; day 60 is the non-existent 1900-02-29, irrelevant for invoice dates
    private static final LocalDate EXCEL_EPOCH = LocalDate.of(1899, 12, 30);

    private DateUtils() {
        // Utility class - no instantiation
    }

    /**
     * Parse date from various formats to LocalDate.
     *
     * Supports:
     * - LocalDate / LocalDateTime instances (spreadsheet date cells)
     * - Excel serial numbers
     * - DD/MM/YYYY strings (also with '-' or '.')
     * - YYYY-MM-DD strings, optionally followed by a time
     *
     * @param dateValue Date value in any supported format
     * @return LocalDate or null if parsing fails
     */
    public static LocalDate parseDate(Object dateValue) {
        if (dateValue == null) {
            return null;
        }
        if (dateValue instanceof LocalDate localDate) {
            return localDate;
        }
        if (dateValue instanceof LocalDateTime localDateTime) {
            return localDateTime.toLocalDate();
        }
        if (dateValue instanceof Number number) {
            return parseExcelSerialDate(number.doubleValue());
        }

        String dateStr = dateValue.toString().trim();
        if (dateStr.isEmpty()) {
            return null;
        }

        try {
            return parseExcelSerialDate(Double.parseDouble(dateStr));
        } catch (NumberFormatException ignored) {
            // Not a number, try string formats
        }

        try {
            Matcher dmy = DMY_PATTERN.matcher(dateStr);
            if (dmy.matches()) {
                return LocalDate.of(
                        Integer.parseInt(dmy.group(3)),
                        Integer.parseInt(dmy.group(2)),
                        Integer.parseInt(dmy.group(1)));
            }

            Matcher ymd = YMD_PATTERN.matcher(dateStr);
            if (ymd.matches()) {
                return LocalDate.of(
                        Integer.parseInt(ymd.group(1)),
                        Integer.parseInt(ymd.group(2)),
                        Integer.parseInt(ymd.group(3)));
            }
        } catch (java.time.DateTimeException e) {
            // 31/02/2025 and similar
            return null;
        }

        try {
            return LocalDate.parse(dateStr, ISO_FORMAT);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    /**
     * Parse Excel serial date number to LocalDate.
     * Values outside 1 (1900-01-01) .. 60000 (~2064) are treated as errors.
     */
    public static LocalDate parseExcelSerialDate(double serialDate) {
        if (serialDate < 1 || serialDate > 60000) {
            return null;
        }
        return EXCEL_EPOCH.plusDays((long) Math.floor(serialDate));
    }

    /**
     * Format LocalDate to YYYY-MM-DD string (storage format).
     */
    public static String formatDate(LocalDate date) {
        return date == null ? null : date.format(ISO_FORMAT);
    }

    /**
     * Format LocalDate to DD/MM/YYYY string (report format).
     */
    public static String formatDisplayDate(LocalDate date) {
        return date == null ? "" : date.format(DISPLAY_FORMAT);
    }

    /**
     * Parse a stored YYYY-MM-DD string. Null when absent or malformed.
     */
    public static LocalDate parseIsoDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim(), ISO_FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
