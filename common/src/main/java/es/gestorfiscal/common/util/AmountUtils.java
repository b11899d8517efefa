package es.gestorfiscal.common.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for monetary amounts.
 *
 * Aggregation helpers never round: rounding to cents is a presentation concern
 * (see {@link #formatCurrency(BigDecimal)}).
 */
public final class AmountUtils {

    private static final Pattern NUMERIC_PATTERN = Pattern.compile("-?\\d+(?:\\.\\d+)?");
    private static final Locale SPAIN = new Locale("es", "ES");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private AmountUtils() {
        // Utility class - no instantiation
    }

    /**
     * Null-safe value: missing amounts count as zero.
     */
    public static BigDecimal orZero(BigDecimal amount) {
        return amount == null ? BigDecimal.ZERO : amount;
    }

    /**
     * Null-safe addition without rounding.
     */
    public static BigDecimal add(BigDecimal left, BigDecimal right) {
        return orZero(left).add(orZero(right));
    }

    /**
     * amount * rate / 100, exact.
     */
    public static BigDecimal percentOf(BigDecimal amount, BigDecimal rate) {
        return orZero(amount).multiply(orZero(rate)).divide(HUNDRED);
    }

    /**
     * Convert a stored value (Firestore number or string) to BigDecimal.
     * NaN, infinite and unparseable values become zero so one bad document
     * cannot break a whole report.
     */
    public static BigDecimal toDecimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : BigDecimal.ZERO;
        }
        if (value instanceof Number number) {
            return BigDecimal.valueOf(number.longValue());
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    /**
     * Parse an amount typed by a person or read from a spreadsheet.
     *
     * Handles:
     * - Spanish format (1.234,56) and English format (1,234.56)
     * - Comma as the only separator (10,50)
     * - Currency symbols and whitespace
     *
     * @param value Value to parse
     * @return BigDecimal amount or null when no number is present
     */
    public static BigDecimal parseAmount(Object value) {
        if (value == null) {
            return null;
        }

        if (value instanceof Number) {
            return toDecimal(value);
        }

        String stringValue = value.toString()
                .replaceAll("[\\s\\u00A0\\u202F\\u2009€]+", "")
                .trim();

        int lastComma = stringValue.lastIndexOf(',');
        int lastDot = stringValue.lastIndexOf('.');
        if (lastComma >= 0 && lastDot >= 0) {
            // whichever separator comes last is the decimal one
            if (lastComma > lastDot) {
                stringValue = stringValue.replace(".", "").replace(",", ".");
            } else {
                stringValue = stringValue.replace(",", "");
            }
        } else if (lastComma >= 0) {
            stringValue = stringValue.replace(",", ".");
        }

        Matcher matcher = NUMERIC_PATTERN.matcher(stringValue);
        if (!matcher.find()) {
            return null;
        }

        try {
            return new BigDecimal(matcher.group());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Round amount to 2 decimal places.
     */
    public static BigDecimal round(BigDecimal amount) {
        if (amount == null) {
            return BigDecimal.ZERO.setScale(2);
        }
        return amount.setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Format for reports: two decimals, Spanish separators, euro sign (1.234,56 €).
     */
    public static String formatCurrency(BigDecimal amount) {
        DecimalFormat format = new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(SPAIN));
        format.setRoundingMode(RoundingMode.HALF_UP);
        return format.format(round(amount)) + " €";
    }

    /**
     * Check if amount is positive (greater than zero).
     */
    public static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.compareTo(BigDecimal.ZERO) > 0;
    }
}
