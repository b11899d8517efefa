package es.gestorfiscal.common.util;

import es.gestorfiscal.common.dto.record.FiscalRecordDto;
import es.gestorfiscal.common.dto.record.RecordKind;

import java.util.Collection;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for sequential document numbers.
 *
 * The number format is: {prefix}-{yy}-{n}
 * - prefix: A for income, R for expense
 * - yy: two-digit year of the issue date
 * - n: positive integer, no padding
 *
 * The next number is a projection of the current record set: nothing is reserved,
 * and a new year starts at 1 without any explicit close.
 */
public final class DocumentNumberSequencer {

    private static final String DELIMITER = "-";

    private DocumentNumberSequencer() {
        // Utility class - no instantiation
    }

    /**
     * Next unused number for a kind and year.
     *
     * @param existing snapshot of stored records (any kind, any year)
     * @param kind     document kind
     * @param year     four-digit fiscal year
     * @return e.g. A-25-7 when A-25-6 is the highest income number of 2025
     */
    public static String nextNumber(Collection<FiscalRecordDto> existing, RecordKind kind, int year) {
        Pattern pattern = patternFor(kind, year);
        long max = 0;

        if (existing != null) {
            for (FiscalRecordDto record : existing) {
                if (record == null || record.getKind() != kind || record.getDocumentNumber() == null) {
                    continue;
                }
                OptionalLong sequence = match(pattern, record.getDocumentNumber());
                if (sequence.isPresent() && sequence.getAsLong() > max) {
                    max = sequence.getAsLong();
                }
            }
        }

        return format(kind, year, max + 1);
    }

    /**
     * Build a number in the A-25-1 format.
     */
    public static String format(RecordKind kind, int year, long sequence) {
        return String.join(DELIMITER, kind.getNumberPrefix(), yearSuffix(year), String.valueOf(sequence));
    }

    /**
     * Extract n from a number of the given kind and year.
     * Empty when the number does not follow the pattern exactly.
     */
    public static OptionalLong parseSequence(RecordKind kind, int year, String documentNumber) {
        if (documentNumber == null) {
            return OptionalLong.empty();
        }
        return match(patternFor(kind, year), documentNumber);
    }

    /**
     * Two-digit year: 2025 -> "25", 2007 -> "07".
     */
    public static String yearSuffix(int year) {
        return String.format("%02d", Math.floorMod(year, 100));
    }

    private static Pattern patternFor(RecordKind kind, int year) {
        return Pattern.compile("^" + kind.getNumberPrefix() + DELIMITER + yearSuffix(year) + DELIMITER + "(\\d+)$");
    }

    private static OptionalLong match(Pattern pattern, String documentNumber) {
        Matcher matcher = pattern.matcher(documentNumber);
        if (!matcher.matches()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(matcher.group(1)));
        } catch (NumberFormatException e) {
            // more digits than a long holds
            return OptionalLong.empty();
        }
    }
}
