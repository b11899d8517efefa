package es.gestorfiscal.common.util;

import es.gestorfiscal.common.dto.taxid.TaxIdType;
import es.gestorfiscal.common.dto.taxid.TaxIdValidationResult;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Utility class for Spanish tax identifier validation.
 *
 * Spanish formats:
 * - DNI/NIF: 8 digits + check letter (natural persons)
 * - NIE: X/Y/Z + 7 digits + check letter (foreign residents)
 * - CIF: organisation letter + 7 digits + control character (companies)
 *
 * DNI and NIE check letters use the mod-23 table. The CIF control character is
 * only checked for shape; its arithmetic is not validated.
 */
public final class TaxIdValidator {

    public static final String CHECK_LETTERS = "TRWAGMYFPDXBNJZSQVHLCKE";

    private static final Pattern DNI_PATTERN = Pattern.compile("^[0-9]{8}[A-Z]$");
    private static final Pattern NIE_PATTERN = Pattern.compile("^[XYZ][0-9]{7}[A-Z]$");
    private static final Pattern CIF_PATTERN = Pattern.compile("^[ABCDEFGHJKLMNPQRSUVW][0-9]{7}[0-9A-J]$");

    private TaxIdValidator() {
        // Utility class - no instantiation
    }

    /**
     * Classify and check a tax identifier.
     *
     * @param identifier raw identifier as typed or extracted
     * @return VALID, INVALID_CHECKSUM (with the expected letter) or UNRECOGNIZED_FORMAT
     */
    public static TaxIdValidationResult validate(String identifier) {
        String value = normalize(identifier);

        if (DNI_PATTERN.matcher(value).matches()) {
            long number = Long.parseLong(value.substring(0, 8));
            return checkLetter(value, TaxIdType.DNI, number, value.charAt(8));
        }

        if (NIE_PATTERN.matcher(value).matches()) {
            long number = Long.parseLong(niePrefixDigit(value.charAt(0)) + value.substring(1, 8));
            return checkLetter(value, TaxIdType.NIE, number, value.charAt(8));
        }

        if (CIF_PATTERN.matcher(value).matches()) {
            return TaxIdValidationResult.valid(value, TaxIdType.CIF);
        }

        return TaxIdValidationResult.unrecognized(value);
    }

    public static boolean isValid(String identifier) {
        return validate(identifier).isValid();
    }

    /**
     * Trim and upper-case. Null becomes empty.
     */
    public static String normalize(String identifier) {
        if (identifier == null) {
            return "";
        }
        return identifier.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Check letter required by a DNI number (or an NIE after prefix substitution).
     */
    public static char expectedLetter(long number) {
        return CHECK_LETTERS.charAt((int) (number % 23));
    }

    private static TaxIdValidationResult checkLetter(String value, TaxIdType type, long number, char actual) {
        char expected = expectedLetter(number);
        if (actual != expected) {
            return TaxIdValidationResult.invalidChecksum(value, type, expected);
        }
        return TaxIdValidationResult.valid(value, type);
    }

    // X -> 0, Y -> 1, Z -> 2
    private static String niePrefixDigit(char prefix) {
        return String.valueOf(prefix - 'X');
    }
}
