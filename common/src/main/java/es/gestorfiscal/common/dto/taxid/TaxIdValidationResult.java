package es.gestorfiscal.common.dto.taxid;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of classifying and checking a Spanish tax identifier.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaxIdValidationResult {

    private String value;             // normalized (trimmed, upper-cased)
    private TaxIdType type;
    private TaxIdStatus status;
    private Character expectedLetter; // only for INVALID_CHECKSUM

    public static TaxIdValidationResult valid(String value, TaxIdType type) {
        return new TaxIdValidationResult(value, type, TaxIdStatus.VALID, null);
    }

    public static TaxIdValidationResult invalidChecksum(String value, TaxIdType type, char expectedLetter) {
        return new TaxIdValidationResult(value, type, TaxIdStatus.INVALID_CHECKSUM, expectedLetter);
    }

    public static TaxIdValidationResult unrecognized(String value) {
        return new TaxIdValidationResult(value, TaxIdType.UNKNOWN, TaxIdStatus.UNRECOGNIZED_FORMAT, null);
    }

    @JsonIgnore
    public boolean isValid() {
        return status == TaxIdStatus.VALID;
    }

    /**
     * Human-readable description of the problem, or null when valid.
     */
    public String describeProblem() {
        return switch (status) {
            case VALID -> null;
            case INVALID_CHECKSUM -> String.format("%s incorrecto: la letra debería ser %s", type, expectedLetter);
            case UNRECOGNIZED_FORMAT -> "Formato español inválido. Esperado: DNI, CIF o NIE";
        };
    }
}
