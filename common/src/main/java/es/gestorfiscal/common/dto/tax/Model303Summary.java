package es.gestorfiscal.common.dto.tax;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Modelo 303 (periodic VAT return).
 *
 * result = outputVat - inputVat
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Model303Summary {

    private BigDecimal outputBase;  // base of income records
    private BigDecimal outputVat;   // IVA devengado
    private BigDecimal inputBase;   // base of deductible expenses
    private BigDecimal inputVat;    // IVA soportado
    private BigDecimal result;

    public static Model303Summary zero() {
        return new Model303Summary(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public Model303Summary plus(Model303Summary other) {
        return new Model303Summary(
                outputBase.add(other.outputBase),
                outputVat.add(other.outputVat),
                inputBase.add(other.inputBase),
                inputVat.add(other.inputVat),
                result.add(other.result));
    }
}
