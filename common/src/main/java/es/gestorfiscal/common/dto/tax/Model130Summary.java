package es.gestorfiscal.common.dto.tax;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Modelo 130 (IRPF quarterly advance payment, direct estimation).
 *
 * netYield = income - deductible expenses
 * theoreticalQuota = max(netYield, 0) * advance rate
 * result = theoreticalQuota - withholdingSuffered
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Model130Summary {

    private BigDecimal income;
    private BigDecimal expenses;
    private BigDecimal netYield;
    private BigDecimal theoreticalQuota;
    private BigDecimal withholdingSuffered;
    private BigDecimal result;

    public static Model130Summary zero() {
        return new Model130Summary(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public Model130Summary plus(Model130Summary other) {
        return new Model130Summary(
                income.add(other.income),
                expenses.add(other.expenses),
                netYield.add(other.netYield),
                theoreticalQuota.add(other.theoreticalQuota),
                withholdingSuffered.add(other.withholdingSuffered),
                result.add(other.result));
    }
}
