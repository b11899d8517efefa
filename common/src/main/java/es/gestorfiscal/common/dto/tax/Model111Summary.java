package es.gestorfiscal.common.dto.tax;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Modelo 111 (withholdings remitted on received invoices).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Model111Summary {

    private BigDecimal withheldAmount;

    public static Model111Summary zero() {
        return new Model111Summary(BigDecimal.ZERO);
    }

    public Model111Summary plus(Model111Summary other) {
        return new Model111Summary(withheldAmount.add(other.withheldAmount));
    }
}
