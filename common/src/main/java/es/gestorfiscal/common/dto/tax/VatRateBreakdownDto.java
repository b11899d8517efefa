package es.gestorfiscal.common.dto.tax;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/** Deductible expense totals for one VAT rate. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VatRateBreakdownDto {

    private BigDecimal vatRate;
    private BigDecimal taxBase;
    private BigDecimal vatAmount;
}
