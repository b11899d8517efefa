package es.gestorfiscal.common.dto.tax;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Modelo 390 (annual VAT summary).
 *
 * Totals equal the annual 303; the breakdown splits deductible expenses by VAT rate,
 * highest rate first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Model390Summary {

    private int year;
    private Model303Summary totals;
    private List<VatRateBreakdownDto> inputVatBreakdown;
}
