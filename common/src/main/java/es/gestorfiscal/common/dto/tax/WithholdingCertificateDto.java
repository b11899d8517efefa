package es.gestorfiscal.common.dto.tax;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Modelo 190 line: a client that withheld IRPF on our invoices during the year.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WithholdingCertificateDto {

    private String taxId;
    private String name;
    private BigDecimal taxBase;
    private BigDecimal withholdingAmount;
}
