package es.gestorfiscal.common.dto.tax;

import es.gestorfiscal.common.dto.record.RecordKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Modelo 347 line: yearly operations with one counterparty above the declaration threshold.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThirdPartyOperationDto {

    private String taxId;
    private String name;
    private BigDecimal total;           // sum of |totalAmount|, both kinds
    private RecordKind dominantKind;    // INCOME = client key, EXPENSE = provider key
}
