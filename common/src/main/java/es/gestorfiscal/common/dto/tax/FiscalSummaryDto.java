package es.gestorfiscal.common.dto.tax;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result of aggregating the record set of one fiscal year.
 *
 * model303/model130/model111 belong to the requested quarter, or to the whole year
 * when quarter is null. The yearly figures are always the sum of the four quarters.
 * Models 390, 347 and 190 are yearly only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FiscalSummaryDto {

    private int year;
    private Integer quarter;

    private Model303Summary model303;
    private Model130Summary model130;
    private Model111Summary model111;

    private List<QuarterlySummaryDto> quarters;

    private Model390Summary model390;
    private List<ThirdPartyOperationDto> model347;
    private List<WithholdingCertificateDto> model190;
}
