package es.gestorfiscal.common.dto.closing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Year-end figures shown before generating the closing report.
 *
 * Closing a year changes nothing: numbering restarts by itself at A-{yy+1}-1.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FiscalYearClosingDto {

    private int year;
    private int recordCount;
    private BigDecimal incomeTotal;
    private BigDecimal deductibleExpenseTotal;
    private BigDecimal netYield;
    private BigDecimal vatResult;
    private BigDecimal withholdingSuffered;
    private String nextIncomeNumber;
}
