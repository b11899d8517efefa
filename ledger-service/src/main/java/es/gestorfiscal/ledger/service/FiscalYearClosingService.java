package es.gestorfiscal.ledger.service;

import es.gestorfiscal.common.dto.closing.FiscalYearClosingDto;
import es.gestorfiscal.common.dto.record.FiscalRecordDto;
import es.gestorfiscal.common.dto.record.RecordKind;
import es.gestorfiscal.common.dto.tax.Model130Summary;
import es.gestorfiscal.common.dto.tax.Model303Summary;
import es.gestorfiscal.common.util.DocumentNumberSequencer;
import es.gestorfiscal.common.util.FiscalPeriod;
import es.gestorfiscal.ledger.repository.FiscalRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Year-end figures for the closing report.
 *
 * Closing is informational only. Nothing is locked or renumbered: the first income
 * record of the next year gets A-{yy}-1 from the regular numbering.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FiscalYearClosingService {

    private final FiscalRecordStore recordStore;
    private final FiscalAggregationService aggregationService;

    public List<Integer> availableYears() {
        return availableYears(recordStore.listAll());
    }

    public FiscalYearClosingDto closingStats(int year) {
        return closingStats(recordStore.listAll(), year);
    }

    /**
     * Distinct issue years, newest first. The current year when there are no records.
     */
    public List<Integer> availableYears(List<FiscalRecordDto> records) {
        List<Integer> years = records.stream()
                .map(FiscalRecordDto::getIssueDate)
                .filter(Objects::nonNull)
                .map(LocalDate::getYear)
                .distinct()
                .sorted(Comparator.reverseOrder())
                .collect(Collectors.toList());

        if (years.isEmpty()) {
            return List.of(LocalDate.now().getYear());
        }
        return years;
    }

    public FiscalYearClosingDto closingStats(List<FiscalRecordDto> records, int year) {
        Model303Summary vat = aggregationService.model303(records, year, null);
        Model130Summary yield = aggregationService.model130(records, year, null);

        int recordCount = (int) records.stream()
                .filter(r -> FiscalPeriod.isInYear(r.getIssueDate(), year))
                .count();

        FiscalYearClosingDto stats = FiscalYearClosingDto.builder()
                .year(year)
                .recordCount(recordCount)
                .incomeTotal(yield.getIncome())
                .deductibleExpenseTotal(yield.getExpenses())
                .netYield(yield.getNetYield())
                .vatResult(vat.getResult())
                .withholdingSuffered(yield.getWithholdingSuffered())
                .nextIncomeNumber(DocumentNumberSequencer.nextNumber(records, RecordKind.INCOME, year + 1))
                .build();

        log.info("Closing stats for {}: {} records, net yield {}", year, recordCount, stats.getNetYield());
        return stats;
    }
}
