package es.gestorfiscal.ledger.service;

import es.gestorfiscal.common.dto.record.FiscalRecordDto;
import es.gestorfiscal.common.dto.record.RecordKind;
import es.gestorfiscal.common.dto.tax.*;
import es.gestorfiscal.common.util.AmountUtils;
import es.gestorfiscal.common.util.FiscalPeriod;
import es.gestorfiscal.common.util.TaxIdValidator;
import es.gestorfiscal.ledger.repository.FiscalRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Service computing the AEAT tax model figures from the stored records.
 *
 * Business rules:
 * - The issue date decides year and quarter
 * - Income always counts; expenses count only when deductible (except in 347)
 * - Stored vatAmount, withholdingAmount and totalAmount are trusted, never recomputed
 * - Missing amounts count as zero; nothing is rounded here
 * - Yearly 303/130/111 figures are the sum of the four quarters
 *
 * ALL business logic for the tax models is here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FiscalAggregationService {

    private final FiscalRecordStore recordStore;

    @Value("${fiscal.irpf.advance-rate:0.20}")
    private BigDecimal irpfAdvanceRate = new BigDecimal("0.20");

    @Value("${fiscal.model347.threshold:3005.06}")
    private BigDecimal model347Threshold = new BigDecimal("3005.06");

    // ==================== ENTRY POINTS ====================

    /**
     * Full summary over the current content of the store.
     *
     * @param quarter 1..4, or null for the whole year
     */
    public FiscalSummaryDto summarize(int year, Integer quarter) {
        return aggregate(recordStore.listAll(), year, quarter);
    }

    /**
     * Full summary of a record set for one year (and optionally one quarter).
     * Models 390, 347 and 190 are always yearly.
     */
    public FiscalSummaryDto aggregate(List<FiscalRecordDto> records, int year, Integer quarter) {
        FiscalPeriod.requireValidQuarter(quarter);
        List<FiscalRecordDto> yearRecords = recordsOf(records, year, null);
        log.info("Aggregating {} records of {} (quarter: {})", yearRecords.size(), year,
                quarter != null ? quarter : "all");

        List<QuarterlySummaryDto> quarters = new ArrayList<>();
        for (int q = 1; q <= FiscalPeriod.QUARTERS; q++) {
            List<FiscalRecordDto> quarterRecords = recordsOf(yearRecords, year, q);
            quarters.add(QuarterlySummaryDto.builder()
                    .quarter(q)
                    .model303(compute303(quarterRecords))
                    .model130(compute130(quarterRecords))
                    .model111(compute111(quarterRecords))
                    .build());
        }

        Model303Summary annual303 = Model303Summary.zero();
        Model130Summary annual130 = Model130Summary.zero();
        Model111Summary annual111 = Model111Summary.zero();
        for (QuarterlySummaryDto q : quarters) {
            annual303 = annual303.plus(q.getModel303());
            annual130 = annual130.plus(q.getModel130());
            annual111 = annual111.plus(q.getModel111());
        }

        QuarterlySummaryDto requested = quarter != null ? quarters.get(quarter - 1) : null;

        return FiscalSummaryDto.builder()
                .year(year)
                .quarter(quarter)
                .model303(requested != null ? requested.getModel303() : annual303)
                .model130(requested != null ? requested.getModel130() : annual130)
                .model111(requested != null ? requested.getModel111() : annual111)
                .quarters(quarters)
                .model390(Model390Summary.builder()
                        .year(year)
                        .totals(annual303)
                        .inputVatBreakdown(vatBreakdown(yearRecords))
                        .build())
                .model347(thirdPartyOperations(yearRecords))
                .model190(withholdingCertificates(yearRecords))
                .build();
    }

    // ==================== SINGLE MODELS ====================

    /**
     * Modelo 303. Yearly figure (quarter null) is the sum of the quarters.
     */
    public Model303Summary model303(List<FiscalRecordDto> records, int year, Integer quarter) {
        FiscalPeriod.requireValidQuarter(quarter);
        if (quarter != null) {
            return compute303(recordsOf(records, year, quarter));
        }
        Model303Summary total = Model303Summary.zero();
        for (int q = 1; q <= FiscalPeriod.QUARTERS; q++) {
            total = total.plus(compute303(recordsOf(records, year, q)));
        }
        return total;
    }

    /**
     * Modelo 130. Yearly figure (quarter null) is the sum of the quarters, so the yearly
     * quota ignores negative quarters instead of netting them.
     */
    public Model130Summary model130(List<FiscalRecordDto> records, int year, Integer quarter) {
        FiscalPeriod.requireValidQuarter(quarter);
        if (quarter != null) {
            return compute130(recordsOf(records, year, quarter));
        }
        Model130Summary total = Model130Summary.zero();
        for (int q = 1; q <= FiscalPeriod.QUARTERS; q++) {
            total = total.plus(compute130(recordsOf(records, year, q)));
        }
        return total;
    }

    /**
     * Modelo 111. Yearly figure (quarter null) is the sum of the quarters.
     */
    public Model111Summary model111(List<FiscalRecordDto> records, int year, Integer quarter) {
        FiscalPeriod.requireValidQuarter(quarter);
        if (quarter != null) {
            return compute111(recordsOf(records, year, quarter));
        }
        Model111Summary total = Model111Summary.zero();
        for (int q = 1; q <= FiscalPeriod.QUARTERS; q++) {
            total = total.plus(compute111(recordsOf(records, year, q)));
        }
        return total;
    }

    public Model390Summary model390(List<FiscalRecordDto> records, int year) {
        return Model390Summary.builder()
                .year(year)
                .totals(model303(records, year, null))
                .inputVatBreakdown(vatBreakdown(recordsOf(records, year, null)))
                .build();
    }

    public List<ThirdPartyOperationDto> model347(List<FiscalRecordDto> records, int year) {
        return thirdPartyOperations(recordsOf(records, year, null));
    }

    public List<WithholdingCertificateDto> model190(List<FiscalRecordDto> records, int year) {
        return withholdingCertificates(recordsOf(records, year, null));
    }

    // ==================== FORMULAS ====================

    private Model303Summary compute303(List<FiscalRecordDto> records) {
        BigDecimal outputBase = BigDecimal.ZERO;
        BigDecimal outputVat = BigDecimal.ZERO;
        BigDecimal inputBase = BigDecimal.ZERO;
        BigDecimal inputVat = BigDecimal.ZERO;

        for (FiscalRecordDto record : records) {
            if (record.getKind() == RecordKind.INCOME) {
                outputBase = AmountUtils.add(outputBase, record.getTaxBase());
                outputVat = AmountUtils.add(outputVat, record.getVatAmount());
            } else if (record.isCountedExpense()) {
                inputBase = AmountUtils.add(inputBase, record.getTaxBase());
                inputVat = AmountUtils.add(inputVat, record.getVatAmount());
            }
        }

        return new Model303Summary(outputBase, outputVat, inputBase, inputVat, outputVat.subtract(inputVat));
    }

    private Model130Summary compute130(List<FiscalRecordDto> records) {
        BigDecimal income = BigDecimal.ZERO;
        BigDecimal expenses = BigDecimal.ZERO;
        BigDecimal withholdingSuffered = BigDecimal.ZERO;

        for (FiscalRecordDto record : records) {
            if (record.getKind() == RecordKind.INCOME) {
                income = AmountUtils.add(income, record.getTaxBase());
                withholdingSuffered = AmountUtils.add(withholdingSuffered, record.getWithholdingAmount());
            } else if (record.isCountedExpense()) {
                expenses = AmountUtils.add(expenses, record.getTaxBase());
            }
        }

        BigDecimal netYield = income.subtract(expenses);
        BigDecimal theoreticalQuota = netYield.max(BigDecimal.ZERO).multiply(irpfAdvanceRate);

        return new Model130Summary(income, expenses, netYield, theoreticalQuota, withholdingSuffered,
                theoreticalQuota.subtract(withholdingSuffered));
    }

    private Model111Summary compute111(List<FiscalRecordDto> records) {
        BigDecimal withheld = BigDecimal.ZERO;
        for (FiscalRecordDto record : records) {
            if (record.isCountedExpense()) {
                withheld = AmountUtils.add(withheld, record.getWithholdingAmount());
            }
        }
        return new Model111Summary(withheld);
    }

    /**
     * Deductible expenses grouped by VAT rate, highest rate first. 21 and 21.00 are one rate.
     */
    private List<VatRateBreakdownDto> vatBreakdown(List<FiscalRecordDto> yearRecords) {
        Map<BigDecimal, BigDecimal[]> byRate = new TreeMap<>(Comparator.reverseOrder());

        for (FiscalRecordDto record : yearRecords) {
            if (!record.isCountedExpense()) {
                continue;
            }
            BigDecimal rate = AmountUtils.orZero(record.getVatRate()).stripTrailingZeros();
            if (rate.scale() < 0) {
                rate = rate.setScale(0);
            }
            BigDecimal[] sums = byRate.computeIfAbsent(rate, r -> new BigDecimal[]{BigDecimal.ZERO, BigDecimal.ZERO});
            sums[0] = AmountUtils.add(sums[0], record.getTaxBase());
            sums[1] = AmountUtils.add(sums[1], record.getVatAmount());
        }

        return byRate.entrySet().stream()
                .map(e -> VatRateBreakdownDto.builder()
                        .vatRate(e.getKey())
                        .taxBase(e.getValue()[0])
                        .vatAmount(e.getValue()[1])
                        .build())
                .collect(Collectors.toList());
    }

    /**
     * Modelo 347: every record of the year, income and expense alike, grouped by counterparty.
     * Only groups strictly above the threshold are declared.
     */
    private List<ThirdPartyOperationDto> thirdPartyOperations(List<FiscalRecordDto> yearRecords) {
        Map<String, CounterpartyTotals> groups = new LinkedHashMap<>();

        for (FiscalRecordDto record : yearRecords) {
            String taxId = TaxIdValidator.normalize(record.getCounterpartyTaxId());
            CounterpartyTotals totals = groups.computeIfAbsent(taxId, CounterpartyTotals::new);
            totals.add(record);
        }

        List<ThirdPartyOperationDto> declared = groups.values().stream()
                .filter(g -> g.total().compareTo(model347Threshold) > 0)
                .map(g -> ThirdPartyOperationDto.builder()
                        .taxId(g.taxId)
                        .name(g.name)
                        .total(g.total())
                        .dominantKind(g.dominantKind())
                        .build())
                .sorted(Comparator.comparing(ThirdPartyOperationDto::getTotal).reversed()
                        .thenComparing(ThirdPartyOperationDto::getTaxId))
                .collect(Collectors.toList());

        log.debug("Modelo 347: {} counterparties, {} above {}", groups.size(), declared.size(), model347Threshold);
        return declared;
    }

    /**
     * Modelo 190: clients that withheld IRPF on our invoices.
     */
    private List<WithholdingCertificateDto> withholdingCertificates(List<FiscalRecordDto> yearRecords) {
        Map<String, CounterpartyTotals> groups = new LinkedHashMap<>();

        for (FiscalRecordDto record : yearRecords) {
            if (record.getKind() != RecordKind.INCOME || !AmountUtils.isPositive(record.getWithholdingAmount())) {
                continue;
            }
            String taxId = TaxIdValidator.normalize(record.getCounterpartyTaxId());
            groups.computeIfAbsent(taxId, CounterpartyTotals::new).add(record);
        }

        return groups.values().stream()
                .map(g -> WithholdingCertificateDto.builder()
                        .taxId(g.taxId)
                        .name(g.name)
                        .taxBase(g.taxBase)
                        .withholdingAmount(g.withholding)
                        .build())
                .sorted(Comparator.comparing(WithholdingCertificateDto::getWithholdingAmount).reversed()
                        .thenComparing(WithholdingCertificateDto::getTaxId))
                .collect(Collectors.toList());
    }

    // ==================== HELPERS ====================

    private List<FiscalRecordDto> recordsOf(List<FiscalRecordDto> records, int year, Integer quarter) {
        if (records == null) {
            return Collections.emptyList();
        }
        return records.stream()
                .filter(Objects::nonNull)
                .filter(r -> FiscalPeriod.isInPeriod(r.getIssueDate(), year, quarter))
                .collect(Collectors.toList());
    }

    /**
     * Running totals of one counterparty.
     */
    private static class CounterpartyTotals {
        private final String taxId;
        private String name;
        private RecordKind firstKind;
        private BigDecimal incomeTotal = BigDecimal.ZERO;
        private BigDecimal expenseTotal = BigDecimal.ZERO;
        private BigDecimal taxBase = BigDecimal.ZERO;
        private BigDecimal withholding = BigDecimal.ZERO;

        CounterpartyTotals(String taxId) {
            this.taxId = taxId;
        }

        void add(FiscalRecordDto record) {
            if ((name == null || name.isBlank()) && record.getCounterpartyName() != null
                    && !record.getCounterpartyName().isBlank()) {
                name = record.getCounterpartyName().trim();
            }
            if (firstKind == null) {
                firstKind = record.getKind();
            }

            BigDecimal absTotal = AmountUtils.orZero(record.getTotalAmount()).abs();
            if (record.getKind() == RecordKind.INCOME) {
                incomeTotal = incomeTotal.add(absTotal);
            } else {
                expenseTotal = expenseTotal.add(absTotal);
            }
            taxBase = AmountUtils.add(taxBase, record.getTaxBase());
            withholding = AmountUtils.add(withholding, record.getWithholdingAmount());
        }

        BigDecimal total() {
            return incomeTotal.add(expenseTotal);
        }

        // Larger volume wins; a tie keeps the kind of the first record seen
        RecordKind dominantKind() {
            int cmp = incomeTotal.compareTo(expenseTotal);
            if (cmp > 0) {
                return RecordKind.INCOME;
            }
            if (cmp < 0) {
                return RecordKind.EXPENSE;
            }
            return firstKind;
        }
    }
}
