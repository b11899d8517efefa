package es.gestorfiscal.ledger.service;

import es.gestorfiscal.common.dto.closing.FiscalYearClosingDto;
import es.gestorfiscal.common.dto.record.FiscalRecordDto;
import es.gestorfiscal.common.dto.record.RecordKind;
import es.gestorfiscal.ledger.repository.FiscalRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FiscalYearClosingServiceTest {

    @Mock
    private FiscalRecordStore recordStore;

    private FiscalYearClosingService service;

    @BeforeEach
    void setUp() {
        service = new FiscalYearClosingService(recordStore, new FiscalAggregationService(recordStore));
    }

    private static FiscalRecordDto record(RecordKind kind, String number, LocalDate date, String base, String vat,
                                          String withholding) {
        return FiscalRecordDto.builder()
                .kind(kind)
                .documentNumber(number)
                .issueDate(date)
                .taxBase(new BigDecimal(base))
                .vatAmount(new BigDecimal(vat))
                .withholdingAmount(new BigDecimal(withholding))
                .deductible(kind == RecordKind.EXPENSE ? Boolean.TRUE : null)
                .build();
    }

    @Test
    void closingStats_ShouldSummarizeYear() {
        // Arrange
        when(recordStore.listAll()).thenReturn(List.of(
                record(RecordKind.INCOME, "A-25-1", LocalDate.of(2025, 2, 1), "1000", "210", "150"),
                record(RecordKind.INCOME, "A-25-2", LocalDate.of(2025, 11, 1), "500", "105", "75"),
                record(RecordKind.EXPENSE, "R-25-1", LocalDate.of(2025, 6, 1), "300", "63", "0"),
                record(RecordKind.INCOME, "A-24-9", LocalDate.of(2024, 12, 1), "9000", "1890", "0")));

        // Act
        FiscalYearClosingDto stats = service.closingStats(2025);

        // Assert
        assertEquals(2025, stats.getYear());
        assertEquals(3, stats.getRecordCount());
        assertEquals(0, new BigDecimal("1500").compareTo(stats.getIncomeTotal()));
        assertEquals(0, new BigDecimal("300").compareTo(stats.getDeductibleExpenseTotal()));
        assertEquals(0, new BigDecimal("1200").compareTo(stats.getNetYield()));
        assertEquals(0, new BigDecimal("252").compareTo(stats.getVatResult()));
        assertEquals(0, new BigDecimal("225").compareTo(stats.getWithholdingSuffered()));
        assertEquals("A-26-1", stats.getNextIncomeNumber());
    }

    @Test
    void availableYears_ShouldListDistinctYearsNewestFirst() {
        List<FiscalRecordDto> records = List.of(
                record(RecordKind.INCOME, "A-23-1", LocalDate.of(2023, 1, 1), "1", "0", "0"),
                record(RecordKind.INCOME, "A-25-1", LocalDate.of(2025, 1, 1), "1", "0", "0"),
                record(RecordKind.EXPENSE, "R-25-1", LocalDate.of(2025, 3, 1), "1", "0", "0"));

        assertEquals(List.of(2025, 2023), service.availableYears(records));
        assertEquals(List.of(LocalDate.now().getYear()), service.availableYears(List.of()));
    }
}
