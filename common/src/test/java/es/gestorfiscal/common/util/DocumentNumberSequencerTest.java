package es.gestorfiscal.common.util;

import es.gestorfiscal.common.dto.record.FiscalRecordDto;
import es.gestorfiscal.common.dto.record.RecordKind;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class DocumentNumberSequencerTest {

    private static FiscalRecordDto record(RecordKind kind, String number) {
        return FiscalRecordDto.builder()
                .kind(kind)
                .documentNumber(number)
                .issueDate(LocalDate.of(2025, 1, 1))
                .build();
    }

    @Test
    void nextNumber_ShouldStartAtOneWhenEmpty() {
        assertEquals("A-25-1", DocumentNumberSequencer.nextNumber(List.of(), RecordKind.INCOME, 2025));
        assertEquals("R-25-1", DocumentNumberSequencer.nextNumber(null, RecordKind.EXPENSE, 2025));
    }

    @Test
    void nextNumber_ShouldUseHighestSequenceNotCount() {
        List<FiscalRecordDto> records = List.of(
                record(RecordKind.INCOME, "A-25-1"),
                record(RecordKind.INCOME, "A-25-7"),
                record(RecordKind.INCOME, "A-25-3"));

        assertEquals("A-25-8", DocumentNumberSequencer.nextNumber(records, RecordKind.INCOME, 2025));
    }

    @Test
    void nextNumber_ShouldIsolateKindsAndYears() {
        List<FiscalRecordDto> records = List.of(
                record(RecordKind.INCOME, "A-25-4"),
                record(RecordKind.INCOME, "A-24-90"),
                record(RecordKind.EXPENSE, "R-25-20"),
                record(RecordKind.EXPENSE, "A-25-50")); // wrong prefix for an expense

        assertEquals("A-25-5", DocumentNumberSequencer.nextNumber(records, RecordKind.INCOME, 2025));
        assertEquals("R-25-21", DocumentNumberSequencer.nextNumber(records, RecordKind.EXPENSE, 2025));
        assertEquals("A-26-1", DocumentNumberSequencer.nextNumber(records, RecordKind.INCOME, 2026));
    }

    @Test
    void nextNumber_ShouldIgnoreNumbersOutsideThePattern() {
        List<FiscalRecordDto> records = List.of(
                record(RecordKind.INCOME, "A-25-3"),
                record(RecordKind.INCOME, "A-25-9-bis"),
                record(RecordKind.INCOME, "XA-25-40"),
                record(RecordKind.INCOME, "IMP-1700000000000-2"),
                record(RecordKind.INCOME, null));

        assertEquals("A-25-4", DocumentNumberSequencer.nextNumber(records, RecordKind.INCOME, 2025));
    }

    @Test
    void nextNumber_ShouldBeIdempotentAndMonotonic() {
        List<FiscalRecordDto> records = new ArrayList<>(List.of(record(RecordKind.INCOME, "A-25-2")));

        String first = DocumentNumberSequencer.nextNumber(records, RecordKind.INCOME, 2025);
        String second = DocumentNumberSequencer.nextNumber(records, RecordKind.INCOME, 2025);
        assertEquals(first, second);

        records.add(record(RecordKind.INCOME, first));
        String third = DocumentNumberSequencer.nextNumber(records, RecordKind.INCOME, 2025);

        assertEquals("A-25-3", first);
        assertEquals("A-25-4", third);
    }

    @Test
    void parseSequence_ShouldMatchExactPatternOnly() {
        assertEquals(OptionalLong.of(12), DocumentNumberSequencer.parseSequence(RecordKind.INCOME, 2025, "A-25-12"));
        assertTrue(DocumentNumberSequencer.parseSequence(RecordKind.INCOME, 2024, "A-25-12").isEmpty());
        assertTrue(DocumentNumberSequencer.parseSequence(RecordKind.EXPENSE, 2025, "A-25-12").isEmpty());
        assertTrue(DocumentNumberSequencer.parseSequence(RecordKind.INCOME, 2025, null).isEmpty());
    }

    @Test
    void yearSuffix_ShouldPadToTwoDigits() {
        assertEquals("25", DocumentNumberSequencer.yearSuffix(2025));
        assertEquals("07", DocumentNumberSequencer.yearSuffix(2007));
        assertEquals("00", DocumentNumberSequencer.yearSuffix(2100));
        assertEquals("R-07-3", DocumentNumberSequencer.format(RecordKind.EXPENSE, 2007, 3));
    }
}
