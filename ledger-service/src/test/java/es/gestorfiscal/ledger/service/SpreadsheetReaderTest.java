package es.gestorfiscal.ledger.service;

import es.gestorfiscal.common.exception.GestorFiscalException;
import es.gestorfiscal.common.exception.ValidationException;
import es.gestorfiscal.ledger.service.SpreadsheetReader.SheetRow;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.util.unit.DataSize;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SpreadsheetReaderTest {

    private static final Map<String, String> HEADERS = SpreadsheetReader.headerIndex(Map.of(
            "name", List.of("Nombre", "Razón Social"),
            "taxId", List.of("NIF", "CIF"),
            "amount", List.of("Importe")));

    private final SpreadsheetReader reader = new SpreadsheetReader();

    private static MockMultipartFile csv(String content) {
        return new MockMultipartFile("file", "datos.csv", "text/csv", content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void read_ShouldMapCommaSeparatedCsvByAlias() {
        List<SheetRow> rows = reader.read(csv("razon social,cif,Otra\nEmpresa SL,B12345678,x\n"), HEADERS);

        assertEquals(1, rows.size());
        assertEquals(2, rows.get(0).getRowIndex());
        assertEquals("Empresa SL", rows.get(0).text("name"));
        assertEquals("B12345678", rows.get(0).text("taxId"));
        assertNull(rows.get(0).value("amount"));
        assertEquals(2, rows.get(0).getValues().size());
    }

    @Test
    void read_ShouldTolerateShortCsvRows() {
        List<SheetRow> rows = reader.read(csv("Nombre;NIF;Importe\nAna;12345678Z\n"), HEADERS);

        assertEquals(1, rows.size());
        assertEquals("Ana", rows.get(0).text("name"));
        assertNull(rows.get(0).text("amount"));
    }

    @Test
    void read_ShouldRejectOversizedFiles() {
        ReflectionTestUtils.setField(reader, "maxFileSize", DataSize.ofBytes(10));

        assertThrows(ValidationException.class,
                () -> reader.read(csv("Nombre;NIF\nAna;12345678Z\n"), HEADERS));
    }

    @Test
    void detectDelimiter_ShouldFollowTheHeaderLine() {
        assertEquals(';', SpreadsheetReader.detectDelimiter("Nombre;Importe\n1,5;2,5"));
        assertEquals(',', SpreadsheetReader.detectDelimiter("Nombre,Importe\n1;2"));
        assertEquals(',', SpreadsheetReader.detectDelimiter("Nombre"));
    }

    @Test
    void normalizeHeader_ShouldIgnoreCaseAccentsAndSpaces() {
        assertEquals("base imponible", SpreadsheetReader.normalizeHeader("  BASE   Imponible "));
        assertEquals("retencion %", SpreadsheetReader.normalizeHeader("Retención %"));
    }

    @Test
    void headerIndex_ShouldRejectAliasUsedTwice() {
        Map<String, List<String>> aliases = Map.of(
                "name", List.of("Nombre"),
                "companyName", List.of("nombre"));

        assertThrows(GestorFiscalException.class, () -> SpreadsheetReader.headerIndex(aliases));
    }

    @Test
    void text_ShouldPrintIntegralNumbersWithoutDecimals() {
        SheetRow row = new SheetRow(2, Map.of("taxId", 12345678.0, "amount", 12.5));

        assertEquals("12345678", row.text("taxId"));
        assertEquals("12.5", row.text("amount"));
    }
}
