package es.gestorfiscal.ledger.service;

import es.gestorfiscal.common.dto.imports.RecordImportResponse;
import es.gestorfiscal.common.dto.imports.RecordImportResponse.ImportedRow;
import es.gestorfiscal.common.dto.imports.RecordImportResponse.SkippedRow;
import es.gestorfiscal.common.dto.integrity.IntegrityReport;
import es.gestorfiscal.common.dto.record.FiscalRecordDto;
import es.gestorfiscal.common.dto.record.RecordKind;
import es.gestorfiscal.common.exception.IntegrityViolationException;
import es.gestorfiscal.common.exception.ValidationException;
import es.gestorfiscal.common.util.AmountUtils;
import es.gestorfiscal.common.util.DateUtils;
import es.gestorfiscal.ledger.repository.FiscalRecordStore;
import es.gestorfiscal.ledger.service.SpreadsheetReader.SheetRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.*;

/**
 * Service for bulk import of fiscal records from Excel or CSV files.
 *
 * Files are read by {@link SpreadsheetReader}; headers are matched against {@link #COLUMN_ALIASES}.
 *
 * Defaults for empty cells:
 * - documentNumber: IMP-{import timestamp}-{row}
 * - counterpartyName: "Desconocido", concept: "Importado"
 * - vatRate: 21, withholdingRate: 0
 * - vatAmount, withholdingAmount, totalAmount: derived from base and rates
 * - income: incomeTaxCategory "Prestación de servicios"
 * - expense: expenseIrpfCategory "Otros servicios exteriores",
 *   expenseVatCategory "Operaciones Interiores Corrientes", deductible false
 *
 * Rows go through the same integrity checks as manual entries. Importing is an explicit
 * user action, so advisories are accepted and reported; rows with blocking issues are skipped.
 *
 * ALL business logic for spreadsheet import is here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecordImportService {

    public static final Map<String, List<String>> COLUMN_ALIASES = Map.ofEntries(
            Map.entry("documentNumber", List.of("Número", "Nº Factura", "Número Factura", "Número Interno", "Ref", "Referencia")),
            Map.entry("issueDate", List.of("Fecha", "Fecha Factura", "Fecha Emisión", "Emisión", "Date")),
            Map.entry("counterpartyTaxId", List.of("NIF", "CIF", "DNI", "NIE", "NIF/CIF", "Identificación")),
            Map.entry("counterpartyName", List.of("Nombre", "Razón Social", "Cliente", "Proveedor", "Entidad")),
            Map.entry("counterpartyAddress", List.of("Domicilio", "Domicilio Fiscal", "Dirección")),
            Map.entry("concept", List.of("Concepto", "Descripción")),
            Map.entry("category", List.of("Categoría")),
            Map.entry("taxBase", List.of("Base", "Base Imponible", "Imponible", "Subtotal")),
            Map.entry("vatRate", List.of("IVA %", "% IVA", "Tipo IVA")),
            Map.entry("vatAmount", List.of("Cuota IVA", "Importe IVA")),
            Map.entry("withholdingRate", List.of("IRPF %", "% IRPF", "Retención %")),
            Map.entry("withholdingAmount", List.of("Cuota IRPF", "Importe IRPF", "Retención")),
            Map.entry("totalAmount", List.of("Total", "Importe Total")),
            Map.entry("supplies", List.of("Suplidos")),
            Map.entry("retainer", List.of("Provisión de Fondos", "Provisión")),
            Map.entry("incomeTaxCategory", List.of("Tipo de Ingreso", "Tipo Ingreso")),
            Map.entry("supplierInvoiceNumber", List.of("Nº Factura Proveedor", "Ref Proveedor", "Supplier Num")),
            Map.entry("registrationDate", List.of("Fecha Registro", "Registro")),
            Map.entry("expenseIrpfCategory", List.of("Tipo Gasto IRPF", "Tipo IRPF")),
            Map.entry("expenseVatCategory", List.of("Tipo Gasto IVA", "Tipo IVA Gasto")),
            Map.entry("deductible", List.of("Deducible", "Gasto Deducible"))
    );

    static final BigDecimal DEFAULT_VAT_RATE = BigDecimal.valueOf(21);
    static final String DEFAULT_COUNTERPARTY_NAME = "Desconocido";
    static final String DEFAULT_CONCEPT = "Importado";
    static final String DEFAULT_INCOME_TAX_CATEGORY = "Prestación de servicios";
    static final String DEFAULT_EXPENSE_IRPF_CATEGORY = "Otros servicios exteriores";
    static final String DEFAULT_EXPENSE_VAT_CATEGORY = "Operaciones Interiores Corrientes";

    private static final Map<String, String> HEADER_TO_FIELD = SpreadsheetReader.headerIndex(COLUMN_ALIASES);
    private static final Set<String> TRUE_VALUES = Set.of("SI", "SÍ", "YES", "TRUE", "1", "X");

    private final FiscalRecordStore recordStore;
    private final FiscalRecordService fiscalRecordService;
    private final SpreadsheetReader spreadsheetReader;

    /**
     * Import records from an Excel (.xlsx, .xls) or CSV file.
     *
     * @param dryRun true to only report what would be imported
     */
    public RecordImportResponse importFile(MultipartFile file, RecordKind kind, boolean dryRun) {
        if (kind == null) {
            throw new ValidationException("kind", "Record kind is required (INCOME or EXPENSE)");
        }
        List<SheetRow> rows = spreadsheetReader.read(file, HEADER_TO_FIELD);

        log.info("Record import started - kind: {}, file: {}, rows: {}, dryRun: {}",
                kind, file.getOriginalFilename(), rows.size(), dryRun);

        RecordImportResponse response = processRows(rows, kind, dryRun);

        log.info("Record import finished - processed: {}, imported: {}, skipped: {}",
                response.getTotalRowsProcessed(), response.getImportedCount(), response.getSkippedCount());
        return response;
    }

    // ==================== ROW PROCESSING ====================

    private RecordImportResponse processRows(List<SheetRow> rows, RecordKind kind, boolean dryRun) {
        String importStamp = String.valueOf(System.currentTimeMillis());
        List<FiscalRecordDto> snapshot = new ArrayList<>(recordStore.listAll());
        List<ImportedRow> imported = new ArrayList<>();
        List<SkippedRow> skipped = new ArrayList<>();

        for (SheetRow row : rows) {
            int rowIndex = row.getRowIndex();

            FiscalRecordDto draft = fiscalRecordService.deriveAmounts(mapRow(row, kind, importStamp));
            IntegrityReport report = fiscalRecordService.check(draft, false, snapshot);

            if (report.isBlocked()) {
                log.warn("Row {} skipped: {} blocking issue(s)", rowIndex, report.getBlocking().size());
                skipped.add(SkippedRow.builder()
                        .rowIndex(rowIndex)
                        .documentNumber(draft.getDocumentNumber())
                        .reason("Blocking integrity issues")
                        .issues(report.getBlocking())
                        .build());
                continue;
            }

            String recordId = null;
            if (dryRun) {
                snapshot.add(draft);
            } else {
                try {
                    FiscalRecordDto saved = fiscalRecordService.create(draft, true, snapshot);
                    snapshot.add(saved);
                    recordId = saved.getId();
                } catch (IntegrityViolationException e) {
                    skipped.add(SkippedRow.builder()
                            .rowIndex(rowIndex)
                            .documentNumber(draft.getDocumentNumber())
                            .reason(e.getMessage())
                            .issues(e.getReport().getBlocking())
                            .build());
                    continue;
                }
            }

            imported.add(ImportedRow.builder()
                    .rowIndex(rowIndex)
                    .recordId(recordId)
                    .documentNumber(draft.getDocumentNumber())
                    .counterpartyTaxId(draft.getCounterpartyTaxId())
                    .advisories(report.getAdvisory())
                    .build());
        }

        return RecordImportResponse.builder()
                .dryRun(dryRun)
                .kind(kind)
                .message(String.format("%s %d records, skipped %d",
                        dryRun ? "Would import" : "Imported", imported.size(), skipped.size()))
                .totalRowsProcessed(rows.size())
                .importedCount(imported.size())
                .skippedCount(skipped.size())
                .importedRows(imported)
                .skippedRows(skipped)
                .build();
    }

    private FiscalRecordDto mapRow(SheetRow row, RecordKind kind, String importStamp) {
        FiscalRecordDto.FiscalRecordDtoBuilder builder = FiscalRecordDto.builder()
                .kind(kind)
                .documentNumber(orDefault(row.text("documentNumber"), "IMP-" + importStamp + "-" + row.getRowIndex()))
                .issueDate(date(row, "issueDate"))
                .counterpartyTaxId(row.text("counterpartyTaxId"))
                .counterpartyName(orDefault(row.text("counterpartyName"), DEFAULT_COUNTERPARTY_NAME))
                .counterpartyAddress(row.text("counterpartyAddress"))
                .concept(orDefault(row.text("concept"), DEFAULT_CONCEPT))
                .category(row.text("category"))
                .taxBase(amount(row, "taxBase"))
                .vatRate(Optional.ofNullable(amount(row, "vatRate")).orElse(DEFAULT_VAT_RATE))
                .vatAmount(amount(row, "vatAmount"))
                .withholdingRate(Optional.ofNullable(amount(row, "withholdingRate")).orElse(BigDecimal.ZERO))
                .withholdingAmount(amount(row, "withholdingAmount"))
                .totalAmount(amount(row, "totalAmount"));

        if (kind == RecordKind.INCOME) {
            builder.supplies(amount(row, "supplies"))
                    .retainer(amount(row, "retainer"))
                    .incomeTaxCategory(orDefault(row.text("incomeTaxCategory"), DEFAULT_INCOME_TAX_CATEGORY));
        } else {
            builder.supplierInvoiceNumber(row.text("supplierInvoiceNumber"))
                    .registrationDate(date(row, "registrationDate"))
                    .expenseIrpfCategory(orDefault(row.text("expenseIrpfCategory"), DEFAULT_EXPENSE_IRPF_CATEGORY))
                    .expenseVatCategory(orDefault(row.text("expenseVatCategory"), DEFAULT_EXPENSE_VAT_CATEGORY))
                    .deductible(parseBoolean(row.value("deductible")));
        }

        return builder.build();
    }

    // ==================== HELPERS ====================

    private BigDecimal amount(SheetRow row, String field) {
        return AmountUtils.parseAmount(row.value(field));
    }

    private LocalDate date(SheetRow row, String field) {
        return DateUtils.parseDate(row.value(field));
    }

    static Boolean parseBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() == 1;
        }
        if (value == null) {
            return Boolean.FALSE;
        }
        return TRUE_VALUES.contains(value.toString().trim().toUpperCase(Locale.ROOT));
    }

    private static String orDefault(String value, String fallback) {
        return value == null ? fallback : value;
    }
}
