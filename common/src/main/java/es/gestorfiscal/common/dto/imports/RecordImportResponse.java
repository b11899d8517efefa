package es.gestorfiscal.common.dto.imports;

import es.gestorfiscal.common.dto.integrity.IntegrityIssue;
import es.gestorfiscal.common.dto.record.RecordKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for spreadsheet imports of fiscal records.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordImportResponse {

    private boolean dryRun;
    private RecordKind kind;
    private String message;

    private int totalRowsProcessed;
    private int importedCount;
    private int skippedCount;

    private List<ImportedRow> importedRows;
    private List<SkippedRow> skippedRows;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImportedRow {
        private int rowIndex;
        private String recordId;
        private String documentNumber;
        private String counterpartyTaxId;
        private List<IntegrityIssue> advisories;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SkippedRow {
        private int rowIndex;
        private String documentNumber;
        private String reason;
        private List<IntegrityIssue> issues;
    }
}
