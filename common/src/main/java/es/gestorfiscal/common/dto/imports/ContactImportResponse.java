package es.gestorfiscal.common.dto.imports;

import es.gestorfiscal.common.dto.contact.ContactType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for spreadsheet imports of contacts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContactImportResponse {

    private boolean dryRun;
    private String message;

    private int totalRowsProcessed;
    private int importedCount;
    private int skippedCount;

    private List<ImportedContact> importedRows;
    private List<SkippedContact> skippedRows;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImportedContact {
        private int rowIndex;
        /** Id given (or, on a dry run, that would be given) to the contact. */
        private String internalId;
        private ContactType type;
        private String name;
        private String taxId;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SkippedContact {
        private int rowIndex;
        private String name;
        private String taxId;
        private String reason;
    }
}
