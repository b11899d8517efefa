package es.gestorfiscal.ledger.controller;

import es.gestorfiscal.common.dto.ApiResponse;
import es.gestorfiscal.common.dto.imports.RecordImportResponse;
import es.gestorfiscal.common.dto.integrity.IntegrityReport;
import es.gestorfiscal.common.dto.record.BulkDeleteRequest;
import es.gestorfiscal.common.dto.record.FiscalRecordDto;
import es.gestorfiscal.common.dto.record.RecordKind;
import es.gestorfiscal.ledger.service.DocumentNumberService;
import es.gestorfiscal.ledger.service.FiscalRecordService;
import es.gestorfiscal.ledger.service.RecordImportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;

/**
 * REST Controller for income and expense records.
 *
 * IMPORTANT: Controllers contain NO business logic.
 * All logic is delegated to FiscalRecordService, DocumentNumberService and RecordImportService.
 */
@RestController
@RequestMapping("/api/records")
@RequiredArgsConstructor
@Tag(name = "Records", description = "Issued and received invoices")
public class FiscalRecordController {

    private final FiscalRecordService fiscalRecordService;
    private final DocumentNumberService documentNumberService;
    private final RecordImportService recordImportService;

    // ==================== QUERIES ====================

    @GetMapping
    @Operation(summary = "List records, optionally filtered by kind, year and quarter")
    public ResponseEntity<ApiResponse<List<FiscalRecordDto>>> listRecords(
            @RequestParam(required = false) RecordKind kind,
            @RequestParam(required = false) Integer year,
            @RequestParam(required = false) Integer quarter) {

        return ResponseEntity.ok(ApiResponse.success(fiscalRecordService.list(kind, year, quarter)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get record by ID")
    public ResponseEntity<ApiResponse<FiscalRecordDto>> getRecord(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(fiscalRecordService.get(id)));
    }

    // ==================== NUMBERING ====================

    @GetMapping("/next-number")
    @Operation(summary = "Suggest the next document number for a kind and year")
    public ResponseEntity<ApiResponse<String>> nextNumber(
            @RequestParam RecordKind kind,
            @RequestParam int year) {

        return ResponseEntity.ok(ApiResponse.success(documentNumberService.suggestNext(kind, year)));
    }

    @GetMapping("/exists")
    @Operation(summary = "Check whether a document number is already used")
    public ResponseEntity<ApiResponse<Boolean>> numberExists(
            @RequestParam RecordKind kind,
            @RequestParam String number) {

        return ResponseEntity.ok(ApiResponse.success(documentNumberService.exists(kind, number)));
    }

    // ==================== WRITES ====================

    @PostMapping("/check")
    @Operation(summary = "Run the pre-save integrity checks without saving")
    public ResponseEntity<ApiResponse<IntegrityReport>> checkRecord(
            @RequestBody FiscalRecordDto draft,
            @RequestParam(defaultValue = "false") boolean edit) {

        return ResponseEntity.ok(ApiResponse.success(fiscalRecordService.check(draft, edit)));
    }

    @PostMapping
    @Operation(summary = "Create a record (advisory issues need confirmAdvisories=true)")
    public ResponseEntity<ApiResponse<FiscalRecordDto>> createRecord(
            @RequestBody FiscalRecordDto draft,
            @RequestParam(defaultValue = "false") boolean confirmAdvisories) {

        FiscalRecordDto created = fiscalRecordService.create(draft, confirmAdvisories);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Record created"));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Replace a record")
    public ResponseEntity<ApiResponse<FiscalRecordDto>> replaceRecord(
            @PathVariable String id,
            @RequestBody FiscalRecordDto draft,
            @RequestParam(defaultValue = "false") boolean confirmAdvisories) {

        FiscalRecordDto updated = fiscalRecordService.replace(id, draft, confirmAdvisories);
        return ResponseEntity.ok(ApiResponse.success(updated, "Record updated"));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a record")
    public ResponseEntity<ApiResponse<Void>> deleteRecord(@PathVariable String id) {
        fiscalRecordService.delete(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Record deleted"));
    }

    @PostMapping("/bulk-delete")
    @Operation(summary = "Delete several records")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> bulkDelete(
            @Valid @RequestBody BulkDeleteRequest request) {

        int deleted = fiscalRecordService.deleteMany(request.getIds());
        return ResponseEntity.ok(ApiResponse.success(Map.of("deleted", deleted), "Records deleted"));
    }

    // ==================== IMPORT ====================

    @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Import records from an Excel or CSV file")
    public ResponseEntity<ApiResponse<RecordImportResponse>> importRecords(
            @RequestParam("file") MultipartFile file,
            @RequestParam("kind") RecordKind kind,
            @RequestParam(defaultValue = "false") boolean dryRun) {

        RecordImportResponse response = recordImportService.importFile(file, kind, dryRun);
        return ResponseEntity.ok(ApiResponse.success(response, response.getMessage()));
    }
}
