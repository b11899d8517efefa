package es.gestorfiscal.ledger.controller;

import es.gestorfiscal.common.dto.ApiResponse;
import es.gestorfiscal.common.dto.tax.*;
import es.gestorfiscal.ledger.service.FiscalAggregationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST Controller for the AEAT tax model figures.
 *
 * IMPORTANT: Controllers contain NO business logic.
 * All logic is delegated to FiscalAggregationService.
 */
@RestController
@RequestMapping("/api/tax-models")
@RequiredArgsConstructor
@Tag(name = "Tax Models", description = "Modelos 303, 390, 130, 111, 347 and 190")
public class TaxModelController {

    private final FiscalAggregationService aggregationService;

    @GetMapping("/{year}")
    @Operation(summary = "All models for a year, periodic ones for the given quarter")
    public ResponseEntity<ApiResponse<FiscalSummaryDto>> getSummary(
            @PathVariable int year,
            @RequestParam(required = false) Integer quarter) {

        return ResponseEntity.ok(ApiResponse.success(aggregationService.summarize(year, quarter)));
    }

    @GetMapping("/{year}/303")
    @Operation(summary = "Modelo 303 (VAT), quarterly or yearly")
    public ResponseEntity<ApiResponse<Model303Summary>> getModel303(
            @PathVariable int year,
            @RequestParam(required = false) Integer quarter) {

        return ResponseEntity.ok(ApiResponse.success(aggregationService.summarize(year, quarter).getModel303()));
    }

    @GetMapping("/{year}/130")
    @Operation(summary = "Modelo 130 (IRPF advance payment), quarterly or yearly")
    public ResponseEntity<ApiResponse<Model130Summary>> getModel130(
            @PathVariable int year,
            @RequestParam(required = false) Integer quarter) {

        return ResponseEntity.ok(ApiResponse.success(aggregationService.summarize(year, quarter).getModel130()));
    }

    @GetMapping("/{year}/111")
    @Operation(summary = "Modelo 111 (withholdings on received invoices), quarterly or yearly")
    public ResponseEntity<ApiResponse<Model111Summary>> getModel111(
            @PathVariable int year,
            @RequestParam(required = false) Integer quarter) {

        return ResponseEntity.ok(ApiResponse.success(aggregationService.summarize(year, quarter).getModel111()));
    }

    @GetMapping("/{year}/390")
    @Operation(summary = "Modelo 390 (annual VAT summary)")
    public ResponseEntity<ApiResponse<Model390Summary>> getModel390(@PathVariable int year) {
        return ResponseEntity.ok(ApiResponse.success(aggregationService.summarize(year, null).getModel390()));
    }

    @GetMapping("/{year}/347")
    @Operation(summary = "Modelo 347 (operations with third parties above the threshold)")
    public ResponseEntity<ApiResponse<List<ThirdPartyOperationDto>>> getModel347(@PathVariable int year) {
        return ResponseEntity.ok(ApiResponse.success(aggregationService.summarize(year, null).getModel347()));
    }

    @GetMapping("/{year}/190")
    @Operation(summary = "Modelo 190 (withholding certificates by client)")
    public ResponseEntity<ApiResponse<List<WithholdingCertificateDto>>> getModel190(@PathVariable int year) {
        return ResponseEntity.ok(ApiResponse.success(aggregationService.summarize(year, null).getModel190()));
    }
}
