package es.gestorfiscal.ledger.controller;

import es.gestorfiscal.common.dto.ApiResponse;
import es.gestorfiscal.common.dto.closing.FiscalYearClosingDto;
import es.gestorfiscal.ledger.service.FiscalYearClosingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/fiscal-years")
@RequiredArgsConstructor
@Tag(name = "Fiscal Years", description = "Years with records and year-end closing figures")
public class FiscalYearController {

    private final FiscalYearClosingService closingService;

    @GetMapping
    @Operation(summary = "Years that have records, newest first")
    public ResponseEntity<ApiResponse<List<Integer>>> getAvailableYears() {
        return ResponseEntity.ok(ApiResponse.success(closingService.availableYears()));
    }

    @GetMapping("/{year}/closing")
    @Operation(summary = "Year-end closing figures")
    public ResponseEntity<ApiResponse<FiscalYearClosingDto>> getClosing(@PathVariable int year) {
        return ResponseEntity.ok(ApiResponse.success(closingService.closingStats(year)));
    }
}
