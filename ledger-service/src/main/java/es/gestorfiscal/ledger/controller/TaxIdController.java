package es.gestorfiscal.ledger.controller;

import es.gestorfiscal.common.dto.ApiResponse;
import es.gestorfiscal.common.dto.taxid.TaxIdValidationResult;
import es.gestorfiscal.common.util.TaxIdValidator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/tax-ids")
@Tag(name = "Tax IDs", description = "DNI, NIE and CIF validation")
public class TaxIdController {

    @GetMapping("/{value}/validation")
    @Operation(summary = "Classify a tax id and check its control letter")
    public ResponseEntity<ApiResponse<TaxIdValidationResult>> validate(@PathVariable String value) {
        TaxIdValidationResult result = TaxIdValidator.validate(value);
        return ResponseEntity.ok(ApiResponse.success(result, result.describeProblem()));
    }
}
