package es.gestorfiscal.ledger.controller;

import es.gestorfiscal.common.dto.ApiResponse;
import es.gestorfiscal.common.dto.profile.ProfessionalProfileDto;
import es.gestorfiscal.ledger.service.ProfileService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST Controller for the professional profile.
 *
 * IMPORTANT: Controllers contain NO business logic.
 * All logic is delegated to ProfileService.
 */
@RestController
@RequestMapping("/api/profile")
@RequiredArgsConstructor
@Tag(name = "Profile", description = "Professional holding the practice")
public class ProfileController {

    private final ProfileService profileService;

    @GetMapping
    @Operation(summary = "Get the professional profile")
    public ResponseEntity<ApiResponse<ProfessionalProfileDto>> getProfile() {
        return ResponseEntity.ok(ApiResponse.success(profileService.getProfile()));
    }

    @PutMapping
    @Operation(summary = "Replace the professional profile")
    public ResponseEntity<ApiResponse<ProfessionalProfileDto>> updateProfile(
            @Valid @RequestBody ProfessionalProfileDto profile) {

        ProfessionalProfileDto updated = profileService.updateProfile(profile);
        return ResponseEntity.ok(ApiResponse.success(updated, "Profile updated"));
    }
}
