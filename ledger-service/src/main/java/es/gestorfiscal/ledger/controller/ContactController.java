package es.gestorfiscal.ledger.controller;

import es.gestorfiscal.common.dto.ApiResponse;
import es.gestorfiscal.common.dto.contact.ContactDto;
import es.gestorfiscal.common.dto.contact.ContactType;
import es.gestorfiscal.common.dto.imports.ContactImportResponse;
import es.gestorfiscal.ledger.service.ContactService;
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

/**
 * REST Controller for saved clients and providers.
 *
 * IMPORTANT: Controllers contain NO business logic.
 * All logic is delegated to ContactService.
 */
@RestController
@RequestMapping("/api/contacts")
@RequiredArgsConstructor
@Tag(name = "Contacts", description = "Client and provider address book")
public class ContactController {

    private final ContactService contactService;

    @GetMapping
    @Operation(summary = "List contacts, optionally of one type")
    public ResponseEntity<ApiResponse<List<ContactDto>>> listContacts(
            @RequestParam(required = false) ContactType type) {

        return ResponseEntity.ok(ApiResponse.success(contactService.list(type)));
    }

    @GetMapping("/{internalId}")
    @Operation(summary = "Get contact by internal id")
    public ResponseEntity<ApiResponse<ContactDto>> getContact(@PathVariable String internalId) {
        return ResponseEntity.ok(ApiResponse.success(contactService.get(internalId)));
    }

    @PostMapping
    @Operation(summary = "Create contact")
    public ResponseEntity<ApiResponse<ContactDto>> createContact(@Valid @RequestBody ContactDto contact) {
        ContactDto created = contactService.create(contact);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Contact created"));
    }

    @PutMapping("/{internalId}")
    @Operation(summary = "Update contact")
    public ResponseEntity<ApiResponse<ContactDto>> updateContact(
            @PathVariable String internalId,
            @Valid @RequestBody ContactDto contact) {

        ContactDto updated = contactService.update(internalId, contact);
        return ResponseEntity.ok(ApiResponse.success(updated, "Contact updated"));
    }

    @DeleteMapping("/{internalId}")
    @Operation(summary = "Delete contact")
    public ResponseEntity<ApiResponse<Void>> deleteContact(@PathVariable String internalId) {
        contactService.delete(internalId);
        return ResponseEntity.ok(ApiResponse.success(null, "Contact deleted"));
    }

    @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Import contacts from an Excel or CSV file")
    public ResponseEntity<ApiResponse<ContactImportResponse>> importContacts(
            @RequestParam("file") MultipartFile file,
            @RequestParam(defaultValue = "false") boolean dryRun) {

        ContactImportResponse response = contactService.importContacts(file, dryRun);
        return ResponseEntity.ok(ApiResponse.success(response, response.getMessage()));
    }
}
