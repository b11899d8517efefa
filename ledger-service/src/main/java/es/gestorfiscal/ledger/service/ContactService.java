package es.gestorfiscal.ledger.service;

import es.gestorfiscal.common.dto.contact.ContactDto;
import es.gestorfiscal.common.dto.contact.ContactType;
import es.gestorfiscal.common.dto.imports.ContactImportResponse;
import es.gestorfiscal.common.dto.imports.ContactImportResponse.ImportedContact;
import es.gestorfiscal.common.dto.imports.ContactImportResponse.SkippedContact;
import es.gestorfiscal.common.dto.taxid.TaxIdValidationResult;
import es.gestorfiscal.common.exception.DuplicateResourceException;
import es.gestorfiscal.common.exception.ResourceNotFoundException;
import es.gestorfiscal.common.exception.ValidationException;
import es.gestorfiscal.common.util.TaxIdValidator;
import es.gestorfiscal.ledger.repository.ContactRepository;
import es.gestorfiscal.ledger.service.SpreadsheetReader.SheetRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Service for the address book of clients and providers.
 *
 * Business rules:
 * - Internal ids are C-n for clients and P-n for providers, next = highest n of the type + 1
 * - A tax id belongs to one contact only
 * - Client tax ids must be valid; an invalid provider tax id is only logged
 * - Changing the type of a contact gives it a new internal id under the new prefix
 * - Imported rows follow the same rules; rows that break them are skipped, not fatal
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContactService {

    private static final String RESOURCE = "Contact";
    static final String DEFAULT_IMPORTED_NAME = "Desconocido";

    public static final Map<String, List<String>> CONTACT_COLUMN_ALIASES = Map.of(
            "type", List.of("Tipo", "Type", "Rol"),
            "name", List.of("Nombre", "Razón Social", "Name", "Empresa"),
            "taxId", List.of("NIF", "CIF", "DNI", "NIE", "Tax ID"),
            "fiscalAddress", List.of("Domicilio", "Dirección", "Address"),
            "email", List.of("Email", "Correo", "Mail"),
            "phone", List.of("Teléfono", "Telefono", "Phone", "Móvil"),
            "contactPerson", List.of("Persona de Contacto", "Contacto"),
            "notes", List.of("Notas", "Observaciones", "Notes", "Comentarios")
    );

    private static final Map<String, String> HEADER_TO_FIELD = SpreadsheetReader.headerIndex(CONTACT_COLUMN_ALIASES);

    private final ContactRepository contactRepository;
    private final SpreadsheetReader spreadsheetReader;

    /**
     * All contacts, optionally of one type, ordered by internal id (C-2 before C-10).
     */
    public List<ContactDto> list(ContactType type) {
        return contactRepository.findAll().stream()
                .filter(c -> type == null || c.getType() == type)
                .sorted(Comparator.comparing((ContactDto c) -> c.getType() != null ? c.getType().ordinal() : Integer.MAX_VALUE)
                        .thenComparingLong(c -> sequenceOf(c.getInternalId())))
                .collect(Collectors.toList());
    }

    public ContactDto get(String internalId) {
        return contactRepository.findById(internalId)
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, internalId));
    }

    public ContactDto create(ContactDto contact) {
        List<ContactDto> existing = contactRepository.findAll();
        ContactDto prepared = prepare(contact, null, existing);

        ContactDto saved = contactRepository.save(prepared.toBuilder()
                .internalId(nextInternalId(prepared.getType(), existing))
                .build());
        log.info("Created contact {} ({})", saved.getInternalId(), saved.getName());
        return saved;
    }

    public ContactDto update(String internalId, ContactDto contact) {
        ContactDto current = get(internalId);
        List<ContactDto> existing = contactRepository.findAll();
        ContactDto prepared = prepare(contact, internalId, existing);

        if (prepared.getType() == current.getType()) {
            ContactDto saved = contactRepository.save(prepared.toBuilder().internalId(internalId).build());
            log.info("Updated contact {}", internalId);
            return saved;
        }

        ContactDto saved = contactRepository.save(prepared.toBuilder()
                .internalId(nextInternalId(prepared.getType(), existing))
                .build());
        contactRepository.delete(internalId);
        log.info("Contact {} changed type to {}, new id {}", internalId, prepared.getType(), saved.getInternalId());
        return saved;
    }

    public void delete(String internalId) {
        get(internalId);
        contactRepository.delete(internalId);
        log.info("Deleted contact {}", internalId);
    }

    // ==================== IMPORT ====================

    /**
     * Import contacts from an Excel or CSV file.
     *
     * A row is a provider when its type column mentions "prov" or "supplier", a client otherwise.
     * Rows without a tax id, with a tax id already in the book (or earlier in the file),
     * or with an invalid client tax id are skipped with the reason.
     *
     * @param dryRun true to only report what would be imported
     */
    public ContactImportResponse importContacts(MultipartFile file, boolean dryRun) {
        List<SheetRow> rows = spreadsheetReader.read(file, HEADER_TO_FIELD);
        log.info("Contact import started - file: {}, rows: {}, dryRun: {}",
                file.getOriginalFilename(), rows.size(), dryRun);

        List<ContactDto> snapshot = new ArrayList<>(contactRepository.findAll());
        List<ImportedContact> imported = new ArrayList<>();
        List<SkippedContact> skipped = new ArrayList<>();

        for (SheetRow row : rows) {
            ContactDto draft = mapRow(row);

            ContactDto prepared;
            try {
                prepared = prepare(draft, null, snapshot);
            } catch (ValidationException | DuplicateResourceException e) {
                log.warn("Contact row {} skipped: {}", row.getRowIndex(), e.getMessage());
                skipped.add(SkippedContact.builder()
                        .rowIndex(row.getRowIndex())
                        .name(draft.getName())
                        .taxId(draft.getTaxId())
                        .reason(e.getMessage())
                        .build());
                continue;
            }

            ContactDto numbered = prepared.toBuilder()
                    .internalId(nextInternalId(prepared.getType(), snapshot))
                    .build();
            ContactDto saved = dryRun ? numbered : contactRepository.save(numbered);
            snapshot.add(saved);

            imported.add(ImportedContact.builder()
                    .rowIndex(row.getRowIndex())
                    .internalId(saved.getInternalId())
                    .type(saved.getType())
                    .name(saved.getName())
                    .taxId(saved.getTaxId())
                    .build());
        }

        log.info("Contact import finished - processed: {}, imported: {}, skipped: {}",
                rows.size(), imported.size(), skipped.size());

        return ContactImportResponse.builder()
                .dryRun(dryRun)
                .message(String.format("%s %d contacts, skipped %d",
                        dryRun ? "Would import" : "Imported", imported.size(), skipped.size()))
                .totalRowsProcessed(rows.size())
                .importedCount(imported.size())
                .skippedCount(skipped.size())
                .importedRows(imported)
                .skippedRows(skipped)
                .build();
    }

    private ContactDto mapRow(SheetRow row) {
        String name = row.text("name");
        return ContactDto.builder()
                .type(parseImportedType(row.text("type")))
                .name(name != null ? name : DEFAULT_IMPORTED_NAME)
                .taxId(row.text("taxId"))
                .fiscalAddress(row.text("fiscalAddress"))
                .email(row.text("email"))
                .phone(row.text("phone"))
                .contactPerson(row.text("contactPerson"))
                .notes(row.text("notes"))
                .build();
    }

    static ContactType parseImportedType(String value) {
        if (value == null) {
            return ContactType.CLIENT;
        }
        String upper = SpreadsheetReader.normalizeHeader(value).toUpperCase(Locale.ROOT);
        return upper.contains("PROV") || upper.contains("SUPPLIER") ? ContactType.PROVIDER : ContactType.CLIENT;
    }

    /**
     * Next internal id for a type: C-1 when there are no clients yet.
     */
    public String nextInternalId(ContactType type, List<ContactDto> existing) {
        long max = existing.stream()
                .filter(c -> c.getType() == type)
                .filter(c -> c.getInternalId() != null && c.getInternalId().startsWith(type.getIdPrefix() + "-"))
                .mapToLong(c -> sequenceOf(c.getInternalId()))
                .filter(n -> n != Long.MAX_VALUE)
                .max()
                .orElse(0);
        return type.getIdPrefix() + "-" + (max + 1);
    }

    // ==================== HELPERS ====================

    private ContactDto prepare(ContactDto contact, String ownId, List<ContactDto> existing) {
        if (contact.getType() == null) {
            throw new ValidationException("type", "Contact type is required");
        }
        if (contact.getName() == null || contact.getName().isBlank()) {
            throw new ValidationException("name", "Name is required");
        }

        String taxId = TaxIdValidator.normalize(contact.getTaxId());
        if (taxId.isEmpty()) {
            throw new ValidationException("taxId", "Tax ID is required");
        }

        TaxIdValidationResult validation = TaxIdValidator.validate(taxId);
        if (!validation.isValid()) {
            if (contact.getType() == ContactType.CLIENT) {
                throw new ValidationException("taxId", validation.describeProblem());
            }
            log.warn("Provider {} saved with tax id {}: {}", contact.getName(), taxId, validation.describeProblem());
        }

        boolean taken = existing.stream()
                .anyMatch(c -> taxId.equals(TaxIdValidator.normalize(c.getTaxId()))
                        && !Objects.equals(c.getInternalId(), ownId));
        if (taken) {
            throw new DuplicateResourceException(RESOURCE, taxId);
        }

        return contact.toBuilder()
                .name(contact.getName().trim())
                .taxId(taxId)
                .build();
    }

    private static long sequenceOf(String internalId) {
        if (internalId == null) {
            return Long.MAX_VALUE;
        }
        int dash = internalId.indexOf('-');
        try {
            return Long.parseLong(internalId.substring(dash + 1));
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }
}
