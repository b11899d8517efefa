package es.gestorfiscal.ledger.repository;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import es.gestorfiscal.common.dto.contact.ContactDto;
import es.gestorfiscal.common.dto.contact.ContactType;
import es.gestorfiscal.common.exception.StoreAccessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ExecutionException;

/**
 * Repository for saved clients and providers.
 *
 * Collection: contacts, document id = internal id (C-1, P-3)
 * Document structure: {
 *   name: string,
 *   taxId: string,
 *   fiscalAddress: string,
 *   type: "CLIENT" | "PROVIDER",
 *   email, phone, contactPerson, notes: string,
 *   updatedAt: Timestamp
 * }
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ContactRepository {

    private static final String COLLECTION = "contacts";

    private final Firestore firestore;

    /**
     * Get all contacts.
     *
     * @throws StoreAccessException when Firestore cannot be read; an empty list here
     *         would hand out ids and tax ids that are already taken
     */
    public List<ContactDto> findAll() {
        try {
            List<ContactDto> contacts = new ArrayList<>();
            for (QueryDocumentSnapshot document : firestore.collection(COLLECTION).get().get().getDocuments()) {
                contacts.add(documentToDto(document));
            }
            return contacts;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("load contacts", e);
        } catch (ExecutionException e) {
            throw failure("load contacts", e);
        }
    }

    /**
     * Find contact by internal id.
     */
    public Optional<ContactDto> findById(String internalId) {
        try {
            DocumentSnapshot document = firestore.collection(COLLECTION).document(internalId).get().get();
            if (!document.exists()) {
                return Optional.empty();
            }
            return Optional.of(documentToDto(document));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("load contact " + internalId, e);
        } catch (ExecutionException e) {
            throw failure("load contact " + internalId, e);
        }
    }

    /**
     * Save contact under its internal id.
     */
    public ContactDto save(ContactDto contact) {
        try {
            Map<String, Object> data = new HashMap<>();
            data.put("name", contact.getName());
            data.put("taxId", contact.getTaxId());
            data.put("fiscalAddress", contact.getFiscalAddress());
            data.put("type", contact.getType().name());
            data.put("email", contact.getEmail());
            data.put("phone", contact.getPhone());
            data.put("contactPerson", contact.getContactPerson());
            data.put("notes", contact.getNotes());
            data.put("updatedAt", Timestamp.now());

            firestore.collection(COLLECTION).document(contact.getInternalId()).set(data).get();
            log.debug("Saved contact: {}", contact.getInternalId());
            return contact;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("save contact " + contact.getInternalId(), e);
        } catch (ExecutionException e) {
            throw failure("save contact " + contact.getInternalId(), e);
        }
    }

    /**
     * Delete contact by internal id.
     */
    public void delete(String internalId) {
        try {
            firestore.collection(COLLECTION).document(internalId).delete().get();
            log.debug("Deleted contact: {}", internalId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("delete contact " + internalId, e);
        } catch (ExecutionException e) {
            throw failure("delete contact " + internalId, e);
        }
    }

    private StoreAccessException failure(String action, Exception e) {
        Throwable root = e.getCause() != null ? e.getCause() : e;
        log.error("Failed to {}: {}", action, root.getMessage(), e);
        return new StoreAccessException("Failed to " + action + ": " + root.getMessage(), e);
    }

    private ContactDto documentToDto(DocumentSnapshot doc) {
        String type = doc.getString("type");
        return ContactDto.builder()
                .internalId(doc.getId())
                .name(doc.getString("name"))
                .taxId(doc.getString("taxId"))
                .fiscalAddress(doc.getString("fiscalAddress"))
                .type(parseType(type))
                .email(doc.getString("email"))
                .phone(doc.getString("phone"))
                .contactPerson(doc.getString("contactPerson"))
                .notes(doc.getString("notes"))
                .build();
    }

    private ContactType parseType(String value) {
        if (value == null) {
            return null;
        }
        try {
            return ContactType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown contact type '{}' in stored document", value);
            return null;
        }
    }
}
