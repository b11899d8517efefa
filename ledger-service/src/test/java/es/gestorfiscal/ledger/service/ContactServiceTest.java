package es.gestorfiscal.ledger.service;

import es.gestorfiscal.common.dto.contact.ContactDto;
import es.gestorfiscal.common.dto.contact.ContactType;
import es.gestorfiscal.common.dto.imports.ContactImportResponse;
import es.gestorfiscal.common.exception.DuplicateResourceException;
import es.gestorfiscal.common.exception.StoreAccessException;
import es.gestorfiscal.common.exception.ValidationException;
import es.gestorfiscal.ledger.repository.ContactRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ContactServiceTest {

    @Mock
    private ContactRepository contactRepository;

    private ContactService service;

    @BeforeEach
    void setUp() {
        service = new ContactService(contactRepository, new SpreadsheetReader());
    }

    private static ContactDto contact(String internalId, ContactType type, String taxId) {
        return ContactDto.builder()
                .internalId(internalId)
                .name("Contacto " + taxId)
                .taxId(taxId)
                .type(type)
                .build();
    }

    @Test
    void create_ShouldAssignNextIdOfItsType() {
        // Arrange
        when(contactRepository.findAll()).thenReturn(List.of(
                contact("C-2", ContactType.CLIENT, "12345678Z"),
                contact("C-10", ContactType.CLIENT, "X1234567L"),
                contact("P-4", ContactType.PROVIDER, "B12345678")));
        when(contactRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        // Act
        ContactDto client = service.create(contact(null, ContactType.CLIENT, " y0000000z "));
        ContactDto provider = service.create(contact(null, ContactType.PROVIDER, "B87654321"));

        // Assert
        assertEquals("C-11", client.getInternalId());
        assertEquals("Y0000000Z", client.getTaxId());
        assertEquals("P-5", provider.getInternalId());
    }

    @Test
    void create_ShouldStartNumberingAtOne() {
        when(contactRepository.findAll()).thenReturn(List.of());
        when(contactRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        assertEquals("P-1", service.create(contact(null, ContactType.PROVIDER, "B12345678")).getInternalId());
    }

    @Test
    void create_ShouldRejectDuplicateTaxId() {
        when(contactRepository.findAll()).thenReturn(List.of(contact("C-1", ContactType.CLIENT, "12345678Z")));

        assertThrows(DuplicateResourceException.class,
                () -> service.create(contact(null, ContactType.PROVIDER, "12345678z")));
        verify(contactRepository, never()).save(any());
    }

    @Test
    void create_ShouldBlockInvalidClientTaxIdButAcceptProvider() {
        // Arrange
        when(contactRepository.findAll()).thenReturn(List.of());
        when(contactRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        // Act & Assert
        assertThrows(ValidationException.class, () -> service.create(contact(null, ContactType.CLIENT, "12345678A")));

        ContactDto provider = service.create(contact(null, ContactType.PROVIDER, "12345678A"));
        assertEquals("P-1", provider.getInternalId());
    }

    @Test
    void create_ShouldNotSaveWhenContactsCannotBeRead() {
        // Arrange
        when(contactRepository.findAll())
                .thenThrow(new StoreAccessException("Failed to list contacts: UNAVAILABLE", null));

        // Act & Assert
        assertThrows(StoreAccessException.class, () -> service.create(contact(null, ContactType.CLIENT, "12345678Z")));
        verify(contactRepository, never()).save(any());
    }

    @Test
    void update_ShouldReissueIdWhenTypeChanges() {
        // Arrange
        ContactDto stored = contact("C-3", ContactType.CLIENT, "12345678Z");
        when(contactRepository.findById("C-3")).thenReturn(Optional.of(stored));
        when(contactRepository.findAll()).thenReturn(List.of(stored, contact("P-7", ContactType.PROVIDER, "B12345678")));
        when(contactRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        // Act
        ContactDto updated = service.update("C-3", stored.toBuilder().type(ContactType.PROVIDER).build());

        // Assert
        assertEquals("P-8", updated.getInternalId());
        verify(contactRepository).delete("C-3");
    }

    @Test
    void update_ShouldKeepIdAndOwnTaxId() {
        // Arrange
        ContactDto stored = contact("C-3", ContactType.CLIENT, "12345678Z");
        when(contactRepository.findById("C-3")).thenReturn(Optional.of(stored));
        when(contactRepository.findAll()).thenReturn(List.of(stored));
        when(contactRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        // Act
        ContactDto updated = service.update("C-3", stored.toBuilder().email("ana@example.com").build());

        // Assert
        assertEquals("C-3", updated.getInternalId());
        assertEquals("ana@example.com", updated.getEmail());
        verify(contactRepository, never()).delete(any());
    }

    @Test
    void list_ShouldSortIdsNaturally() {
        when(contactRepository.findAll()).thenReturn(List.of(
                contact("C-10", ContactType.CLIENT, "A"),
                contact("P-1", ContactType.PROVIDER, "B"),
                contact("C-2", ContactType.CLIENT, "C")));

        List<ContactDto> clients = service.list(ContactType.CLIENT);

        assertEquals(List.of("C-2", "C-10"), clients.stream().map(ContactDto::getInternalId).toList());
    }

    // ==================== IMPORT ====================

    private static MockMultipartFile contactsCsv() {
        String csv = "Tipo;Razón Social;NIF;Correo;Teléfono\n"
                + "Proveedor;Papelería SL;B12345678;compras@papeleria.es;910000000\n"
                + "Cliente;Ana García;12345678z;;\n"
                + ";Sin identificar;;;\n"
                + "Cliente;Letra mal;12345678A;;\n"
                + "cliente;Ana otra vez;12345678Z;;\n";
        return new MockMultipartFile("file", "contactos.csv", "text/csv", csv.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void importContacts_ShouldNumberNewContactsAndSkipBadRows() {
        // Arrange
        when(contactRepository.findAll()).thenReturn(List.of(contact("C-4", ContactType.CLIENT, "X1234567L")));
        when(contactRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        // Act
        ContactImportResponse response = service.importContacts(contactsCsv(), false);

        // Assert
        assertEquals(5, response.getTotalRowsProcessed());
        assertEquals(2, response.getImportedCount());
        assertEquals(3, response.getSkippedCount());

        ContactImportResponse.ImportedContact provider = response.getImportedRows().get(0);
        assertEquals("P-1", provider.getInternalId());
        assertEquals(ContactType.PROVIDER, provider.getType());
        assertEquals("C-5", response.getImportedRows().get(1).getInternalId());
        assertEquals("12345678Z", response.getImportedRows().get(1).getTaxId());

        assertEquals(List.of(4, 5, 6), response.getSkippedRows().stream()
                .map(ContactImportResponse.SkippedContact::getRowIndex).toList());
        assertTrue(response.getSkippedRows().get(2).getReason().contains("12345678Z"));

        verify(contactRepository).save(argThat(c -> "P-1".equals(c.getInternalId())
                && "compras@papeleria.es".equals(c.getEmail())
                && "910000000".equals(c.getPhone())));
        verify(contactRepository, times(2)).save(any());
    }

    @Test
    void importContacts_ShouldNotWriteOnDryRun() {
        when(contactRepository.findAll()).thenReturn(List.of());

        ContactImportResponse response = service.importContacts(contactsCsv(), true);

        assertTrue(response.isDryRun());
        assertEquals(2, response.getImportedCount());
        assertEquals("C-1", response.getImportedRows().get(1).getInternalId());
        verify(contactRepository, never()).save(any());
    }

    @Test
    void parseImportedType_ShouldDetectProviders() {
        assertEquals(ContactType.PROVIDER, ContactService.parseImportedType("Proveedor"));
        assertEquals(ContactType.PROVIDER, ContactService.parseImportedType("supplier"));
        assertEquals(ContactType.CLIENT, ContactService.parseImportedType("Cliente"));
        assertEquals(ContactType.CLIENT, ContactService.parseImportedType(null));
    }
}
