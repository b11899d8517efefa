package es.gestorfiscal.ledger.service;

import es.gestorfiscal.common.dto.profile.ProfessionalProfileDto;
import es.gestorfiscal.common.exception.StoreAccessException;
import es.gestorfiscal.common.exception.ValidationException;
import es.gestorfiscal.ledger.repository.ProfileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProfileServiceTest {

    @Mock
    private ProfileRepository profileRepository;

    private ProfileService service;

    @BeforeEach
    void setUp() {
        service = new ProfileService(profileRepository);
    }

    private static ProfessionalProfileDto.ProfessionalProfileDtoBuilder profile() {
        return ProfessionalProfileDto.builder()
                .name("  Ana García Abogada ")
                .nif(" 12345678z ")
                .city("Madrid")
                .barAssociation("ICAM")
                .collegiateNumber("12345");
    }

    @Test
    void getProfile_ShouldReturnEmptyProfileWhenNeverSaved() {
        when(profileRepository.getProfile()).thenReturn(Optional.empty());

        ProfessionalProfileDto result = service.getProfile();

        assertNotNull(result);
        assertNull(result.getName());
        assertNull(result.getNif());
    }

    @Test
    void getProfile_ShouldPropagateStoreFailure() {
        when(profileRepository.getProfile()).thenThrow(new StoreAccessException("Failed to load professional profile", null));

        assertThrows(StoreAccessException.class, () -> service.getProfile());
    }

    @Test
    void updateProfile_ShouldNormalizeAndSave() {
        // Arrange
        ProfessionalProfileDto input = profile().iban("es91 2100 0418 4502 0005 1332").build();

        // Act
        ProfessionalProfileDto result = service.updateProfile(input);

        // Assert
        ArgumentCaptor<ProfessionalProfileDto> captor = ArgumentCaptor.forClass(ProfessionalProfileDto.class);
        verify(profileRepository).saveProfile(captor.capture());
        ProfessionalProfileDto saved = captor.getValue();
        assertEquals("Ana García Abogada", saved.getName());
        assertEquals("12345678Z", saved.getNif());
        assertEquals("ES9121000418450200051332", saved.getIban());
        assertEquals("ICAM", saved.getBarAssociation());
        assertEquals(saved, result);
    }

    @Test
    void updateProfile_ShouldAcceptMissingNifAndIban() {
        ProfessionalProfileDto result = service.updateProfile(profile().nif("").iban("  ").build());

        assertNull(result.getNif());
        assertNull(result.getIban());
        verify(profileRepository).saveProfile(any());
    }

    @Test
    void updateProfile_ShouldRejectInvalidInput() {
        assertThrows(ValidationException.class, () -> service.updateProfile(profile().name(" ").build()));
        assertThrows(ValidationException.class, () -> service.updateProfile(profile().nif("12345678A").build()));
        assertThrows(ValidationException.class, () -> service.updateProfile(profile().iban("FR7630006000011234567890189").build()));
        assertThrows(ValidationException.class, () -> service.updateProfile(profile().iban("ES91 2100").build()));
        verify(profileRepository, never()).saveProfile(any());
    }
}
