package es.gestorfiscal.ledger.service;

import es.gestorfiscal.common.dto.profile.ProfessionalProfileDto;
import es.gestorfiscal.common.dto.taxid.TaxIdValidationResult;
import es.gestorfiscal.common.exception.ValidationException;
import es.gestorfiscal.common.util.TaxIdValidator;
import es.gestorfiscal.ledger.repository.ProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Service for the professional profile.
 *
 * ALL business logic for the profile is here.
 * Controllers only delegate to this service.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileService {

    // Spanish account: ES, two check digits, twenty digits
    private static final Pattern SPANISH_IBAN = Pattern.compile("ES\\d{22}");

    private final ProfileRepository profileRepository;

    /**
     * Saved profile, or an empty one when it was never saved.
     */
    public ProfessionalProfileDto getProfile() {
        return profileRepository.getProfile()
                .orElseGet(() -> ProfessionalProfileDto.builder().build());
    }

    /**
     * Replace the profile.
     *
     * The name is required. The NIF, when given, must be a valid Spanish tax id;
     * it is printed on every invoice and return.
     */
    public ProfessionalProfileDto updateProfile(ProfessionalProfileDto profile) {
        if (profile.getName() == null || profile.getName().isBlank()) {
            throw new ValidationException("name", "Name is required");
        }

        String nif = TaxIdValidator.normalize(profile.getNif());
        if (!nif.isEmpty()) {
            TaxIdValidationResult validation = TaxIdValidator.validate(nif);
            if (!validation.isValid()) {
                throw new ValidationException("nif", validation.describeProblem());
            }
        }

        String iban = normalizeIban(profile.getIban());
        if (iban != null && !SPANISH_IBAN.matcher(iban).matches()) {
            throw new ValidationException("iban", "IBAN must be ES followed by 22 digits");
        }

        ProfessionalProfileDto updated = profile.toBuilder()
                .name(profile.getName().trim())
                .nif(nif.isEmpty() ? null : nif)
                .iban(iban)
                .build();

        profileRepository.saveProfile(updated);
        log.info("Professional profile updated ({})", updated.getNif());
        return updated;
    }

    static String normalizeIban(String iban) {
        if (iban == null) {
            return null;
        }
        String compact = iban.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        return compact.isEmpty() ? null : compact;
    }
}
