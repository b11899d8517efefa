package es.gestorfiscal.ledger.repository;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import es.gestorfiscal.common.dto.profile.ProfessionalProfileDto;
import es.gestorfiscal.common.exception.StoreAccessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

/**
 * Repository for the professional profile, a single document.
 *
 * Data access only - NO business logic here.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ProfileRepository {

    private static final String COLLECTION = "config";
    private static final String DOCUMENT = "professional_profile";

    private final Firestore firestore;

    /**
     * Get the saved profile, empty when it was never saved.
     */
    public Optional<ProfessionalProfileDto> getProfile() {
        try {
            DocumentSnapshot snapshot = firestore.collection(COLLECTION).document(DOCUMENT).get().get();

            if (!snapshot.exists()) {
                log.debug("Professional profile document not found");
                return Optional.empty();
            }

            return Optional.of(ProfessionalProfileDto.builder()
                    .name(snapshot.getString("name"))
                    .nif(snapshot.getString("nif"))
                    .address(snapshot.getString("address"))
                    .city(snapshot.getString("city"))
                    .zipCode(snapshot.getString("zipCode"))
                    .province(snapshot.getString("province"))
                    .barAssociation(snapshot.getString("barAssociation"))
                    .collegiateNumber(snapshot.getString("collegiateNumber"))
                    .phone(snapshot.getString("phone"))
                    .email(snapshot.getString("email"))
                    .website(snapshot.getString("website"))
                    .iban(snapshot.getString("iban"))
                    .build());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("load professional profile", e);
        } catch (ExecutionException e) {
            throw failure("load professional profile", e);
        }
    }

    /**
     * Save the profile, replacing the previous one.
     */
    public void saveProfile(ProfessionalProfileDto profile) {
        try {
            Map<String, Object> data = new HashMap<>();
            data.put("name", profile.getName());
            data.put("nif", profile.getNif());
            data.put("address", profile.getAddress());
            data.put("city", profile.getCity());
            data.put("zipCode", profile.getZipCode());
            data.put("province", profile.getProvince());
            data.put("barAssociation", profile.getBarAssociation());
            data.put("collegiateNumber", profile.getCollegiateNumber());
            data.put("phone", profile.getPhone());
            data.put("email", profile.getEmail());
            data.put("website", profile.getWebsite());
            data.put("iban", profile.getIban());
            data.put("updatedAt", Timestamp.now());

            firestore.collection(COLLECTION).document(DOCUMENT).set(data).get();
            log.debug("Professional profile saved");

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("save professional profile", e);
        } catch (ExecutionException e) {
            throw failure("save professional profile", e);
        }
    }

    private StoreAccessException failure(String action, Exception e) {
        Throwable root = e.getCause() != null ? e.getCause() : e;
        log.error("Failed to {}: {}", action, root.getMessage(), e);
        return new StoreAccessException("Failed to " + action + ": " + root.getMessage(), e);
    }
}
