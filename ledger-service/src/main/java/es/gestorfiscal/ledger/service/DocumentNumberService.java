package es.gestorfiscal.ledger.service;

import es.gestorfiscal.common.dto.record.RecordKind;
import es.gestorfiscal.common.util.DocumentNumberSequencer;
import es.gestorfiscal.ledger.repository.FiscalRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Document numbers over the current store content.
 *
 * A suggestion is not a reservation: two drafts opened at once get the same number,
 * and the second save is rejected as a duplicate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentNumberService {

    private final FiscalRecordStore recordStore;

    public String suggestNext(RecordKind kind, int year) {
        String next = DocumentNumberSequencer.nextNumber(recordStore.listAll(), kind, year);
        log.debug("Next {} number for {}: {}", kind, year, next);
        return next;
    }

    /**
     * Whether a record of this kind already holds the number. Lets callers tell a new
     * record from an edit of an existing one.
     */
    public boolean exists(RecordKind kind, String documentNumber) {
        if (documentNumber == null || documentNumber.isBlank()) {
            return false;
        }
        String number = documentNumber.trim();
        return recordStore.listAll().stream()
                .anyMatch(r -> r.getKind() == kind && r.getDocumentNumber() != null
                        && number.equals(r.getDocumentNumber().trim()));
    }
}
