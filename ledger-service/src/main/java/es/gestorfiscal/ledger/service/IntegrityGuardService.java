package es.gestorfiscal.ledger.service;

import es.gestorfiscal.common.dto.integrity.IntegrityIssue;
import es.gestorfiscal.common.dto.integrity.IntegrityReport;
import es.gestorfiscal.common.dto.integrity.IssueCode;
import es.gestorfiscal.common.dto.record.FiscalRecordDto;
import es.gestorfiscal.common.dto.record.RecordKind;
import es.gestorfiscal.common.dto.taxid.TaxIdStatus;
import es.gestorfiscal.common.dto.taxid.TaxIdValidationResult;
import es.gestorfiscal.common.util.TaxIdValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Objects;

/**
 * Pre-save checks on a draft record.
 *
 * Business rules:
 * 1. Document number unique per kind (on edit, only the record itself may hold it)
 * 2. Counterparty tax id: blocking on income, advisory on expenses
 * 3. Counterparty name, tax id, document number, issue date and kind are required
 *
 * Issues are returned as data; nothing is thrown, stored or modified here.
 */
@Slf4j
@Service
public class IntegrityGuardService {

    public IntegrityReport checkBeforeSave(FiscalRecordDto draft, Collection<FiscalRecordDto> existing, boolean isEdit) {
        IntegrityReport report = IntegrityReport.builder().build();

        checkDuplicateNumber(draft, existing, isEdit, report);
        checkTaxId(draft, report);
        checkRequiredFields(draft, report);

        if (!report.isClean()) {
            log.debug("Integrity check of {} {}: {} blocking, {} advisory", draft.getKind(),
                    draft.getDocumentNumber(), report.getBlocking().size(), report.getAdvisory().size());
        }
        return report;
    }

    private void checkDuplicateNumber(FiscalRecordDto draft, Collection<FiscalRecordDto> existing,
                                      boolean isEdit, IntegrityReport report) {
        String number = trimToNull(draft.getDocumentNumber());
        if (number == null || draft.getKind() == null || existing == null) {
            return;
        }

        boolean taken = existing.stream()
                .filter(Objects::nonNull)
                .filter(r -> r.getKind() == draft.getKind())
                .filter(r -> number.equals(trimToNull(r.getDocumentNumber())))
                .anyMatch(r -> !isEdit || !Objects.equals(r.getId(), draft.getId()));

        if (taken) {
            report.getBlocking().add(IntegrityIssue.builder()
                    .code(IssueCode.DUPLICATE_DOCUMENT_NUMBER)
                    .field("documentNumber")
                    .message(String.format("El número %s ya existe", number))
                    .build());
        }
    }

    private void checkTaxId(FiscalRecordDto draft, IntegrityReport report) {
        if (trimToNull(draft.getCounterpartyTaxId()) == null) {
            return;
        }

        TaxIdValidationResult result = TaxIdValidator.validate(draft.getCounterpartyTaxId());
        if (result.isValid()) {
            return;
        }

        IntegrityIssue issue = IntegrityIssue.builder()
                .code(result.getStatus() == TaxIdStatus.INVALID_CHECKSUM
                        ? IssueCode.INVALID_CHECKSUM
                        : IssueCode.UNRECOGNIZED_FORMAT)
                .field("counterpartyTaxId")
                .message(result.describeProblem())
                .expectedLetter(result.getExpectedLetter())
                .build();

        if (draft.getKind() == RecordKind.EXPENSE) {
            report.getAdvisory().add(issue);
        } else {
            report.getBlocking().add(issue);
        }
    }

    private void checkRequiredFields(FiscalRecordDto draft, IntegrityReport report) {
        if (draft.getKind() == null) {
            report.getBlocking().add(missing("kind"));
        }
        if (trimToNull(draft.getCounterpartyName()) == null) {
            report.getBlocking().add(missing("counterpartyName"));
        }
        if (trimToNull(draft.getCounterpartyTaxId()) == null) {
            report.getBlocking().add(missing("counterpartyTaxId"));
        }
        if (trimToNull(draft.getDocumentNumber()) == null) {
            report.getBlocking().add(missing("documentNumber"));
        }
        if (draft.getIssueDate() == null) {
            report.getBlocking().add(missing("issueDate"));
        }
    }

    private IntegrityIssue missing(String field) {
        return IntegrityIssue.builder()
                .code(IssueCode.MISSING_REQUIRED_FIELD)
                .field(field)
                .message("Campo obligatorio: " + field)
                .build();
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
