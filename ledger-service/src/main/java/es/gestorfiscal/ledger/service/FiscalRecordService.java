package es.gestorfiscal.ledger.service;

import es.gestorfiscal.common.dto.integrity.IntegrityReport;
import es.gestorfiscal.common.dto.record.FiscalRecordDto;
import es.gestorfiscal.common.dto.record.RecordKind;
import es.gestorfiscal.common.exception.AdvisoryConfirmationRequiredException;
import es.gestorfiscal.common.exception.IntegrityViolationException;
import es.gestorfiscal.common.exception.ResourceNotFoundException;
import es.gestorfiscal.common.exception.ValidationException;
import es.gestorfiscal.common.util.AmountUtils;
import es.gestorfiscal.common.util.FiscalPeriod;
import es.gestorfiscal.common.util.TaxIdValidator;
import es.gestorfiscal.ledger.repository.FiscalRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Service for writing and reading fiscal records.
 *
 * Every write goes through the integrity checks, whatever its origin (form, import
 * or extracted from a document):
 * - blocking issues reject the write with every failing field
 * - advisory issues need explicit confirmation
 *
 * ALL business logic for record writes is here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FiscalRecordService {

    private static final String RESOURCE = "FiscalRecord";

    private final FiscalRecordStore recordStore;
    private final IntegrityGuardService integrityGuard;

    // ==================== READ ====================

    /**
     * Records filtered by kind, year and quarter, newest first.
     * Every filter is optional, but a quarter needs a year.
     */
    public List<FiscalRecordDto> list(RecordKind kind, Integer year, Integer quarter) {
        FiscalPeriod.requireValidQuarter(quarter);
        if (quarter != null && year == null) {
            throw new ValidationException("quarter", "A quarter filter needs a year");
        }

        return recordStore.listAll().stream()
                .filter(r -> kind == null || r.getKind() == kind)
                .filter(r -> year == null || FiscalPeriod.isInPeriod(r.getIssueDate(), year, quarter))
                .sorted(Comparator.comparing(FiscalRecordDto::getIssueDate,
                        Comparator.nullsLast(Comparator.<LocalDate>reverseOrder())))
                .collect(Collectors.toList());
    }

    public FiscalRecordDto get(String id) {
        return recordStore.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, id));
    }

    // ==================== WRITE ====================

    /**
     * Dry run of the integrity checks against the current store content.
     */
    public IntegrityReport check(FiscalRecordDto draft, boolean isEdit) {
        return check(draft, isEdit, recordStore.listAll());
    }

    /**
     * Integrity checks against a snapshot the caller already holds (one read per import).
     */
    public IntegrityReport check(FiscalRecordDto draft, boolean isEdit, Collection<FiscalRecordDto> snapshot) {
        return integrityGuard.checkBeforeSave(prepare(draft), snapshot, isEdit);
    }

    /**
     * Save a new record.
     *
     * @param confirmAdvisories true when the user accepted the advisory issues
     * @throws IntegrityViolationException when a blocking issue exists
     * @throws AdvisoryConfirmationRequiredException when advisories exist and were not confirmed
     */
    public FiscalRecordDto create(FiscalRecordDto draft, boolean confirmAdvisories) {
        return create(draft, confirmAdvisories, recordStore.listAll());
    }

    /**
     * Save a new record, checking uniqueness against the given snapshot of the store.
     */
    public FiscalRecordDto create(FiscalRecordDto draft, boolean confirmAdvisories, Collection<FiscalRecordDto> snapshot) {
        FiscalRecordDto record = prepare(draft).toBuilder().id(null).build();

        IntegrityReport report = integrityGuard.checkBeforeSave(record, snapshot, false);
        enforce(record, report, confirmAdvisories);

        FiscalRecordDto saved = recordStore.insert(record);
        log.info("Created {} record {} ({})", saved.getKind(), saved.getDocumentNumber(), saved.getId());
        return saved;
    }

    /**
     * Replace an existing record. The kind of a record never changes.
     */
    public FiscalRecordDto replace(String id, FiscalRecordDto draft, boolean confirmAdvisories) {
        FiscalRecordDto current = get(id);
        if (draft.getKind() != null && draft.getKind() != current.getKind()) {
            throw new ValidationException("kind",
                    String.format("Cannot change record kind from %s to %s", current.getKind(), draft.getKind()));
        }

        FiscalRecordDto record = prepare(draft).toBuilder()
                .id(id)
                .kind(current.getKind())
                .build();

        IntegrityReport report = integrityGuard.checkBeforeSave(record, recordStore.listAll(), true);
        enforce(record, report, confirmAdvisories);

        FiscalRecordDto saved = recordStore.replace(id, record);
        log.info("Updated {} record {} ({})", saved.getKind(), saved.getDocumentNumber(), id);
        return saved;
    }

    public void delete(String id) {
        FiscalRecordDto current = get(id);
        recordStore.delete(id);
        log.info("Deleted {} record {} ({})", current.getKind(), current.getDocumentNumber(), id);
    }

    /**
     * Delete several records at once. Unknown ids are ignored.
     *
     * @return number of ids submitted for deletion
     */
    public int deleteMany(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            throw new ValidationException("ids", "No records selected");
        }
        int deleted = recordStore.deleteMany(ids);
        log.info("Bulk deleted {} records", deleted);
        return deleted;
    }

    // ==================== DERIVED AMOUNTS ====================

    /**
     * Fill the derived amounts a draft leaves empty:
     * - income taxBase = fees + taxableExpenses
     * - vatAmount = taxBase * vatRate / 100
     * - withholdingAmount = taxBase * withholdingRate / 100
     * - totalAmount = taxBase + vatAmount - withholdingAmount (+ supplies on income)
     *
     * Amounts already present are kept as given. Returns a new instance.
     */
    public FiscalRecordDto deriveAmounts(FiscalRecordDto draft) {
        FiscalRecordDto.FiscalRecordDtoBuilder builder = draft.toBuilder();
        boolean income = draft.getKind() == RecordKind.INCOME;

        BigDecimal taxBase = draft.getTaxBase();
        if (taxBase == null && income && (draft.getFees() != null || draft.getTaxableExpenses() != null)) {
            taxBase = AmountUtils.add(draft.getFees(), draft.getTaxableExpenses());
            builder.taxBase(taxBase);
        }
        if (taxBase == null) {
            return builder.build();
        }

        BigDecimal vatAmount = draft.getVatAmount();
        if (vatAmount == null && draft.getVatRate() != null) {
            vatAmount = AmountUtils.percentOf(taxBase, draft.getVatRate());
            builder.vatAmount(vatAmount);
        }

        BigDecimal withholdingAmount = draft.getWithholdingAmount();
        if (withholdingAmount == null && draft.getWithholdingRate() != null) {
            withholdingAmount = AmountUtils.percentOf(taxBase, draft.getWithholdingRate());
            builder.withholdingAmount(withholdingAmount);
        }

        if (draft.getTotalAmount() == null) {
            BigDecimal total = AmountUtils.add(taxBase, vatAmount).subtract(AmountUtils.orZero(withholdingAmount));
            if (income) {
                total = AmountUtils.add(total, draft.getSupplies());
            }
            builder.totalAmount(total);
        }

        return builder.build();
    }

    // ==================== HELPERS ====================

    private FiscalRecordDto prepare(FiscalRecordDto draft) {
        if (draft == null) {
            throw new ValidationException("record", "Record body is required");
        }
        FiscalRecordDto record = deriveAmounts(draft);
        if (record.getCounterpartyTaxId() != null && !record.getCounterpartyTaxId().isBlank()) {
            record = record.toBuilder()
                    .counterpartyTaxId(TaxIdValidator.normalize(record.getCounterpartyTaxId()))
                    .build();
        }
        if (record.getDocumentNumber() != null) {
            record = record.toBuilder().documentNumber(record.getDocumentNumber().trim()).build();
        }
        return record;
    }

    private void enforce(FiscalRecordDto record, IntegrityReport report, boolean confirmAdvisories) {
        if (report.isBlocked()) {
            log.warn("Rejected {} record {}: {} blocking issue(s)", record.getKind(),
                    record.getDocumentNumber(), report.getBlocking().size());
            throw new IntegrityViolationException(report);
        }
        if (report.hasAdvisories() && !confirmAdvisories) {
            log.info("{} record {} needs confirmation of {} advisory issue(s)", record.getKind(),
                    record.getDocumentNumber(), report.getAdvisory().size());
            throw new AdvisoryConfirmationRequiredException(report);
        }
        if (report.hasAdvisories()) {
            log.warn("Saving {} record {} with confirmed advisories: {}", record.getKind(),
                    record.getDocumentNumber(), report.getAdvisory().size());
        }
    }
}
