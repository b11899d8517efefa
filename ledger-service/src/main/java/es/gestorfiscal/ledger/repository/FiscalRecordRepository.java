package es.gestorfiscal.ledger.repository;

import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.WriteBatch;
import es.gestorfiscal.common.dto.record.FiscalRecordDto;
import es.gestorfiscal.common.dto.record.RecordKind;
import es.gestorfiscal.common.exception.StoreAccessException;
import es.gestorfiscal.common.util.AmountUtils;
import es.gestorfiscal.common.util.DateUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.*;
import java.util.concurrent.ExecutionException;

/**
 * Repository for fiscal records stored in Firebase.
 *
 * Data access only - NO business logic here.
 *
 * Structure in Firebase:
 * fiscalRecords/{id}: {
 *   "kind": "INCOME",
 *   "documentNumber": "A-25-1",
 *   "issueDate": "2025-01-15",
 *   "taxBase": "1000.00",       // amounts stored as strings, full precision
 *   ...
 * }
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class FiscalRecordRepository implements FiscalRecordStore {

    private static final String COLLECTION = "fiscalRecords";
    private static final int MAX_BATCH_WRITES = 500;

    private final Firestore firestore;

    @Override
    public List<FiscalRecordDto> listAll() {
        try {
            List<FiscalRecordDto> records = new ArrayList<>();
            for (QueryDocumentSnapshot document : firestore.collection(COLLECTION).get().get().getDocuments()) {
                records.add(documentToRecord(document));
            }
            log.debug("Loaded {} fiscal records", records.size());
            return records;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("load fiscal records", e);
        } catch (ExecutionException e) {
            throw failure("load fiscal records", e);
        }
    }

    @Override
    public Optional<FiscalRecordDto> findById(String id) {
        try {
            DocumentSnapshot document = firestore.collection(COLLECTION).document(id).get().get();
            if (!document.exists()) {
                return Optional.empty();
            }
            return Optional.of(documentToRecord(document));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("load fiscal record " + id, e);
        } catch (ExecutionException e) {
            throw failure("load fiscal record " + id, e);
        }
    }

    @Override
    public FiscalRecordDto insert(FiscalRecordDto record) {
        String id = record.getId() != null ? record.getId() : UUID.randomUUID().toString();
        FiscalRecordDto stored = record.toBuilder().id(id).build();
        write(id, stored, "insert");
        return stored;
    }

    @Override
    public FiscalRecordDto replace(String id, FiscalRecordDto record) {
        FiscalRecordDto stored = record.toBuilder().id(id).build();
        write(id, stored, "replace");
        return stored;
    }

    @Override
    public void delete(String id) {
        try {
            firestore.collection(COLLECTION).document(id).delete().get();
            log.info("Deleted fiscal record: {}", id);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("delete fiscal record " + id, e);
        } catch (ExecutionException e) {
            throw failure("delete fiscal record " + id, e);
        }
    }

    @Override
    public int deleteMany(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }

        List<String> pending = new ArrayList<>(new LinkedHashSet<>(ids));
        try {
            for (int from = 0; from < pending.size(); from += MAX_BATCH_WRITES) {
                List<String> chunk = pending.subList(from, Math.min(from + MAX_BATCH_WRITES, pending.size()));
                WriteBatch batch = firestore.batch();
                for (String id : chunk) {
                    batch.delete(firestore.collection(COLLECTION).document(id));
                }
                batch.commit().get();
                log.debug("Batch deleted {} fiscal records", chunk.size());
            }
            log.info("Deleted {} fiscal records", pending.size());
            return pending.size();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("batch delete fiscal records", e);
        } catch (ExecutionException e) {
            throw failure("batch delete fiscal records", e);
        }
    }

    // ==================== MAPPING ====================

    private void write(String id, FiscalRecordDto record, String operation) {
        try {
            Map<String, Object> data = recordToMap(record);
            data.put("updatedAt", com.google.cloud.Timestamp.now());
            firestore.collection(COLLECTION).document(id).set(data).get();
            log.debug("Fiscal record {} ({}): {}", operation, record.getDocumentNumber(), id);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure(operation + " fiscal record " + id, e);
        } catch (ExecutionException e) {
            throw failure(operation + " fiscal record " + id, e);
        }
    }

    private StoreAccessException failure(String action, Exception e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        log.error("Failed to {}: {}", action, root.getMessage(), e);
        return new StoreAccessException("Failed to " + action + ": " + root.getMessage(), e);
    }

    private FiscalRecordDto documentToRecord(DocumentSnapshot doc) {
        return FiscalRecordDto.builder()
                .id(doc.getId())
                .kind(parseKind(doc.getString("kind")))
                .documentNumber(doc.getString("documentNumber"))
                .issueDate(DateUtils.parseIsoDate(doc.getString("issueDate")))
                .registrationDate(DateUtils.parseIsoDate(doc.getString("registrationDate")))
                .supplierInvoiceNumber(doc.getString("supplierInvoiceNumber"))
                .concept(doc.getString("concept"))
                .counterpartyTaxId(doc.getString("counterpartyTaxId"))
                .counterpartyName(doc.getString("counterpartyName"))
                .counterpartyAddress(doc.getString("counterpartyAddress"))
                .fees(amount(doc, "fees"))
                .taxableExpenses(amount(doc, "taxableExpenses"))
                .supplies(amount(doc, "supplies"))
                .retainer(amount(doc, "retainer"))
                .taxBase(amount(doc, "taxBase"))
                .vatRate(amount(doc, "vatRate"))
                .vatAmount(amount(doc, "vatAmount"))
                .withholdingRate(amount(doc, "withholdingRate"))
                .withholdingAmount(amount(doc, "withholdingAmount"))
                .totalAmount(amount(doc, "totalAmount"))
                .deductible(doc.getBoolean("deductible"))
                .category(doc.getString("category"))
                .incomeTaxCategory(doc.getString("incomeTaxCategory"))
                .expenseIrpfCategory(doc.getString("expenseIrpfCategory"))
                .expenseVatCategory(doc.getString("expenseVatCategory"))
                .build();
    }

    private Map<String, Object> recordToMap(FiscalRecordDto record) {
        Map<String, Object> data = new HashMap<>();
        data.put("kind", record.getKind() != null ? record.getKind().name() : null);
        data.put("documentNumber", record.getDocumentNumber());
        data.put("issueDate", DateUtils.formatDate(record.getIssueDate()));
        data.put("registrationDate", DateUtils.formatDate(record.getRegistrationDate()));
        data.put("supplierInvoiceNumber", record.getSupplierInvoiceNumber());
        data.put("concept", record.getConcept());
        data.put("counterpartyTaxId", record.getCounterpartyTaxId());
        data.put("counterpartyName", record.getCounterpartyName());
        data.put("counterpartyAddress", record.getCounterpartyAddress());
        data.put("fees", toStored(record.getFees()));
        data.put("taxableExpenses", toStored(record.getTaxableExpenses()));
        data.put("supplies", toStored(record.getSupplies()));
        data.put("retainer", toStored(record.getRetainer()));
        data.put("taxBase", toStored(record.getTaxBase()));
        data.put("vatRate", toStored(record.getVatRate()));
        data.put("vatAmount", toStored(record.getVatAmount()));
        data.put("withholdingRate", toStored(record.getWithholdingRate()));
        data.put("withholdingAmount", toStored(record.getWithholdingAmount()));
        data.put("totalAmount", toStored(record.getTotalAmount()));
        data.put("deductible", record.getDeductible());
        data.put("category", record.getCategory());
        data.put("incomeTaxCategory", record.getIncomeTaxCategory());
        data.put("expenseIrpfCategory", record.getExpenseIrpfCategory());
        data.put("expenseVatCategory", record.getExpenseVatCategory());
        return data;
    }

    // Older documents may hold plain numbers instead of strings
    private BigDecimal amount(DocumentSnapshot doc, String field) {
        return AmountUtils.toDecimal(doc.get(field));
    }

    private String toStored(BigDecimal amount) {
        return amount == null ? null : amount.toPlainString();
    }

    private RecordKind parseKind(String value) {
        if (value == null) {
            return null;
        }
        try {
            return RecordKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown record kind '{}' in stored document", value);
            return null;
        }
    }
}
