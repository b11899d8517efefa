package es.gestorfiscal.ledger.repository;

import es.gestorfiscal.common.dto.record.FiscalRecordDto;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable store of fiscal records.
 *
 * Every call is synchronous and atomic from the caller's point of view. The store assumes a
 * single writer: concurrent read-check-write sequences from several sessions are not guarded.
 */
public interface FiscalRecordStore {

    /**
     * Full snapshot of every stored record.
     */
    List<FiscalRecordDto> listAll();

    Optional<FiscalRecordDto> findById(String id);

    FiscalRecordDto insert(FiscalRecordDto record);

    FiscalRecordDto replace(String id, FiscalRecordDto record);

    void delete(String id);

    /**
     * @return number of ids submitted for deletion
     */
    int deleteMany(Collection<String> ids);
}
