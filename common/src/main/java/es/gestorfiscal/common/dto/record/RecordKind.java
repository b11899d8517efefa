package es.gestorfiscal.common.dto.record;

/**
 * Kind of fiscal record from the professional's perspective.
 *
 * INCOME: issued invoice (counterparty is the client)
 * EXPENSE: received invoice or ticket (counterparty is the supplier)
 */
public enum RecordKind {
    INCOME("A"),
    EXPENSE("R");

    private final String numberPrefix;

    RecordKind(String numberPrefix) {
        this.numberPrefix = numberPrefix;
    }

    /**
     * Letter that opens every document number of this kind (A-25-1, R-25-14).
     */
    public String getNumberPrefix() {
        return numberPrefix;
    }
}
