package es.gestorfiscal.common.dto.taxid;

public enum TaxIdStatus {
    VALID,
    INVALID_CHECKSUM,
    UNRECOGNIZED_FORMAT
}
