package es.gestorfiscal.common.dto.integrity;

public enum IssueCode {
    DUPLICATE_DOCUMENT_NUMBER,
    MISSING_REQUIRED_FIELD,
    INVALID_CHECKSUM,
    UNRECOGNIZED_FORMAT
}
