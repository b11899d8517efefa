package es.gestorfiscal.common.dto.taxid;

/**
 * Spanish tax identifier shapes.
 *
 * DNI: natural person, 8 digits + check letter
 * NIE: foreign resident, X/Y/Z + 7 digits + check letter
 * CIF: company, letter + 7 digits + control character
 */
public enum TaxIdType {
    DNI,
    NIE,
    CIF,
    UNKNOWN
}
