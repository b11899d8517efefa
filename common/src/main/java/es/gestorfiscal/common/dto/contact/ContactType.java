package es.gestorfiscal.common.dto.contact;

/**
 * Role of a saved contact. Clients get internal ids C-n, providers P-n.
 */
public enum ContactType {
    CLIENT("C"),
    PROVIDER("P");

    private final String idPrefix;

    ContactType(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    public String getIdPrefix() {
        return idPrefix;
    }
}
