package es.gestorfiscal.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when the record store (Firestore) fails a read or a write.
 */
public class StoreAccessException extends GestorFiscalException {

    public StoreAccessException(String message, Throwable cause) {
        super(message, HttpStatus.SERVICE_UNAVAILABLE, "GF_ERR_503");
        if (cause != null) {
            initCause(cause);
        }
    }
}
