package es.gestorfiscal.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when request input is invalid.
 */
public class ValidationException extends GestorFiscalException {

    public ValidationException(String message) {
        super(message, HttpStatus.BAD_REQUEST, "GF_ERR_400");
    }

    public ValidationException(String field, String message) {
        super(
            String.format("Validation failed for '%s': %s", field, message),
            HttpStatus.BAD_REQUEST,
            "GF_ERR_400"
        );
    }
}
