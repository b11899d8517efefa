package es.gestorfiscal.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base exception for all Gestor Fiscal business exceptions.
 */
@Getter
public class GestorFiscalException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public GestorFiscalException(String message) {
        super(message);
        this.status = HttpStatus.INTERNAL_SERVER_ERROR;
        this.errorCode = "GF_ERR_001";
    }

    public GestorFiscalException(String message, HttpStatus status, String errorCode) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public GestorFiscalException(String message, Throwable cause) {
        super(message, cause);
        this.status = HttpStatus.INTERNAL_SERVER_ERROR;
        this.errorCode = "GF_ERR_001";
    }
}
