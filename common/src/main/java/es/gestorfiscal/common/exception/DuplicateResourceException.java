package es.gestorfiscal.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when attempting to create a duplicate resource.
 */
public class DuplicateResourceException extends GestorFiscalException {

    public DuplicateResourceException(String resourceType, String identifier) {
        super(
            String.format("%s already exists with identifier: %s", resourceType, identifier),
            HttpStatus.CONFLICT,
            "GF_ERR_409"
        );
    }
}
