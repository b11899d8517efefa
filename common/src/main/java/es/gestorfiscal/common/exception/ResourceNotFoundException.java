package es.gestorfiscal.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a requested resource does not exist.
 */
public class ResourceNotFoundException extends GestorFiscalException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
            String.format("%s not found with identifier: %s", resourceType, identifier),
            HttpStatus.NOT_FOUND,
            "GF_ERR_404"
        );
    }
}
