package es.gestorfiscal.common.infrastructure;

import es.gestorfiscal.common.dto.ApiResponse;
import es.gestorfiscal.common.dto.integrity.IntegrityReport;
import es.gestorfiscal.common.exception.*;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.util.stream.Collectors;

/**
 * Maps exceptions to the {@link ApiResponse} envelope.
 *
 * Integrity failures carry their {@link IntegrityReport} as data, so the caller can
 * list every failing field (422) or ask the user to confirm the advisories (409).
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String BAD_REQUEST_CODE = "GF_ERR_400";

    // ==================== INTEGRITY ====================

    @ExceptionHandler(IntegrityViolationException.class)
    public ResponseEntity<ApiResponse<IntegrityReport>> handleIntegrityViolation(IntegrityViolationException ex) {
        log.warn("Record rejected with {} blocking issue(s)", ex.getReport().getBlocking().size());
        return respond(ex.getStatus(), ApiResponse.error(ex.getMessage(), ex.getErrorCode(), ex.getReport()));
    }

    @ExceptionHandler(AdvisoryConfirmationRequiredException.class)
    public ResponseEntity<ApiResponse<IntegrityReport>> handleAdvisory(AdvisoryConfirmationRequiredException ex) {
        log.info("Advisory confirmation required: {}", ex.getMessage());
        return respond(ex.getStatus(), ApiResponse.error(ex.getMessage(), ex.getErrorCode(), ex.getReport()));
    }

    // ==================== CLIENT ERRORS ====================

    @ExceptionHandler({ResourceNotFoundException.class, ValidationException.class, DuplicateResourceException.class})
    public ResponseEntity<ApiResponse<Void>> handleClientError(GestorFiscalException ex) {
        log.warn("{} ({}): {}", ex.getClass().getSimpleName(), ex.getErrorCode(), ex.getMessage());
        return respond(ex.getStatus(), ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleBeanValidation(MethodArgumentNotValidException ex) {
        String errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        log.warn("Request body rejected: {}", errors);
        return respond(HttpStatus.BAD_REQUEST, ApiResponse.error(errors, BAD_REQUEST_CODE));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String message = String.format("Invalid value '%s' for parameter '%s'", ex.getValue(), ex.getName());
        log.warn(message);
        return respond(HttpStatus.BAD_REQUEST, ApiResponse.error(message, BAD_REQUEST_CODE));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        log.warn("Upload rejected: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ApiResponse.error("Uploaded file is too large", BAD_REQUEST_CODE));
    }

    // ==================== SERVER ERRORS ====================

    @ExceptionHandler(StoreAccessException.class)
    public ResponseEntity<ApiResponse<Void>> handleStoreAccess(StoreAccessException ex) {
        // already logged with its cause by the repository
        return respond(ex.getStatus(), ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(GestorFiscalException.class)
    public ResponseEntity<ApiResponse<Void>> handleGestorFiscalException(GestorFiscalException ex) {
        log.error("Application error ({}): {}", ex.getErrorCode(), ex.getMessage(), ex);
        return respond(ex.getStatus(), ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGeneric(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
                ApiResponse.error("An unexpected error occurred", "GF_ERR_500"));
    }

    // ==================== HELPERS ====================

    /**
     * Null when the response was already committed: a second body cannot be written.
     */
    private <T> ResponseEntity<ApiResponse<T>> respond(HttpStatus status, ApiResponse<T> body) {
        if (isResponseCommitted()) {
            log.warn("Response already committed, dropping error body: {}", body.getMessage());
            return null;
        }
        return ResponseEntity.status(status).body(body);
    }

    private boolean isResponseCommitted() {
        ServletRequestAttributes attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attrs == null) {
            return false;
        }
        HttpServletResponse response = attrs.getResponse();
        return response != null && response.isCommitted();
    }
}
