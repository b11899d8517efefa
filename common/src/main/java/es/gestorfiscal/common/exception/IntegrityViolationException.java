package es.gestorfiscal.common.exception;

import es.gestorfiscal.common.dto.integrity.IntegrityIssue;
import es.gestorfiscal.common.dto.integrity.IntegrityReport;
import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.stream.Collectors;

/**
 * Exception thrown when a record cannot be saved because of blocking integrity issues.
 * Carries the full report so every failing field can be listed.
 */
@Getter
public class IntegrityViolationException extends GestorFiscalException {

    private final IntegrityReport report;

    public IntegrityViolationException(IntegrityReport report) {
        super(
            "Record rejected: " + report.getBlocking().stream()
                    .map(IntegrityIssue::getMessage)
                    .collect(Collectors.joining("; ")),
            HttpStatus.UNPROCESSABLE_ENTITY,
            "GF_ERR_422"
        );
        this.report = report;
    }
}
