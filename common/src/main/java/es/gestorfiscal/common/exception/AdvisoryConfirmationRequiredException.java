package es.gestorfiscal.common.exception;

import es.gestorfiscal.common.dto.integrity.IntegrityIssue;
import es.gestorfiscal.common.dto.integrity.IntegrityReport;
import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.stream.Collectors;

/**
 * Exception thrown when a record has advisory issues and the caller did not confirm them.
 * Resubmitting with confirmation saves the record.
 */
@Getter
public class AdvisoryConfirmationRequiredException extends GestorFiscalException {

    private final IntegrityReport report;

    public AdvisoryConfirmationRequiredException(IntegrityReport report) {
        super(
            "Confirmation required: " + report.getAdvisory().stream()
                    .map(IntegrityIssue::getMessage)
                    .collect(Collectors.joining("; ")),
            HttpStatus.CONFLICT,
            "GF_ERR_409_ADVISORY"
        );
        this.report = report;
    }
}
