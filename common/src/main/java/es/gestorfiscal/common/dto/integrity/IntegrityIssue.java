package es.gestorfiscal.common.dto.integrity;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single problem found on a draft record before it is saved.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IntegrityIssue {

    private IssueCode code;
    private String field;
    private String message;
    private Character expectedLetter;   // only for INVALID_CHECKSUM
}
