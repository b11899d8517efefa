package es.gestorfiscal.common.dto.integrity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of the pre-save checks.
 *
 * Blocking issues prevent the save. Advisory issues allow it once the user confirms,
 * but stay flagged until corrected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntegrityReport {

    @Builder.Default
    private List<IntegrityIssue> blocking = new ArrayList<>();

    @Builder.Default
    private List<IntegrityIssue> advisory = new ArrayList<>();

    @JsonIgnore
    public boolean isBlocked() {
        return !blocking.isEmpty();
    }

    @JsonIgnore
    public boolean hasAdvisories() {
        return !advisory.isEmpty();
    }

    @JsonIgnore
    public boolean isClean() {
        return blocking.isEmpty() && advisory.isEmpty();
    }
}
