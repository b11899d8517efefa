package es.gestorfiscal.common.dto.tax;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Periodic models (303, 130, 111) for one quarter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuarterlySummaryDto {

    private int quarter;
    private Model303Summary model303;
    private Model130Summary model130;
    private Model111Summary model111;
}
