package es.gestorfiscal.ledger.controller;

import es.gestorfiscal.common.dto.tax.FiscalSummaryDto;
import es.gestorfiscal.common.dto.tax.Model303Summary;
import es.gestorfiscal.common.exception.ValidationException;
import es.gestorfiscal.common.infrastructure.GlobalExceptionHandler;
import es.gestorfiscal.ledger.service.FiscalAggregationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class TaxModelControllerTest {

    @Mock
    private FiscalAggregationService aggregationService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new TaxModelController(aggregationService), new TaxIdController())
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void getModel303_ShouldReturnQuarterFigures() throws Exception {
        // Arrange
        Model303Summary m303 = new Model303Summary(new BigDecimal("2000"), new BigDecimal("420"),
                new BigDecimal("100"), new BigDecimal("21"), new BigDecimal("399"));
        when(aggregationService.summarize(2025, 1)).thenReturn(FiscalSummaryDto.builder()
                .year(2025).quarter(1).model303(m303).build());

        // Act & Assert
        mockMvc.perform(get("/api/tax-models/2025/303").param("quarter", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.result").value(399));
    }

    @Test
    void getSummary_ShouldRejectInvalidQuarter() throws Exception {
        when(aggregationService.summarize(2025, 7))
                .thenThrow(new ValidationException("quarter", "Quarter must be between 1 and 4, got 7"));

        mockMvc.perform(get("/api/tax-models/2025").param("quarter", "7"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void validateTaxId_ShouldReportExpectedLetter() throws Exception {
        mockMvc.perform(get("/api/tax-ids/12345678A/validation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.type").value("DNI"))
                .andExpect(jsonPath("$.data.status").value("INVALID_CHECKSUM"))
                .andExpect(jsonPath("$.data.expectedLetter").value("Z"));
    }
}
