package es.gestorfiscal.ledger.controller;

import es.gestorfiscal.common.dto.integrity.IntegrityIssue;
import es.gestorfiscal.common.dto.integrity.IntegrityReport;
import es.gestorfiscal.common.dto.integrity.IssueCode;
import es.gestorfiscal.common.dto.record.FiscalRecordDto;
import es.gestorfiscal.common.dto.record.RecordKind;
import es.gestorfiscal.common.exception.AdvisoryConfirmationRequiredException;
import es.gestorfiscal.common.exception.IntegrityViolationException;
import es.gestorfiscal.common.exception.ResourceNotFoundException;
import es.gestorfiscal.common.infrastructure.GlobalExceptionHandler;
import es.gestorfiscal.ledger.service.DocumentNumberService;
import es.gestorfiscal.ledger.service.FiscalRecordService;
import es.gestorfiscal.ledger.service.RecordImportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class FiscalRecordControllerTest {

    private static final String INCOME_JSON = """
            {
              "kind": "INCOME",
              "documentNumber": "A-25-1",
              "issueDate": "2025-01-15",
              "counterpartyTaxId": "12345678Z",
              "counterpartyName": "Ana García",
              "taxBase": 1000,
              "vatRate": 21
            }
            """;

    @Mock
    private FiscalRecordService fiscalRecordService;

    @Mock
    private DocumentNumberService documentNumberService;

    @Mock
    private RecordImportService recordImportService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        FiscalRecordController controller =
                new FiscalRecordController(fiscalRecordService, documentNumberService, recordImportService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void createRecord_ShouldReturnCreatedRecord() throws Exception {
        // Arrange
        when(fiscalRecordService.create(any(), eq(false))).thenReturn(FiscalRecordDto.builder()
                .id("r1")
                .kind(RecordKind.INCOME)
                .documentNumber("A-25-1")
                .issueDate(LocalDate.of(2025, 1, 15))
                .totalAmount(new BigDecimal("1210"))
                .retainer(new BigDecimal("200"))
                .build());

        // Act & Assert
        mockMvc.perform(post("/api/records").contentType(MediaType.APPLICATION_JSON).content(INCOME_JSON))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.id").value("r1"))
                .andExpect(jsonPath("$.data.issueDate").value("2025-01-15"))
                .andExpect(jsonPath("$.data.amountToPay").value(1010));
    }

    @Test
    void createRecord_ShouldReturnEveryBlockingIssue() throws Exception {
        // Arrange
        IntegrityReport report = IntegrityReport.builder()
                .blocking(List.of(
                        IntegrityIssue.builder().code(IssueCode.DUPLICATE_DOCUMENT_NUMBER).field("documentNumber")
                                .message("El número A-25-1 ya existe").build(),
                        IntegrityIssue.builder().code(IssueCode.MISSING_REQUIRED_FIELD).field("issueDate")
                                .message("Campo obligatorio: issueDate").build()))
                .build();
        when(fiscalRecordService.create(any(), eq(false))).thenThrow(new IntegrityViolationException(report));

        // Act & Assert
        mockMvc.perform(post("/api/records").contentType(MediaType.APPLICATION_JSON).content(INCOME_JSON))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorCode").value("GF_ERR_422"))
                .andExpect(jsonPath("$.data.blocking.length()").value(2))
                .andExpect(jsonPath("$.data.blocking[0].code").value("DUPLICATE_DOCUMENT_NUMBER"));
    }

    @Test
    void createRecord_ShouldAskForAdvisoryConfirmation() throws Exception {
        // Arrange
        IntegrityReport report = IntegrityReport.builder()
                .advisory(List.of(IntegrityIssue.builder().code(IssueCode.INVALID_CHECKSUM)
                        .field("counterpartyTaxId").expectedLetter('Z')
                        .message("DNI incorrecto: la letra debería ser Z").build()))
                .build();
        when(fiscalRecordService.create(any(), eq(false))).thenThrow(new AdvisoryConfirmationRequiredException(report));

        // Act & Assert
        mockMvc.perform(post("/api/records").contentType(MediaType.APPLICATION_JSON).content(INCOME_JSON))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("GF_ERR_409_ADVISORY"))
                .andExpect(jsonPath("$.data.advisory[0].expectedLetter").value("Z"));
    }

    @Test
    void createRecord_ShouldPassConfirmationFlag() throws Exception {
        when(fiscalRecordService.create(any(), eq(true))).thenReturn(FiscalRecordDto.builder().id("r2").build());

        mockMvc.perform(post("/api/records").param("confirmAdvisories", "true")
                        .contentType(MediaType.APPLICATION_JSON).content(INCOME_JSON))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.id").value("r2"));
    }

    @Test
    void nextNumber_ShouldReturnSuggestion() throws Exception {
        when(documentNumberService.suggestNext(RecordKind.INCOME, 2025)).thenReturn("A-25-3");

        mockMvc.perform(get("/api/records/next-number").param("kind", "INCOME").param("year", "2025"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value("A-25-3"));
    }

    @Test
    void listRecords_ShouldRejectUnknownKind() throws Exception {
        mockMvc.perform(get("/api/records").param("kind", "INVOICE"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("GF_ERR_400"));
    }

    @Test
    void getRecord_ShouldReturnNotFound() throws Exception {
        when(fiscalRecordService.get("missing")).thenThrow(new ResourceNotFoundException("FiscalRecord", "missing"));

        mockMvc.perform(get("/api/records/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("GF_ERR_404"));
    }

    @Test
    void bulkDelete_ShouldReturnDeletedCount() throws Exception {
        when(fiscalRecordService.deleteMany(List.of("a", "b"))).thenReturn(2);

        mockMvc.perform(post("/api/records/bulk-delete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ids\": [\"a\", \"b\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.deleted").value(2));

        verify(fiscalRecordService).deleteMany(List.of("a", "b"));
    }
}
