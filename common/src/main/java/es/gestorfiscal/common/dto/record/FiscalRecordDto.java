package es.gestorfiscal.common.dto.record;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Data Transfer Object for a fiscal record: an issued invoice (INCOME)
 * or a received invoice/ticket (EXPENSE).
 *
 * Derived amounts (vatAmount, withholdingAmount, totalAmount) are stored as given
 * and are never recomputed by the tax model aggregation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FiscalRecordDto {

    private String id;
    private RecordKind kind;
    private String documentNumber;      // A-25-1 (income) or internal R-25-1 (expense)

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate issueDate;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate registrationDate; // EXPENSE only, accounting entry date

    private String supplierInvoiceNumber; // EXPENSE only
    private String concept;

    private String counterpartyTaxId;
    private String counterpartyName;
    private String counterpartyAddress;

    // Income breakdown of the base
    private BigDecimal fees;
    private BigDecimal taxableExpenses;
    private BigDecimal supplies;        // suplidos, outside the taxable base
    private BigDecimal retainer;        // provision of funds already received

    private BigDecimal taxBase;
    private BigDecimal vatRate;
    private BigDecimal vatAmount;
    private BigDecimal withholdingRate;
    private BigDecimal withholdingAmount;
    private BigDecimal totalAmount;

    private Boolean deductible;         // EXPENSE only
    private String category;

    private String incomeTaxCategory;   // INCOME, e.g. "Prestación de servicios"
    private String expenseIrpfCategory; // EXPENSE, e.g. "Arrendamientos"
    private String expenseVatCategory;  // EXPENSE, e.g. "Bien de inversión"

    /**
     * Deductible expenses are the only expenses the tax models count.
     */
    @JsonIgnore
    public boolean isCountedExpense() {
        return kind == RecordKind.EXPENSE && Boolean.TRUE.equals(deductible);
    }

    /**
     * Amount still to be collected once the retainer is discounted.
     */
    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    public BigDecimal getAmountToPay() {
        if (totalAmount == null) {
            return null;
        }
        return retainer == null ? totalAmount : totalAmount.subtract(retainer);
    }
}
