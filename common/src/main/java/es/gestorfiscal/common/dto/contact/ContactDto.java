package es.gestorfiscal.common.dto.contact;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Saved client or provider (address book entry).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ContactDto {

    /**
     * Internal id, C-n for clients and P-n for providers. Assigned on save.
     */
    private String internalId;

    @NotBlank(message = "Name is required")
    private String name;

    @NotBlank(message = "Tax ID is required")
    private String taxId;

    private String fiscalAddress;

    @NotNull(message = "Contact type is required")
    private ContactType type;

    private String email;
    private String phone;
    private String contactPerson;
    private String notes;
}
