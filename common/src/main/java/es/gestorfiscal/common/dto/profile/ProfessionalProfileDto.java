package es.gestorfiscal.common.dto.profile;

import jakarta.validation.constraints.Email;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Holder of the practice: the professional who issues the invoices and files the returns.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProfessionalProfileDto {

    private String name;
    private String nif;

    private String address;
    private String city;
    private String zipCode;
    private String province;

    /** Colegio profesional. */
    private String barAssociation;
    /** Número de colegiado. */
    private String collegiateNumber;

    private String phone;

    @Email(message = "Email is not valid")
    private String email;

    private String website;

    /** Account printed on invoices, stored without spaces. */
    private String iban;
}
