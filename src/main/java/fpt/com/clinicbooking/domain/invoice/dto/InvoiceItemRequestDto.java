package fpt.com.clinicbooking.domain.invoice.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.math.BigDecimal;

/**
 * Needs a service, a medication or a description. A blank description is filled from
 * the referenced service or medication; a missing price from the service catalog.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceItemRequestDto {

    private Integer serviceId;

    private Integer medicationId;

    @Size(max = 255, message = "DESCRIPTION_SIZE")
    private String description;

    @Min(value = 1, message = "QUANTITY_MIN")
    private Integer quantity;

    @DecimalMin(value = "0.00", message = "PRICE_NEGATIVE")
    @Digits(integer = 10, fraction = 2, message = "PRICE_FORMAT")
    private BigDecimal unitPrice;
}
