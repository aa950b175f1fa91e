package fpt.com.clinicbooking.domain.appointment.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.math.BigDecimal;

/**
 * Service line requested on booking. Without {@code unitPrice} the current catalog price is used.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentServiceLineDto {

    @NotNull(message = "SERVICE_ID_REQUIRED")
    private Integer serviceId;

    @Min(value = 1, message = "QUANTITY_MIN")
    private Integer quantity;

    @DecimalMin(value = "0.00", message = "PRICE_NEGATIVE")
    @Digits(integer = 10, fraction = 2, message = "PRICE_FORMAT")
    private BigDecimal unitPrice;
}
