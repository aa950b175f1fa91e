package fpt.com.clinicbooking.domain.appointment.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import lombok.*;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentServiceLineUpdateDto {

    @Min(value = 1, message = "QUANTITY_MIN")
    private Integer quantity;

    @DecimalMin(value = "0.00", message = "PRICE_NEGATIVE")
    @Digits(integer = 10, fraction = 2, message = "PRICE_FORMAT")
    private BigDecimal unitPrice;
}
