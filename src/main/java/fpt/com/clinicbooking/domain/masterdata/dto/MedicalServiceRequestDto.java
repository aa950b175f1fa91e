package fpt.com.clinicbooking.domain.masterdata.dto;

import jakarta.validation.constraints.*;
import lombok.*;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MedicalServiceRequestDto {

    @NotBlank(message = "CODE_REQUIRED")
    @Size(max = 30, message = "CODE_SIZE")
    private String code;

    @NotBlank(message = "NAME_REQUIRED")
    @Size(max = 150, message = "NAME_SIZE")
    private String name;

    private String description;

    @DecimalMin(value = "0.00", message = "PRICE_NEGATIVE")
    @Digits(integer = 10, fraction = 2, message = "PRICE_FORMAT")
    private BigDecimal price;

    @Positive(message = "DURATION_POSITIVE")
    private Integer durationMinutes;
}
