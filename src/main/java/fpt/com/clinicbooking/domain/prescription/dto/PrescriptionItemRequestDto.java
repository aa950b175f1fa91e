package fpt.com.clinicbooking.domain.prescription.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrescriptionItemRequestDto {

    @NotNull(message = "MEDICATION_ID_REQUIRED")
    private Integer medicationId;

    @NotBlank(message = "DOSAGE_REQUIRED")
    @Size(max = 100, message = "DOSAGE_SIZE")
    private String dosage;

    @NotBlank(message = "FREQUENCY_REQUIRED")
    @Size(max = 100, message = "FREQUENCY_SIZE")
    private String frequency;

    @Positive(message = "DURATION_DAYS_POSITIVE")
    private Integer durationDays;

    private String instructions;
}
