package fpt.com.clinicbooking.domain.prescription.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrescriptionCreateDto {

    @NotNull(message = "APPOINTMENT_ID_REQUIRED")
    private Integer appointmentId;

    // defaults to the appointment's doctor
    private Integer prescribedById;

    private String notes;

    @Valid
    @Builder.Default
    private List<PrescriptionItemRequestDto> items = new ArrayList<>();
}
