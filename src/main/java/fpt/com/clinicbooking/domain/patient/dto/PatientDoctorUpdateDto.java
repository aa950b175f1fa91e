package fpt.com.clinicbooking.domain.patient.dto;

import jakarta.validation.constraints.NotNull;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PatientDoctorUpdateDto {

    @NotNull(message = "PRIMARY_REQUIRED")
    private Boolean primary;
}
