package fpt.com.clinicbooking.domain.patient.dto;

import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatientDoctorRequestDto {

    @NotNull(message = "DOCTOR_ID_REQUIRED")
    private Integer doctorId;

    private Boolean primary;

    // today when omitted
    private LocalDate assignedDate;
}
