package fpt.com.clinicbooking.domain.appointment.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentCreateDto {

    @NotNull(message = "PATIENT_ID_REQUIRED")
    private Integer patientId;

    @NotNull(message = "DOCTOR_ID_REQUIRED")
    private Integer doctorId;

    private Integer roomId;

    // booking user, if known
    private Integer createdById;

    @NotNull(message = "SCHEDULED_START_REQUIRED")
    private LocalDateTime scheduledStart;

    @NotNull(message = "SCHEDULED_END_REQUIRED")
    private LocalDateTime scheduledEnd;

    private String reason;

    @Valid
    @Builder.Default
    private List<AppointmentServiceLineDto> services = new ArrayList<>();
}
