package fpt.com.clinicbooking.domain.appointment.dto;

import fpt.com.clinicbooking.domain.appointment.entity.AppointmentStatus;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentStatusUpdateDto {

    @NotNull(message = "STATUS_REQUIRED")
    private AppointmentStatus status;
}
