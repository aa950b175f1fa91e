package fpt.com.clinicbooking.domain.appointment.dto;

import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Reschedule request. {@code roomId} null releases the room; {@code doctorId} null keeps the doctor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentUpdateDto {

    private Integer doctorId;

    private Integer roomId;

    @NotNull(message = "SCHEDULED_START_REQUIRED")
    private LocalDateTime scheduledStart;

    @NotNull(message = "SCHEDULED_END_REQUIRED")
    private LocalDateTime scheduledEnd;

    private String reason;
}
