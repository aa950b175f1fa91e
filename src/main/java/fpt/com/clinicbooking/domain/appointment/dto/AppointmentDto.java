package fpt.com.clinicbooking.domain.appointment.dto;

import fpt.com.clinicbooking.domain.appointment.entity.AppointmentStatus;
import fpt.com.clinicbooking.domain.user.dto.UserSummaryDto;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentDto {
    private Integer id;
    private Integer patientId;
    private String patientName;
    private Integer doctorId;
    private String doctorName;
    private Integer roomId;
    private String roomName;
    private LocalDateTime scheduledStart;
    private LocalDateTime scheduledEnd;
    private AppointmentStatus status;
    private String reason;
    private UserSummaryDto createdBy;
    private List<AppointmentServiceItemDto> services;
    private BigDecimal servicesTotal;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
