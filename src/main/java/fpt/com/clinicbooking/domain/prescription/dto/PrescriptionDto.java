package fpt.com.clinicbooking.domain.prescription.dto;

import lombok.*;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrescriptionDto {
    private Integer id;
    private Integer appointmentId;
    private Integer patientId;
    private Integer prescribedById;
    private String prescribedByName;
    private String notes;
    private List<PrescriptionItemDto> items;
    private LocalDateTime createdAt;
}
