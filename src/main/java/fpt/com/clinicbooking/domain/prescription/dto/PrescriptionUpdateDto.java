package fpt.com.clinicbooking.domain.prescription.dto;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PrescriptionUpdateDto {
    private String notes;
}
