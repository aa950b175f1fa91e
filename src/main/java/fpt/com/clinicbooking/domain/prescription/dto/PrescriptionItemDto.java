package fpt.com.clinicbooking.domain.prescription.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class PrescriptionItemDto {
    private Integer id;
    private Integer medicationId;
    private String medicationName;
    private String strength;
    private String dosage;
    private String frequency;
    private Integer durationDays;
    private String instructions;
}
