package fpt.com.clinicbooking.domain.masterdata.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.LocalDateTime;

@Getter
@AllArgsConstructor
public class MedicationDto {
    private Integer id;
    private String name;
    private String manufacturer;
    private String unit;
    private String strength;
    private LocalDateTime createdAt;
}
