package fpt.com.clinicbooking.domain.masterdata.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Getter
@AllArgsConstructor
public class MedicalServiceDto {
    private Integer id;
    private String code;
    private String name;
    private String description;
    private BigDecimal price;
    private int durationMinutes;
    private LocalDateTime createdAt;
}
