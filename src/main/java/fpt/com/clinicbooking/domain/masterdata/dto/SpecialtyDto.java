package fpt.com.clinicbooking.domain.masterdata.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SpecialtyDto {
    private Integer id;
    private String name;
    private String description;
}
