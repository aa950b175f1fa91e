package fpt.com.clinicbooking.domain.masterdata.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MedicationRequestDto {

    @NotBlank(message = "NAME_REQUIRED")
    @Size(max = 200, message = "NAME_SIZE")
    private String name;

    @Size(max = 200, message = "MANUFACTURER_SIZE")
    private String manufacturer;

    @Size(max = 50, message = "UNIT_SIZE")
    private String unit;

    @Size(max = 100, message = "STRENGTH_SIZE")
    private String strength;
}
