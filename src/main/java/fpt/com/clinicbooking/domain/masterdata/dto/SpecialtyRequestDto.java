package fpt.com.clinicbooking.domain.masterdata.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpecialtyRequestDto {

    @NotBlank(message = "NAME_REQUIRED")
    @Size(max = 100, message = "NAME_SIZE")
    private String name;

    private String description;
}
