package fpt.com.clinicbooking.domain.doctor.dto;

import jakarta.validation.constraints.NotNull;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DoctorUserLinkDto {

    @NotNull(message = "USER_ID_REQUIRED")
    private Integer userId;
}
