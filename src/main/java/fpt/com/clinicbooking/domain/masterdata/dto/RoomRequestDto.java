package fpt.com.clinicbooking.domain.masterdata.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoomRequestDto {

    @NotBlank(message = "ROOM_NAME_REQUIRED")
    @Size(max = 50, message = "ROOM_NAME_SIZE")
    private String name;

    @Size(max = 255, message = "DESCRIPTION_SIZE")
    private String description;

    // null keeps the column default of 1
    @Min(value = 1, message = "CAPACITY_MIN")
    private Integer capacity;
}
